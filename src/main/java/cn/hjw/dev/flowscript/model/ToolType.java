package cn.hjw.dev.flowscript.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 工具类型 (封闭枚举)
 * 新增工具类型 = 新增一个常量 + 对应的 ToolGenerator
 */
@Getter
@RequiredArgsConstructor
public enum ToolType {

    // --- 输入/输出 ---
    INPUT_DATA("Input Data", false),
    OUTPUT_DATA("Output Data", false),
    TEXT_INPUT("Text Input", false),
    BROWSE("Browse", false),

    // --- 准备 ---
    SELECT("Select", false),
    FILTER("Filter", false),
    FORMULA("Formula", false),
    MULTI_FIELD_FORMULA("Multi-Field Formula", false),
    SAMPLE("Sample", false),
    RECORD_ID("Record ID", false),
    UNIQUE("Unique", false),
    SORT("Sort", false),

    // --- 连接 ---
    JOIN("Join", false),
    UNION("Union", false),
    APPEND_FIELDS("Append Fields", false),

    // --- 解析/变换 ---
    TEXT_TO_COLUMNS("Text To Columns", false),
    SUMMARIZE("Summarize", false),
    CROSS_TAB("Cross Tab", false),
    TRANSPOSE("Transpose", false),

    // --- 文档类, 不产生数据 ---
    COMMENT("Comment", true),
    CONTAINER("Tool Container", true),

    UNSUPPORTED("Unsupported", false);

    private final String displayName;

    // 纯文档工具: 不绑定输出变量
    private final boolean documentation;
}

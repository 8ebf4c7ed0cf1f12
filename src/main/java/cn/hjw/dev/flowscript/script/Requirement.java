package cn.hjw.dev.flowscript.script;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 生成脚本的前导项 (import 或辅助函数)
 * 装配器只输出实际用到的项, 按枚举声明顺序排列
 */
@Getter
@RequiredArgsConstructor
public enum Requirement {

    NUMPY(List.of("import numpy as np"), false),
    PANDAS(List.of("import pandas as pd"), false),

    // 未能翻译的表达式占位: 运行到此处即失败, 绝不静默近似
    UNIMPLEMENTED_HELPER(List.of(
            "def unimplemented(source, *args):",
            "    raise NotImplementedError('Manual translation required: ' + source)"), true);

    private final List<String> lines;

    // true: 函数定义, 放在 import 之后
    private final boolean helper;
}

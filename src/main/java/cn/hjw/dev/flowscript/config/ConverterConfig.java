package cn.hjw.dev.flowscript.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * 转换器配置
 * 构造后只读使用, 多个转换可并发共享同一实例
 */
@AllArgsConstructor
@Builder
@Data
public class ConverterConfig {

    // 输出变量前缀, 变量名 = 前缀 + 工具ID
    @Builder.Default
    private String variablePrefix = "df_";

    // 生成脚本的缩进
    @Builder.Default
    private String indent = "    ";

    // 顶层例程名
    @Builder.Default
    private String entryPoint = "main";

    // 每个数据语句后打印行数
    @Builder.Default
    private boolean traceRowCounts = false;

    // 文档结构契约
    @Builder.Default
    private DocumentSchema schema = DocumentSchema.DEFAULT;

    // 工具类型查找表 (classpath 资源)
    @Builder.Default
    private String toolTypeTable = "flowscript/tool-types.properties";

    public static ConverterConfig defaults() {
        return ConverterConfig.builder().build();
    }
}

package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 有向连线: 源工具的某个输出锚点 -> 目标工具的某个输入锚点
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(exclude = "order")
public class Connection {

    public static final String DEFAULT_OUTPUT = "Output";
    public static final String DEFAULT_INPUT = "Input";

    private final ToolId source;
    private final String sourceAnchor;
    private final ToolId destination;
    private final String destinationAnchor;

    // 文档中的出现顺序, 用于多输入工具的稳定排序
    private final int order;

    public static Connection of(long source, long destination) {
        return new Connection(ToolId.of(source), DEFAULT_OUTPUT, ToolId.of(destination), DEFAULT_INPUT, 0);
    }

    @Override
    public String toString() {
        return source + "." + sourceAnchor + " -> " + destination + "." + destinationAnchor;
    }
}

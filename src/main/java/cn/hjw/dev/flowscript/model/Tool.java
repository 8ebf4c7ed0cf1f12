package cn.hjw.dev.flowscript.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * 工作流中的一个处理节点
 * 配置只保存原始键值, 语义由代码生成阶段解释
 */
@Getter
@Builder
public class Tool {

    @NonNull
    private final ToolId id;

    @NonNull
    private final ToolType type;

    // 文档中的原始类型串, UNSUPPORTED 时据此提示人工实现
    @NonNull
    private final String rawType;

    @NonNull
    @Builder.Default
    private final ConfigMap configuration = ConfigMap.EMPTY;

    @NonNull
    @Builder.Default
    private final Position position = Position.ORIGIN;

    // 用户在画布上给工具起的名字, 可能为 null
    private final String annotation;

    @Override
    public String toString() {
        return type.getDisplayName() + "#" + id;
    }
}

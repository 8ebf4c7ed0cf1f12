package cn.hjw.dev.flowscript.config;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 文档结构契约: 元素名/属性名查找表
 * 与工作流设计器的版本化格式对应, 解析器只通过这里取名字, 不硬编码
 * 所有名称按本地名匹配, 忽略命名空间前缀
 */
@Getter
@Builder
public class DocumentSchema {

    public static final DocumentSchema DEFAULT = DocumentSchema.builder().build();

    // --- 工具节点 ---
    @Builder.Default
    private String nodeElement = "Node";

    @Builder.Default
    private String toolIdAttribute = "ToolID";

    // 容器工具内嵌子节点的元素
    @Builder.Default
    private String childNodesElement = "ChildNodes";

    @Builder.Default
    private String propertiesElement = "Properties";

    @Builder.Default
    private String configurationElement = "Configuration";

    // --- 类型识别 (按顺序取第一个非空值) ---
    @Builder.Default
    private String guiSettingsElement = "GuiSettings";

    @Builder.Default
    private String pluginAttribute = "Plugin";

    @Builder.Default
    private String engineSettingsElement = "EngineSettings";

    @Builder.Default
    private String entryPointAttribute = "EngineDllEntryPoint";

    @Builder.Default
    private String macroAttribute = "Macro";

    // --- 位置与注释 ---
    @Builder.Default
    private String positionElement = "Position";

    @Builder.Default
    private String annotationElement = "Annotation";

    @Builder.Default
    private List<String> annotationTextElements = List.of("Name", "DefaultAnnotationText");

    // --- 连线 ---
    @Builder.Default
    private String connectionElement = "Connection";

    @Builder.Default
    private String originElement = "Origin";

    @Builder.Default
    private String destinationElement = "Destination";

    @Builder.Default
    private String endpointToolIdAttribute = "ToolID";

    @Builder.Default
    private String anchorAttribute = "Connection";

    // --- 文档元信息 ---
    @Builder.Default
    private String versionAttribute = "yxmdVer";

    @Builder.Default
    private String metaInfoElement = "MetaInfo";
}

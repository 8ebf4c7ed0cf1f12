package cn.hjw.dev.flowscript.parse;

import cn.hjw.dev.flowscript.config.DocumentSchema;
import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.diagnostic.Stage;
import cn.hjw.dev.flowscript.exception.DocumentParseException;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.ConfigValue;
import cn.hjw.dev.flowscript.model.Connection;
import cn.hjw.dev.flowscript.model.Position;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.ToolType;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import cn.hjw.dev.flowscript.model.WorkflowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 文档解析器: 文档文本 -> 工作流图 + 警告列表
 * <p>
 * 只按元素本地名做结构化定位, 不假设命名空间前缀;
 * 配置按原始键值捕获, 不解释任何工具语义.
 * 可恢复的问题只记警告, 仅在文档无法提取任何工具时抛出 {@link DocumentParseException}.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowDocumentParser {

    private final DocumentSchema schema;
    private final ToolTypeRegistry registry;

    public ParsedWorkflow parse(String document) {
        if (StringUtils.isBlank(document)) {
            throw new DocumentParseException("Workflow document is empty");
        }
        Element root = buildDocument(document).getDocumentElement();

        Diagnostics diagnostics = new Diagnostics();
        WorkflowGraph graph = new WorkflowGraph();
        graph.setMetadata(readMetadata(root));

        // 1. 工具节点
        int[] nodeCount = {0};
        visitToolNodes(root, node -> {
            nodeCount[0]++;
            readTool(node, graph, diagnostics);
        });
        if (nodeCount[0] == 0) {
            throw new DocumentParseException("Workflow document contains no <" + schema.getNodeElement() + "> tool nodes");
        }
        if (graph.size() == 0) {
            throw new DocumentParseException("None of the " + nodeCount[0] + " tool nodes could be extracted");
        }

        // 2. 连线
        List<Element> connectionElements = new ArrayList<>();
        collectDescendants(root, schema.getConnectionElement(), connectionElements);
        Set<Connection> seen = new HashSet<>();
        int order = 0;
        for (Element element : connectionElements) {
            Element origin = firstChild(element, schema.getOriginElement());
            Element destination = firstChild(element, schema.getDestinationElement());
            if (origin == null || destination == null) {
                // 同名但不是连线结构 (例如某工具配置里的 Connection 字段)
                continue;
            }
            Connection connection = new Connection(
                    endpointId(origin), anchor(origin, Connection.DEFAULT_OUTPUT),
                    endpointId(destination), anchor(destination, Connection.DEFAULT_INPUT),
                    order);
            if (!seen.add(connection)) {
                diagnostics.warn(Stage.PARSE, connection.getDestination(), "Ignored duplicate connection " + connection);
                continue;
            }
            graph.addConnection(connection);
            order++;
        }

        log.debug("Parsed workflow: {} tools, {} connections, {} warnings",
                graph.size(), graph.getConnections().size(), diagnostics.size());
        return new ParsedWorkflow(graph, diagnostics);
    }

    // ------------------------------------------------------------------
    // 工具节点
    // ------------------------------------------------------------------

    private void readTool(Element node, WorkflowGraph graph, Diagnostics diagnostics) {
        String rawId = attribute(node, schema.getToolIdAttribute());
        if (StringUtils.isBlank(rawId)) {
            diagnostics.warn(Stage.PARSE, "Skipped <" + localName(node) + "> without "
                    + schema.getToolIdAttribute() + " attribute");
            return;
        }
        ToolId id = ToolId.of(rawId);
        if (graph.containsTool(id)) {
            diagnostics.warn(Stage.PARSE, id, "Skipped duplicate tool node with id " + id);
            return;
        }

        String rawType = resolveRawType(node);
        ToolType type = registry.lookup(rawType).orElse(null);
        if (type == null) {
            type = ToolType.UNSUPPORTED;
            diagnostics.warn(Stage.PARSE, id, rawType.isEmpty()
                    ? "Tool has no type information; emitted as a pass-through stub"
                    : "Unrecognized tool type '" + rawType + "'; emitted as a pass-through stub");
        }

        Element properties = firstChild(node, schema.getPropertiesElement());
        Element configuration = properties == null ? null : firstChild(properties, schema.getConfigurationElement());

        graph.addTool(Tool.builder()
                .id(id)
                .type(type)
                .rawType(rawType)
                .configuration(configuration == null ? ConfigMap.EMPTY : readMap(configuration))
                .position(readPosition(node))
                .annotation(readAnnotation(properties))
                .build());
    }

    /**
     * 依次取 GuiSettings@Plugin, EngineSettings@EngineDllEntryPoint, "macro:" + EngineSettings@Macro
     */
    private String resolveRawType(Element node) {
        Element gui = firstChild(node, schema.getGuiSettingsElement());
        String plugin = gui == null ? null : attribute(gui, schema.getPluginAttribute());
        if (StringUtils.isNotBlank(plugin)) {
            return plugin.trim();
        }
        Element engine = firstChild(node, schema.getEngineSettingsElement());
        if (engine != null) {
            String entryPoint = attribute(engine, schema.getEntryPointAttribute());
            if (StringUtils.isNotBlank(entryPoint)) {
                return entryPoint.trim();
            }
            String macro = attribute(engine, schema.getMacroAttribute());
            if (StringUtils.isNotBlank(macro)) {
                return "macro:" + macro.trim();
            }
        }
        return "";
    }

    private Position readPosition(Element node) {
        Element gui = firstChild(node, schema.getGuiSettingsElement());
        Element position = gui == null ? null : firstChild(gui, schema.getPositionElement());
        if (position == null) {
            return Position.ORIGIN;
        }
        return new Position(NumberUtils.toDouble(attribute(position, "x")), NumberUtils.toDouble(attribute(position, "y")));
    }

    private String readAnnotation(Element properties) {
        Element annotation = properties == null ? null : firstChild(properties, schema.getAnnotationElement());
        if (annotation == null) {
            return null;
        }
        for (String name : schema.getAnnotationTextElements()) {
            Element text = firstChild(annotation, name);
            if (text != null && StringUtils.isNotBlank(text.getTextContent())) {
                return text.getTextContent().trim();
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // 配置: 原样捕获为 ConfigValue
    // ------------------------------------------------------------------

    private ConfigValue readValue(Element element) {
        if (!element.hasAttributes() && !hasElementChildren(element)) {
            return ConfigValue.scalar(StringUtils.trimToEmpty(ownText(element)));
        }
        return readMap(element);
    }

    private ConfigMap readMap(Element element) {
        ConfigMap.Builder builder = ConfigMap.builder();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (isNamespaceDeclaration(attr)) {
                continue;
            }
            builder.put(localName(attr), ConfigValue.scalar(attr.getValue()));
        }
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                builder.put(localName(child), readValue((Element) child));
            }
        }
        String text = StringUtils.trimToEmpty(ownText(element));
        if (!text.isEmpty()) {
            builder.put(ConfigMap.TEXT_KEY, ConfigValue.scalar(text));
        }
        return builder.build();
    }

    // ------------------------------------------------------------------
    // 连线
    // ------------------------------------------------------------------

    private ToolId endpointId(Element endpoint) {
        String id = attribute(endpoint, schema.getEndpointToolIdAttribute());
        if (StringUtils.isBlank(id)) {
            id = ownText(endpoint);
        }
        return ToolId.of(StringUtils.trimToEmpty(id));
    }

    private String anchor(Element endpoint, String defaultAnchor) {
        return StringUtils.defaultIfBlank(attribute(endpoint, schema.getAnchorAttribute()), defaultAnchor).trim();
    }

    // ------------------------------------------------------------------
    // 元信息
    // ------------------------------------------------------------------

    private WorkflowMetadata readMetadata(Element root) {
        Element properties = firstChild(root, schema.getPropertiesElement());
        Element meta = properties == null ? null : firstChild(properties, schema.getMetaInfoElement());
        return WorkflowMetadata.builder()
                .version(StringUtils.trimToNull(attribute(root, schema.getVersionAttribute())))
                .name(childText(meta, "Name"))
                .author(childText(meta, "Author"))
                .description(childText(meta, "Description"))
                .build();
    }

    // ------------------------------------------------------------------
    // DOM 工具方法
    // ------------------------------------------------------------------

    private Document buildDocument(String document) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(document)));
        } catch (SAXException e) {
            throw new DocumentParseException("Malformed workflow document: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new DocumentParseException("Unable to read workflow document", e);
        }
    }

    /**
     * 结构化遍历工具节点: 不进入 Properties 子树, 进入容器的 ChildNodes
     */
    private void visitToolNodes(Element element, Consumer<Element> visitor) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element e = (Element) child;
            String name = localName(e);
            if (name.equals(schema.getNodeElement())) {
                visitor.accept(e);
                Element nested = firstChild(e, schema.getChildNodesElement());
                if (nested != null) {
                    visitToolNodes(nested, visitor);
                }
            } else if (!name.equals(schema.getPropertiesElement())) {
                visitToolNodes(e, visitor);
            }
        }
    }

    private static void collectDescendants(Element element, String name, List<Element> out) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                if (localName(child).equals(name)) {
                    out.add((Element) child);
                }
                collectDescendants((Element) child, name, out);
            }
        }
    }

    private static Element firstChild(Element parent, String name) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && localName(child).equals(name)) {
                return (Element) child;
            }
        }
        return null;
    }

    private static String childText(Element parent, String name) {
        Element child = parent == null ? null : firstChild(parent, name);
        return child == null ? null : StringUtils.trimToNull(child.getTextContent());
    }

    // 按本地名取属性, 忽略前缀
    private static String attribute(Element element, String name) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attr = attributes.item(i);
            if (localName(attr).equals(name)) {
                return attr.getNodeValue();
            }
        }
        return null;
    }

    private static boolean hasElementChildren(Element element) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    // 仅直接文本子节点, 不含后代元素的文本
    private static String ownText(Element element) {
        StringBuilder sb = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(child.getNodeValue());
            }
        }
        return sb.toString();
    }

    private static boolean isNamespaceDeclaration(Attr attr) {
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI());
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    private static class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}

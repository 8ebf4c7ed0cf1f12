package cn.hjw.dev.flowscript.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 工作流图: 工具集合 + 连线集合 + 派生的正/反向邻接表
 * 图本身不校验悬空连线与环, 由 DependencyResolver 负责
 */
public class WorkflowGraph {

    // 按 ToolId 排序, 遍历顺序稳定
    private final Map<ToolId, Tool> tools = new TreeMap<>();

    private final List<Connection> connections = new ArrayList<>();

    // 邻接表 (Key: Source, Value: 出边)
    private final Map<ToolId, List<Connection>> outgoing = new HashMap<>();

    // 反向邻接表 (Key: Destination, Value: 入边)
    private final Map<ToolId, List<Connection>> incoming = new HashMap<>();

    @Getter
    @Setter
    private WorkflowMetadata metadata = WorkflowMetadata.EMPTY;

    /**
     * 注册工具, ID 必须唯一
     */
    public WorkflowGraph addTool(Tool tool) {
        if (tools.containsKey(tool.getId())) {
            throw new IllegalArgumentException("Duplicate tool id: " + tool.getId());
        }
        tools.put(tool.getId(), tool);
        return this;
    }

    /**
     * 添加连线: source -> destination
     * 意味着 destination 依赖 source
     */
    public WorkflowGraph addConnection(Connection connection) {
        connections.add(connection);
        outgoing.computeIfAbsent(connection.getSource(), k -> new ArrayList<>()).add(connection);
        incoming.computeIfAbsent(connection.getDestination(), k -> new ArrayList<>()).add(connection);
        return this;
    }

    public Optional<Tool> findTool(ToolId id) {
        return Optional.ofNullable(tools.get(id));
    }

    public boolean containsTool(ToolId id) {
        return tools.containsKey(id);
    }

    public Collection<Tool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public List<Connection> outgoing(ToolId id) {
        return Collections.unmodifiableList(outgoing.getOrDefault(id, Collections.emptyList()));
    }

    public List<Connection> incoming(ToolId id) {
        return Collections.unmodifiableList(incoming.getOrDefault(id, Collections.emptyList()));
    }

    public int size() {
        return tools.size();
    }
}

package cn.hjw.dev.flowscript.compile;

import cn.hjw.dev.flowscript.exception.CycleException;
import cn.hjw.dev.flowscript.exception.DanglingReferenceException;
import cn.hjw.dev.flowscript.model.Connection;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;

/**
 * 依赖解析: 工作流图 -> 执行计划
 * 无状态, 可被多个转换并发使用
 */
@Slf4j
public class DependencyResolver {

    /**
     * 编译工作流图为执行计划
     * @param graph 工作流图
     * @return 执行计划
     * @throws DanglingReferenceException 连线引用了不存在的工具
     * @throws CycleException 图中存在环 (含自环)
     */
    public ExecutionPlan resolve(WorkflowGraph graph) {
        // 1. 悬空引用校验, 必须先于排序
        for (Connection connection : graph.getConnections()) {
            if (!graph.containsTool(connection.getSource())) {
                throw new DanglingReferenceException(connection, "source");
            }
            if (!graph.containsTool(connection.getDestination())) {
                throw new DanglingReferenceException(connection, "destination");
            }
        }

        // 2. 入度表; 多输入工具 (join/union/append) 的每条入边都计数, 全部上游输出后才就绪
        Map<ToolId, Integer> inDegree = new HashMap<>();
        for (Tool tool : graph.getTools()) {
            inDegree.put(tool.getId(), graph.incoming(tool.getId()).size());
        }

        // 3. Kahn 拓扑排序; 就绪集合按ID升序出队, 保证生成脚本可复现
        Queue<ToolId> ready = new PriorityQueue<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.offer(id);
        });

        List<ToolId> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            ToolId id = ready.poll();
            order.add(id);
            for (Connection out : graph.outgoing(id)) {
                ToolId child = out.getDestination();
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    ready.offer(child);
                }
            }
        }

        // 4. 未输出的工具至少构成一个环, 不返回部分计划
        if (order.size() != graph.size()) {
            List<ToolId> members = new ArrayList<>();
            for (Tool tool : graph.getTools()) {
                if (inDegree.get(tool.getId()) > 0) {
                    members.add(tool.getId());
                }
            }
            log.error("Workflow graph is not a DAG, unresolved tools: {}", members);
            throw new CycleException(members);
        }

        log.debug("Execution plan resolved: {}", order);
        return new ExecutionPlan(order);
    }
}

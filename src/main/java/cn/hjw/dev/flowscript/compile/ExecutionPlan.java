package cn.hjw.dev.flowscript.compile;

import cn.hjw.dev.flowscript.model.ToolId;
import lombok.EqualsAndHashCode;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 执行计划: 拓扑有序的工具ID序列
 * 对任意连线 u -> v 满足 indexOf(u) < indexOf(v); 同一张图总是得到同一个计划
 */
@EqualsAndHashCode(of = "order")
public class ExecutionPlan implements Iterable<ToolId> {

    private final List<ToolId> order;

    // ToolId -> 位置
    private final Map<ToolId, Integer> index = new HashMap<>();

    public ExecutionPlan(List<ToolId> order) {
        this.order = List.copyOf(order);
        for (int i = 0; i < this.order.size(); i++) {
            index.put(this.order.get(i), i);
        }
    }

    public List<ToolId> getOrder() {
        return order;
    }

    /**
     * @return 位置, 不在计划中时为 -1
     */
    public int indexOf(ToolId id) {
        return index.getOrDefault(id, -1);
    }

    public int size() {
        return order.size();
    }

    @Override
    public Iterator<ToolId> iterator() {
        return order.iterator();
    }

    @Override
    public String toString() {
        return order.toString();
    }
}

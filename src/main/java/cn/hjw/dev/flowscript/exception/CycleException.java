package cn.hjw.dev.flowscript.exception;

import cn.hjw.dev.flowscript.model.ToolId;
import lombok.Getter;

import java.util.List;

/**
 * 工作流图不是 DAG
 * members 为拓扑排序结束后仍未输出的全部工具 (按ID升序)
 */
@Getter
public class CycleException extends FlowScriptException {

    private final transient List<ToolId> members;

    public CycleException(List<ToolId> members) {
        super("Workflow graph contains a cycle among tools " + members);
        this.members = List.copyOf(members);
    }
}

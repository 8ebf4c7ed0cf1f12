package cn.hjw.dev.flowscript.parse;

import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 解析结果: 工作流图 + 解析阶段的警告
@Getter
@RequiredArgsConstructor
public class ParsedWorkflow {

    private final WorkflowGraph graph;
    private final Diagnostics diagnostics;
}

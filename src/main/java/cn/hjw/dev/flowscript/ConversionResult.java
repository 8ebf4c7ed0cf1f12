package cn.hjw.dev.flowscript;

import cn.hjw.dev.flowscript.assemble.LineRange;
import cn.hjw.dev.flowscript.compile.ExecutionPlan;
import cn.hjw.dev.flowscript.diagnostic.Diagnostic;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@RequiredArgsConstructor
public class ConversionResult {

    private final String script;

    // 解析与生成阶段的全部警告, 按产生顺序
    private final List<Diagnostic> diagnostics;

    private final Map<ToolId, LineRange> toolLineRanges;

    private final ExecutionPlan plan;

    private final WorkflowGraph graph;
}

package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.compile.ExecutionPlan;
import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.exception.GenerationException;
import cn.hjw.dev.flowscript.expr.ExpressionTranslator;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import cn.hjw.dev.flowscript.script.PythonSyntax;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 代码生成: 按执行计划逐个工具生成 CodeUnit
 * 计划保证上游先于下游, 下游通过已生成的上游 CodeUnit 解析输入变量
 */
@Slf4j
@RequiredArgsConstructor
public class CodeGenerator {

    private final ToolGenerators generators;
    private final ExpressionTranslator translator;
    private final ConverterConfig config;

    public CodeGenerator(ConverterConfig config) {
        this(ToolGenerators.standard(), new ExpressionTranslator(), config);
    }

    public GeneratedUnits generate(WorkflowGraph graph, ExecutionPlan plan) {
        Diagnostics diagnostics = new Diagnostics();
        // 已生成的片段 (Memoization)
        Map<ToolId, CodeUnit> registry = new HashMap<>();
        List<CodeUnit> units = new ArrayList<>();

        for (ToolId id : plan) {
            Tool tool = graph.findTool(id)
                    .orElseThrow(() -> new GenerationException(id, "Execution plan names unknown tool " + id));
            GenerationContext context = new DefaultGenerationContext(tool, graph, registry, translator, diagnostics, config);
            CodeUnit unit = generators.forType(tool.getType()).generate(tool, context);
            if (config.isTraceRowCounts() && !unit.isDocumentation()) {
                unit = withTrace(unit);
            }
            registry.put(id, unit);
            units.add(unit);
            log.debug("Generated {} statement(s) for tool [{}]", unit.getStatements().size(), id);
        }
        return new GeneratedUnits(Collections.unmodifiableList(units), diagnostics);
    }

    // print('Tool 2:', len(df_2), 'rows')
    private static CodeUnit withTrace(CodeUnit unit) {
        CodeUnit.CodeUnitBuilder builder = unit.toBuilder();
        builder.statement("print(" + PythonSyntax.string("Tool " + unit.getToolId() + ":")
                + ", len(" + unit.getOutputVariable() + "), 'rows')");
        return builder.build();
    }
}

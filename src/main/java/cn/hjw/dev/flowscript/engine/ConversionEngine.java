package cn.hjw.dev.flowscript.engine;

import cn.hjw.dev.flowscript.ConversionResult;
import cn.hjw.dev.flowscript.ScriptConverter;
import cn.hjw.dev.flowscript.assemble.GeneratedScript;
import cn.hjw.dev.flowscript.assemble.ScriptAssembler;
import cn.hjw.dev.flowscript.compile.DependencyResolver;
import cn.hjw.dev.flowscript.compile.ExecutionPlan;
import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.exception.FlowScriptException;
import cn.hjw.dev.flowscript.generator.CodeGenerator;
import cn.hjw.dev.flowscript.generator.GeneratedUnits;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import cn.hjw.dev.flowscript.parse.ParsedWorkflow;
import cn.hjw.dev.flowscript.parse.ToolTypeRegistry;
import cn.hjw.dev.flowscript.parse.WorkflowDocumentParser;
import lombok.extern.slf4j.Slf4j;

/**
 * 转换引擎: 解析 -> 排序 -> 生成 -> 装配
 * 构造后不可变, 每次转换的状态都在调用栈内, 可并发使用
 */
@Slf4j
public class ConversionEngine implements ScriptConverter {

    private final WorkflowDocumentParser parser;
    private final DependencyResolver resolver;
    private final CodeGenerator generator;
    private final ScriptAssembler assembler;

    public ConversionEngine() {
        this(ConverterConfig.defaults());
    }

    public ConversionEngine(ConverterConfig config) {
        ToolTypeRegistry registry = ToolTypeRegistry.load(config.getToolTypeTable());
        this.parser = new WorkflowDocumentParser(config.getSchema(), registry);
        this.resolver = new DependencyResolver();
        this.generator = new CodeGenerator(config);
        this.assembler = new ScriptAssembler(config);
    }

    @Override
    public ConversionResult convert(String document) {
        try {
            // 1. 解析
            ParsedWorkflow parsed = parser.parse(document);
            WorkflowGraph graph = parsed.getGraph();

            // 2. 排序
            ExecutionPlan plan = resolver.resolve(graph);

            // 3. 生成
            GeneratedUnits units = generator.generate(graph, plan);

            Diagnostics diagnostics = new Diagnostics();
            diagnostics.addAll(parsed.getDiagnostics());
            diagnostics.addAll(units.getDiagnostics());

            // 4. 装配
            GeneratedScript script = assembler.assemble(graph.getMetadata(), units.getUnits(), diagnostics);
            log.info("Converted workflow with {} tool(s), {} warning(s)", graph.size(), diagnostics.size());
            return new ConversionResult(script.getText(), script.getDiagnostics(), script.getToolLineRanges(), plan, graph);
        } catch (FlowScriptException e) {
            log.error("Conversion failed: {}", e.getMessage());
            throw e;
        }
    }
}

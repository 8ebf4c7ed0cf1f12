package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.diagnostic.Stage;
import cn.hjw.dev.flowscript.expr.ExpressionTranslator;
import cn.hjw.dev.flowscript.expr.TranslatedExpression;
import cn.hjw.dev.flowscript.model.Connection;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.ToolType;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import cn.hjw.dev.flowscript.script.PythonSyntax;
import cn.hjw.dev.flowscript.script.Requirement;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * GenerationContext 的默认实现
 * 输入变量通过已生成的上游 CodeUnit 按连线的源锚点解析
 */
class DefaultGenerationContext implements GenerationContext {

    // 多输入工具的目标锚点排序, 未列出的锚点排在后面
    private static final List<String> ANCHOR_RANK = List.of("input", "left", "targets", "right", "source");

    private final Tool tool;
    private final WorkflowGraph graph;
    private final ExpressionTranslator translator;
    private final Diagnostics diagnostics;

    @Getter
    private final ConverterConfig config;

    private final String outputVariable;

    // (目标锚点, 变量), 已排序
    private final List<Map.Entry<String, String>> boundInputs;

    DefaultGenerationContext(Tool tool,
                             WorkflowGraph graph,
                             Map<ToolId, CodeUnit> upstreamUnits,
                             ExpressionTranslator translator,
                             Diagnostics diagnostics,
                             ConverterConfig config) {
        this.tool = tool;
        this.graph = graph;
        this.translator = translator;
        this.diagnostics = diagnostics;
        this.config = config;
        this.outputVariable = config.getVariablePrefix() + PythonSyntax.identifierPart(tool.getId().getRaw());
        this.boundInputs = resolveInputs(upstreamUnits);
    }

    private List<Map.Entry<String, String>> resolveInputs(Map<ToolId, CodeUnit> upstreamUnits) {
        List<Connection> inbound = new ArrayList<>(graph.incoming(tool.getId()));
        inbound.sort(Comparator.comparingInt((Connection c) -> anchorRank(c.getDestinationAnchor()))
                .thenComparingInt(Connection::getOrder));

        List<Map.Entry<String, String>> result = new ArrayList<>();
        for (Connection c : inbound) {
            CodeUnit upstream = upstreamUnits.get(c.getSource());
            String variable = upstream == null ? null : upstream.variableFor(c.getSourceAnchor());
            if (variable == null) {
                diagnostics.warn(Stage.GENERATE, tool.getId(),
                        "Input from tool " + c.getSource() + " carries no data; connection ignored");
                continue;
            }
            result.add(new AbstractMap.SimpleImmutableEntry<>(c.getDestinationAnchor(), variable));
        }
        return Collections.unmodifiableList(result);
    }

    private static int anchorRank(String anchor) {
        int rank = anchor == null ? -1 : ANCHOR_RANK.indexOf(anchor.toLowerCase(Locale.ROOT));
        return rank < 0 ? ANCHOR_RANK.size() : rank;
    }

    @Override
    public List<String> inputs() {
        List<String> variables = new ArrayList<>();
        for (Map.Entry<String, String> e : boundInputs) {
            variables.add(e.getValue());
        }
        return variables;
    }

    @Override
    public Optional<String> input(String anchor) {
        for (Map.Entry<String, String> e : boundInputs) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(anchor)) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public String primaryInput() {
        if (boundInputs.isEmpty()) {
            warn(tool.getType().getDisplayName() + " has no upstream input; using an empty DataFrame");
            return "pd.DataFrame()";
        }
        return boundInputs.get(0).getValue();
    }

    @Override
    public boolean isConnected(String outputAnchor) {
        for (Connection c : graph.outgoing(tool.getId())) {
            if (outputAnchor.equalsIgnoreCase(c.getSourceAnchor())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String outputVariable() {
        return outputVariable;
    }

    @Override
    public String variable(String anchor) {
        return outputVariable + "_" + PythonSyntax.identifierPart(anchor.toLowerCase(Locale.ROOT));
    }

    @Override
    public TranslatedExpression translate(String formula, String frame, CodeUnit.CodeUnitBuilder unit) {
        TranslatedExpression expr = translator.translate(formula, frame, tool.getId(), diagnostics);
        unit.requirements(expr.getRequirements());
        for (String note : expr.getNotes()) {
            unit.statement("# Note: " + note);
        }
        return expr;
    }

    @Override
    public void warn(String message) {
        diagnostics.warn(Stage.GENERATE, tool.getId(), message);
    }

    @Override
    public CodeUnit.CodeUnitBuilder newUnit() {
        CodeUnit.CodeUnitBuilder unit = CodeUnit.builder()
                .toolId(tool.getId())
                .header(header());
        if (!tool.getType().isDocumentation()) {
            unit.outputVariable(outputVariable)
                    .inputVariables(inputs())
                    .requirement(Requirement.PANDAS);
        }
        return unit;
    }

    // Tool 2: Filter (High value orders)
    private String header() {
        StringBuilder sb = new StringBuilder("Tool ").append(tool.getId()).append(": ");
        if (tool.getType() == ToolType.UNSUPPORTED) {
            sb.append("Unsupported tool '").append(StringUtils.normalizeSpace(tool.getRawType())).append("'");
        } else {
            sb.append(tool.getType().getDisplayName());
        }
        // 标题是单行注释, 注解中的换行折叠为空格
        String annotation = StringUtils.normalizeSpace(tool.getAnnotation());
        if (StringUtils.isNotEmpty(annotation)) {
            sb.append(" (").append(annotation).append(")");
        }
        return sb.toString();
    }
}

package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summarize: 分组 + 命名聚合
 * <pre>
 * &lt;SummarizeFields&gt;
 *   &lt;SummarizeField field="Region" action="GroupBy" rename="Region"/&gt;
 *   &lt;SummarizeField field="Amount" action="Sum" rename="Sum_Amount"/&gt;
 * &lt;/SummarizeFields&gt;
 * </pre>
 */
public class SummarizeGenerator implements ToolGenerator {

    static final String GROUP_BY = "GroupBy";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = PythonSyntax.receiver(context.primaryInput());
        String indent = context.getConfig().getIndent();

        List<String> groups = new ArrayList<>();
        Map<String, String> groupRenames = new LinkedHashMap<>();
        List<String> aggregations = new ArrayList<>();

        for (ConfigMap entry : ConfigFields.entries(tool.getConfiguration(), "SummarizeFields", "SummarizeField")) {
            String field = entry.text("field").orElse(null);
            String action = entry.text("action").orElse(null);
            if (field == null || action == null) {
                context.warn("Summarize field without field name or action skipped");
                continue;
            }
            if (GROUP_BY.equalsIgnoreCase(action)) {
                groups.add(field);
                entry.text("rename").filter(r -> !r.equals(field)).ifPresent(r -> groupRenames.put(field, r));
                continue;
            }
            Optional<AggregationAction> parsed = AggregationAction.parse(action);
            if (parsed.isEmpty()) {
                context.warn("Unsupported summarize action '" + action + "' for field '" + field + "'; field skipped");
                continue;
            }
            String output = entry.text("rename").orElse(parsed.get().getLabel() + "_" + field);
            aggregations.add(PythonSyntax.string(output) + ": (" + PythonSyntax.string(field) + ", "
                    + PythonSyntax.string(parsed.get().getFunction()) + "),");
        }

        if (groups.isEmpty() && aggregations.isEmpty()) {
            context.warn("Summarize has no aggregation; passing data through");
            unit.statement(variable + " = " + source + ".copy()");
            return unit.build();
        }

        String groupList = PythonSyntax.stringList(groups);
        if (aggregations.isEmpty()) {
            // 只有分组: 去重后的分组键
            unit.statement(variable + " = " + source + "[" + groupList + "].drop_duplicates()"
                    + ".sort_values(by=" + groupList + ", kind='mergesort').reset_index(drop=True)");
        } else {
            String grouped = groups.isEmpty()
                    ? source + ".groupby(lambda _: 0)"
                    : source + ".groupby(" + groupList + ", as_index=False, dropna=False)";
            unit.statement(variable + " = " + grouped + ".agg(**{");
            for (String aggregation : aggregations) {
                unit.statement(indent + aggregation);
            }
            unit.statement(groups.isEmpty() ? "}).reset_index(drop=True)" : "})");
        }
        if (!groupRenames.isEmpty()) {
            unit.statement(variable + " = " + variable + ".rename(columns=" + SelectGenerator.dict(groupRenames, true) + ")");
        }
        return unit.build();
    }
}

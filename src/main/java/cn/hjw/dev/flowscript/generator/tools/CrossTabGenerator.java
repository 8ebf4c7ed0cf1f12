package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.List;
import java.util.Optional;

/**
 * Cross Tab: 行转列
 * <pre>
 * &lt;GroupFields&gt;&lt;Field field="Region"/&gt;&lt;/GroupFields&gt;
 * &lt;HeaderField field="Quarter"/&gt;
 * &lt;DataField field="Sales"/&gt;
 * &lt;Methods&gt;&lt;Method method="Sum"/&gt;&lt;/Methods&gt;
 * </pre>
 */
public class CrossTabGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = context.primaryInput();

        Optional<String> header = ConfigFields.attribute(config, "HeaderField", "field");
        Optional<String> data = ConfigFields.attribute(config, "DataField", "field");
        if (header.isEmpty() || data.isEmpty()) {
            context.warn("Cross Tab needs a header field and a data field; passing data through");
            unit.statement(variable + " = " + PythonSyntax.receiver(source) + ".copy()");
            return unit.build();
        }

        AggregationAction method = AggregationAction.SUM;
        List<String> methods = ConfigFields.names(config, "Methods", "Method", "method");
        if (!methods.isEmpty()) {
            Optional<AggregationAction> parsed = AggregationAction.parse(methods.get(0));
            if (parsed.isPresent()) {
                method = parsed.get();
            } else {
                context.warn("Unsupported cross tab method '" + methods.get(0) + "'; using Sum");
            }
        }
        // pivot_table 的 aggfunc 不接受 size
        String aggfunc = method == AggregationAction.COUNT ? "count" : method.getFunction();

        List<String> groups = ConfigFields.names(config, "GroupFields", "Field", "field");
        String index = groups.isEmpty() ? "" : "index=" + PythonSyntax.stringList(groups) + ", ";
        unit.statement(variable + " = pd.pivot_table(" + source + ", " + index
                + "columns=" + PythonSyntax.string(header.get())
                + ", values=" + PythonSyntax.string(data.get())
                + ", aggfunc=" + PythonSyntax.string(aggfunc) + ")"
                + (groups.isEmpty() ? ".reset_index(drop=True)" : ".reset_index()"));
        unit.statement(variable + ".columns.name = None");
        return unit.build();
    }
}

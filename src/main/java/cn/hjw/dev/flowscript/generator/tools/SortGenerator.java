package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Sort: 稳定排序
 * <pre>
 * &lt;SortInfo&gt;&lt;Field field="Amount" order="Descending"/&gt;&lt;/SortInfo&gt;
 * </pre>
 */
public class SortGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = PythonSyntax.receiver(context.primaryInput());

        List<String> fields = new ArrayList<>();
        StringJoiner ascending = new StringJoiner(", ", "[", "]");
        for (ConfigMap entry : ConfigFields.entries(tool.getConfiguration(), "SortInfo", "Field")) {
            entry.text("field").ifPresent(field -> {
                fields.add(field);
                boolean descending = entry.text("order").map(o -> o.toLowerCase(Locale.ROOT).startsWith("desc")).orElse(false);
                ascending.add(PythonSyntax.bool(!descending));
            });
        }

        if (fields.isEmpty()) {
            context.warn("Sort has no sort fields; passing data through");
            unit.statement(variable + " = " + source + ".copy()");
            return unit.build();
        }
        unit.statement(variable + " = " + source + ".sort_values(by=" + PythonSyntax.stringList(fields)
                + ", ascending=" + ascending + ", kind='mergesort')");
        return unit.build();
    }
}

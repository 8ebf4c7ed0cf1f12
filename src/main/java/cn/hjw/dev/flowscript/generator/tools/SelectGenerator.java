package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.expr.ValueKind;
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
import java.util.StringJoiner;

/**
 * Select: 去掉未选字段, 转换类型, 重命名
 * <pre>
 * &lt;SelectFields&gt;
 *   &lt;SelectField field="Region" selected="True" rename="Area" type="V_String"/&gt;
 *   &lt;SelectField field="*Unknown" selected="True"/&gt;
 * &lt;/SelectFields&gt;
 * </pre>
 * *Unknown 未选中时, 只保留显式选中的字段
 */
public class SelectGenerator implements ToolGenerator {

    static final String UNKNOWN_FIELDS = "*Unknown";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = context.primaryInput();

        boolean keepUnknown = true;
        List<String> selected = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        Map<String, String> dtypes = new LinkedHashMap<>();
        List<String> dates = new ArrayList<>();
        Map<String, String> renames = new LinkedHashMap<>();

        for (ConfigMap entry : ConfigFields.entries(tool.getConfiguration(), "SelectFields", "SelectField")) {
            String field = entry.text("field").orElse(null);
            if (field == null) {
                continue;
            }
            boolean isSelected = entry.flag("selected", true);
            if (UNKNOWN_FIELDS.equalsIgnoreCase(field)) {
                keepUnknown = isSelected;
                continue;
            }
            if (!isSelected) {
                dropped.add(field);
                continue;
            }
            selected.add(field);
            entry.text("type").ifPresent(type -> {
                String dtype = FieldTypes.dtypeLiteral(type);
                if (dtype != null) {
                    dtypes.put(field, dtype);
                } else if (FieldTypes.kindOf(type) == ValueKind.DATE) {
                    dates.add(field);
                }
            });
            entry.text("rename").filter(r -> !r.equals(field)).ifPresent(r -> renames.put(field, r));
        }

        if (!keepUnknown) {
            unit.statement(variable + " = " + PythonSyntax.receiver(source) + "[" + PythonSyntax.stringList(selected) + "].copy()");
        } else if (!dropped.isEmpty()) {
            unit.statement(variable + " = " + PythonSyntax.receiver(source) + ".drop(columns=" + PythonSyntax.stringList(dropped) + ")");
        } else {
            unit.statement(variable + " = " + PythonSyntax.receiver(source) + ".copy()");
        }
        if (!dtypes.isEmpty()) {
            unit.statement(variable + " = " + variable + ".astype(" + dict(dtypes, false) + ")");
        }
        for (String field : dates) {
            String column = PythonSyntax.column(variable, field);
            unit.statement(column + " = pd.to_datetime(" + column + ", errors='coerce')");
        }
        if (!renames.isEmpty()) {
            unit.statement(variable + " = " + variable + ".rename(columns=" + dict(renames, true) + ")");
        }
        return unit.build();
    }

    // {'a': 'b'}; quoteValues=false 时值已是字面量
    static String dict(Map<String, String> entries, boolean quoteValues) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        entries.forEach((k, v) -> joiner.add(PythonSyntax.string(k) + ": " + (quoteValues ? PythonSyntax.string(v) : v)));
        return joiner.toString();
    }
}

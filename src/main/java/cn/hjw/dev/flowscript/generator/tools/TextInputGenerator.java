package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.ConfigValue;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Text Input: 内联数据
 * <pre>
 * &lt;Fields&gt;&lt;Field name="Region"/&gt;&lt;/Fields&gt;
 * &lt;Data&gt;&lt;r&gt;&lt;c&gt;West&lt;/c&gt;&lt;/r&gt;&lt;/Data&gt;
 * </pre>
 */
public class TextInputGenerator implements ToolGenerator {

    private static final Pattern ZERO_PADDED = Pattern.compile("-?0\\d+");

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String indent = context.getConfig().getIndent();

        List<String> columns = ConfigFields.names(config, "Fields", "Field", "name");
        if (columns.isEmpty()) {
            context.warn("Text Input defines no fields; producing an empty DataFrame");
            unit.statement(context.outputVariable() + " = pd.DataFrame()");
            return unit.build();
        }

        List<ConfigMap> rows = config.child("Data").map(d -> ConfigFields.maps(d.list("r"))).orElseGet(ArrayList::new);
        unit.statement(context.outputVariable() + " = pd.DataFrame(");
        unit.statement(indent + "[");
        for (ConfigMap row : rows) {
            StringJoiner values = new StringJoiner(", ", "[", "],");
            List<ConfigValue> cells = row.list("c");
            for (int i = 0; i < columns.size(); i++) {
                values.add(i < cells.size() ? literal(cells.get(i)) : "None");
            }
            unit.statement(indent + indent + values);
        }
        unit.statement(indent + "],");
        unit.statement(indent + "columns=" + PythonSyntax.stringList(columns) + ",");
        unit.statement(")");
        return unit.build();
    }

    // 数值与布尔按字面量写出, 空单元格为 None; 补零的编码 (邮编 02134) 保留为字符串
    private static String literal(ConfigValue cell) {
        Optional<String> text = cell.text();
        if (text.isEmpty() || text.get().isEmpty()) {
            return "None";
        }
        if (cell.asNumber().isPresent() && !ZERO_PADDED.matcher(text.get().trim()).matches()) {
            return PythonSyntax.number(text.get());
        }
        Optional<Boolean> bool = cell.asBoolean();
        if (bool.isPresent()) {
            return PythonSyntax.bool(bool.get());
        }
        return PythonSyntax.string(text.get());
    }
}

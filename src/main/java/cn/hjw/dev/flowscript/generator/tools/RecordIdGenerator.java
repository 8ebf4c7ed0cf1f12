package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.ConfigValue;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

/**
 * Record ID: 连续编号字段, Position 为 0 时放在第一列
 */
public class RecordIdGenerator implements ToolGenerator {

    static final String DEFAULT_FIELD = "RecordID";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();

        String field = config.text("FieldName").orElse(DEFAULT_FIELD);
        String start = config.get("StartValue").flatMap(ConfigValue::asNumber).map(d -> d.toBigInteger().toString()).orElse("1");
        boolean first = config.get("Position").flatMap(ConfigValue::asNumber).map(d -> d.signum() == 0).orElse(true);

        String ids = "range(" + start + ", len(" + variable + ") + " + start + ")";
        unit.statement(variable + " = " + PythonSyntax.receiver(context.primaryInput()) + ".copy()");
        if (first) {
            unit.statement(variable + ".insert(0, " + PythonSyntax.string(field) + ", " + ids + ")");
        } else {
            unit.statement(PythonSyntax.column(variable, field) + " = " + ids);
        }
        return unit.build();
    }
}

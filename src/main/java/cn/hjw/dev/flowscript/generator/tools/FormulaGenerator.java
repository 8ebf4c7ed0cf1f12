package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.expr.TranslatedExpression;
import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.List;

/**
 * Formula: 按配置顺序逐个赋值, 后面的公式可以引用前面新建的字段
 * <pre>
 * &lt;FormulaFields&gt;
 *   &lt;FormulaField expression="[Amount] * 2" field="Double" type="Double"/&gt;
 * &lt;/FormulaFields&gt;
 * </pre>
 */
public class FormulaGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        unit.statement(variable + " = " + PythonSyntax.receiver(context.primaryInput()) + ".copy()");

        List<ConfigMap> fields = ConfigFields.entries(tool.getConfiguration(), "FormulaFields", "FormulaField");
        if (fields.isEmpty()) {
            context.warn("Formula has no formula fields; passing data through");
            return unit.build();
        }
        for (ConfigMap field : fields) {
            String name = field.text("field").orElse(null);
            String expression = field.text("expression").orElse(null);
            if (name == null || expression == null) {
                context.warn("Formula field without " + (name == null ? "target field" : "expression for '" + name + "'")
                        + " skipped");
                continue;
            }
            TranslatedExpression expr = context.translate(expression, variable, unit);
            String code = FieldTypes.coerce(expr.getCode(), expr.getKind(), field.text("type").orElse(null), variable);
            unit.statement(PythonSyntax.column(variable, name) + " = " + code);
        }
        return unit.build();
    }
}

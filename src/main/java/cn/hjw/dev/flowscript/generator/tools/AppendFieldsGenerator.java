package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;

import java.util.Optional;

/**
 * Append Fields: Targets 与 Source 做笛卡尔积
 */
public class AppendFieldsGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();

        Optional<String> targets = context.input("Targets");
        Optional<String> source = context.input("Source");
        if (targets.isEmpty() || source.isEmpty()) {
            context.warn("Append Fields needs both Targets and Source inputs; passing the first input through");
            unit.statement(variable + " = " + context.primaryInput());
            return unit.build();
        }
        unit.statement(variable + " = " + targets.get() + ".merge(" + source.get() + ", how='cross')");
        return unit.build();
    }
}

package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;

// Browse: 透传并打印前几行与形状
public class BrowseGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        String variable = context.outputVariable();
        return context.newUnit()
                .statement(variable + " = " + context.primaryInput())
                .statement("print(" + variable + ".head(10))")
                .statement("print(" + variable + ".shape)")
                .build();
    }
}

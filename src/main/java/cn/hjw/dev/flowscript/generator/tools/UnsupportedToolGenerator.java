package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 兜底生成器
 * 未识别的工具透传第一个上游, 保证下游变量链不断; 警告已在解析阶段记录
 */
public class UnsupportedToolGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        List<String> inputs = context.inputs();
        String upstream = inputs.isEmpty() ? "pd.DataFrame()" : inputs.get(0);
        return context.newUnit()
                .statement("# Manual implementation required: tool type '" + StringUtils.normalizeSpace(tool.getRawType()) + "' has no translation")
                .statement(context.outputVariable() + " = " + upstream)
                .build();
    }
}

package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.model.Tool;

/**
 * 工具代码生成器接口
 * 每种 ToolType 一个实现, 通过 {@link ToolGenerators} 分派
 */
@FunctionalInterface
public interface ToolGenerator {

    /**
     * 生成工具对应的代码片段
     * @param tool    当前工具
     * @param context 上游变量、下游连线以及翻译器等的访问入口
     * @return 代码片段
     */
    CodeUnit generate(Tool tool, GenerationContext context);
}

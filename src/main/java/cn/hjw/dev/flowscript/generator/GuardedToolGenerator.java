package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.exception.FlowScriptException;
import cn.hjw.dev.flowscript.exception.GenerationException;
import cn.hjw.dev.flowscript.model.Tool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 生成器装饰器
 * 生成器内部的非预期运行时异常统一转换为带工具ID的 GenerationException
 */
@Slf4j
@RequiredArgsConstructor
public class GuardedToolGenerator implements ToolGenerator {

    private final ToolGenerator delegate;

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        try {
            return delegate.generate(tool, context);
        } catch (FlowScriptException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Generator for tool [{}] ({}) failed", tool.getId(), tool.getType(), e);
            throw new GenerationException(tool.getId(),
                    "Failed to generate code for tool " + tool.getId() + " (" + tool.getType().getDisplayName()
                            + "): " + e.getMessage(), e);
        }
    }
}

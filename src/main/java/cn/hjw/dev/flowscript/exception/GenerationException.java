package cn.hjw.dev.flowscript.exception;

import cn.hjw.dev.flowscript.model.ToolId;
import lombok.Getter;

/**
 * 代码生成阶段的非预期失败 (生成器自身缺陷或执行计划与图不一致)
 */
@Getter
public class GenerationException extends FlowScriptException {

    private final transient ToolId toolId;

    public GenerationException(ToolId toolId, String message) {
        super(message);
        this.toolId = toolId;
    }

    public GenerationException(ToolId toolId, String message, Throwable cause) {
        super(message, cause);
        this.toolId = toolId;
    }
}

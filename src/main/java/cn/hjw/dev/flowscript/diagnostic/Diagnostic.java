package cn.hjw.dev.flowscript.diagnostic;

import cn.hjw.dev.flowscript.model.ToolId;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 一条诊断信息 (机器可读): 严重级别 + 阶段 + 工具ID (可为 null) + 描述
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Diagnostic {

    private final Severity severity;
    private final Stage stage;
    private final ToolId toolId;
    private final String message;

    @Override
    public String toString() {
        return severity + " [" + stage + "]" + (toolId != null ? " tool " + toolId : "") + ": " + message;
    }
}

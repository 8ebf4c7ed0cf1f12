package cn.hjw.dev.flowscript.assemble;

import cn.hjw.dev.flowscript.diagnostic.Diagnostic;
import cn.hjw.dev.flowscript.model.ToolId;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 装配结果: 脚本文本 + 全部警告 + 工具ID -> 行区间
 */
@Getter
@RequiredArgsConstructor
public class GeneratedScript {

    private final String text;

    private final List<Diagnostic> diagnostics;

    // 按执行顺序
    private final Map<ToolId, LineRange> toolLineRanges;
}

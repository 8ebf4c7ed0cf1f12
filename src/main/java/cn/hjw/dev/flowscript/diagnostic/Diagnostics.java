package cn.hjw.dev.flowscript.diagnostic;

import cn.hjw.dev.flowscript.model.ToolId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 警告累加器
 * 贯穿 解析 -> 排序 -> 生成 各阶段, 可恢复问题一律记录在此而不是抛异常
 * 每次转换独占一个实例, 不跨线程共享
 */
@Slf4j
public class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void warn(Stage stage, ToolId toolId, String message) {
        add(new Diagnostic(Severity.WARNING, stage, toolId, message));
    }

    public void warn(Stage stage, String message) {
        warn(stage, null, message);
    }

    public void add(Diagnostic diagnostic) {
        log.warn("{}", diagnostic);
        entries.add(diagnostic);
    }

    public void addAll(Diagnostics other) {
        entries.addAll(other.entries);
    }

    public List<Diagnostic> asList() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> forTool(ToolId toolId) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (toolId.equals(d.getToolId())) {
                result.add(d);
            }
        }
        return result;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}

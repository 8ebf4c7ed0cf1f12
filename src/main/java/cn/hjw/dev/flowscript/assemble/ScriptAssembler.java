package cn.hjw.dev.flowscript.assemble;

import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.WorkflowMetadata;
import cn.hjw.dev.flowscript.script.Requirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 脚本装配
 *
 * 结构: 文档字符串 -> import -> 辅助函数 -> 入口例程 (各工具片段) -> __main__ 守卫
 * 不写入任何时间戳, 相同输入得到逐字节相同的输出
 */
@Slf4j
@RequiredArgsConstructor
public class ScriptAssembler {

    static final String SEPARATOR = "# " + StringUtils.repeat('-', 70);

    private final ConverterConfig config;

    public GeneratedScript assemble(WorkflowMetadata metadata, List<CodeUnit> units, Diagnostics diagnostics) {
        List<String> lines = new ArrayList<>();
        String indent = config.getIndent();

        docstring(lines, metadata, units.size(), diagnostics.size());

        // 1. 前导项: 只输出实际用到的
        Set<Requirement> required = EnumSet.noneOf(Requirement.class);
        boolean hasData = false;
        for (CodeUnit unit : units) {
            required.addAll(unit.getRequirements());
            hasData |= !unit.isDocumentation();
        }
        if (hasData) {
            required.add(Requirement.PANDAS);
        }
        List<String> imports = new ArrayList<>();
        for (Requirement r : required) {
            if (!r.isHelper()) {
                imports.addAll(r.getLines());
            }
        }
        if (!imports.isEmpty()) {
            lines.add("");
            lines.addAll(imports);
        }
        for (Requirement r : required) {
            if (r.isHelper()) {
                lines.add("");
                lines.add("");
                lines.addAll(r.getLines());
            }
        }

        // 2. 入口例程
        lines.add("");
        lines.add("");
        lines.add("def " + config.getEntryPoint() + "():");
        Map<ToolId, LineRange> ranges = new LinkedHashMap<>();
        for (CodeUnit unit : units) {
            int first = lines.size() + 1;
            lines.add(indent + SEPARATOR);
            lines.add(indent + "# " + unit.getHeader());
            for (String statement : unit.getStatements()) {
                lines.add(indent + statement);
            }
            ranges.put(unit.getToolId(), new LineRange(first, lines.size()));
            lines.add("");
        }
        lines.add(indent + "return True");

        // 3. 守卫
        lines.add("");
        lines.add("");
        lines.add("if __name__ == '__main__':");
        lines.add(indent + config.getEntryPoint() + "()");

        String text = String.join("\n", lines) + "\n";
        log.debug("Assembled script: {} line(s), {} tool(s), imports {}", lines.size(), units.size(), required);
        return new GeneratedScript(text, diagnostics.asList(), Collections.unmodifiableMap(ranges));
    }

    private static void docstring(List<String> lines, WorkflowMetadata metadata, int tools, int warnings) {
        lines.add("\"\"\"");
        lines.add("Workflow: " + docText(StringUtils.defaultIfBlank(metadata.getName(), "(untitled)")));
        if (StringUtils.isNotBlank(metadata.getVersion())) {
            lines.add("Document version: " + docText(metadata.getVersion()));
        }
        if (StringUtils.isNotBlank(metadata.getAuthor())) {
            lines.add("Author: " + docText(metadata.getAuthor()));
        }
        if (StringUtils.isNotBlank(metadata.getDescription())) {
            lines.add("");
            for (String line : metadata.getDescription().trim().split("\\r?\\n")) {
                lines.add(docText(line.trim()));
            }
        }
        lines.add("");
        lines.add("Converted " + tools + " tool(s) with " + warnings + " warning(s).");
        lines.add("\"\"\"");
    }

    // 文档字符串内的反斜杠与三引号需要转义
    private static String docText(String text) {
        return text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
    }
}

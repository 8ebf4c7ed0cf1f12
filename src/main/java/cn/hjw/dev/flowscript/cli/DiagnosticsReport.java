package cn.hjw.dev.flowscript.cli;

import cn.hjw.dev.flowscript.ConversionResult;
import cn.hjw.dev.flowscript.assemble.LineRange;
import cn.hjw.dev.flowscript.diagnostic.Diagnostic;
import cn.hjw.dev.flowscript.model.ToolId;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断报告 (JSON)
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "error", "executionOrder", "diagnostics", "toolLineRanges"})
public class DiagnosticsReport {

    public static final String STATUS_CONVERTED = "converted";
    public static final String STATUS_FAILED = "failed";

    private final String status;

    private final String error;

    private final List<String> executionOrder;

    private final List<Entry> diagnostics;

    private final Map<String, int[]> toolLineRanges;

    private DiagnosticsReport(String status, String error, List<String> executionOrder, List<Entry> diagnostics,
                              Map<String, int[]> toolLineRanges) {
        this.status = status;
        this.error = error;
        this.executionOrder = executionOrder;
        this.diagnostics = diagnostics;
        this.toolLineRanges = toolLineRanges;
    }

    public static DiagnosticsReport of(ConversionResult result) {
        List<String> order = new ArrayList<>();
        for (ToolId id : result.getPlan()) {
            order.add(id.getRaw());
        }
        List<Entry> entries = new ArrayList<>();
        for (Diagnostic d : result.getDiagnostics()) {
            entries.add(new Entry(d));
        }
        Map<String, int[]> ranges = new LinkedHashMap<>();
        for (Map.Entry<ToolId, LineRange> e : result.getToolLineRanges().entrySet()) {
            ranges.put(e.getKey().getRaw(), new int[]{e.getValue().getFirst(), e.getValue().getLast()});
        }
        return new DiagnosticsReport(STATUS_CONVERTED, null, order, entries, ranges);
    }

    public static DiagnosticsReport failure(String message) {
        return new DiagnosticsReport(STATUS_FAILED, message, null, new ArrayList<>(), null);
    }

    @Getter
    @JsonPropertyOrder({"severity", "stage", "toolId", "message"})
    public static class Entry {

        private final String severity;
        private final String stage;
        private final String toolId;
        private final String message;

        Entry(Diagnostic d) {
            this.severity = d.getSeverity().name();
            this.stage = d.getStage().name();
            this.toolId = d.getToolId() != null ? d.getToolId().getRaw() : null;
            this.message = d.getMessage();
        }
    }
}

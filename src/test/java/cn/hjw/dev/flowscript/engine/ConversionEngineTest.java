package cn.hjw.dev.flowscript.engine;

import cn.hjw.dev.flowscript.ConversionResult;
import cn.hjw.dev.flowscript.ScriptConverter;
import cn.hjw.dev.flowscript.WorkflowDocuments;
import cn.hjw.dev.flowscript.assemble.LineRange;
import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.diagnostic.Diagnostic;
import cn.hjw.dev.flowscript.exception.CycleException;
import cn.hjw.dev.flowscript.exception.DanglingReferenceException;
import cn.hjw.dev.flowscript.exception.DocumentParseException;
import cn.hjw.dev.flowscript.model.ToolId;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Slf4j
public class ConversionEngineTest {

    private final ScriptConverter converter = new ConversionEngine();

    private static String salesPipeline() {
        return WorkflowDocuments.workflow()
                .named("Sales")
                .node(3, "AlteryxDbFileOutput", "<File>high_value.csv</File>")
                .node(1, "AlteryxDbFileInput", "<File>sales.csv</File>")
                .node(2, "AlteryxFilter", "<Mode>Custom</Mode>"
                        + "<Expression>[Amount] &gt; 1000 AND [Region] = \"West\"</Expression>")
                .connect(1, 2)
                .connect(2, "True", 3, "Input")
                .build();
    }

    /**
     * 场景: 输入 -> 过滤 -> 输出, 文档中节点乱序
     * 预期: 计划为 1,2,3; 三个变量按顺序出现; 无警告
     */
    @Test
    public void testConvert_LinearPipeline() {
        ConversionResult result = converter.convert(salesPipeline());
        String script = result.getScript();
        log.info("Generated script:\n{}", script);

        Assertions.assertEquals(Arrays.asList(ToolId.of(1), ToolId.of(2), ToolId.of(3)), result.getPlan().getOrder());
        Assertions.assertTrue(result.getDiagnostics().isEmpty());

        int read = script.indexOf("df_1 = pd.read_csv('sales.csv')");
        int filter = script.indexOf("df_2 = df_1[((df_1['Amount'] > 1000) & (df_1['Region'] == 'West'))]");
        int write = script.indexOf("df_3 = df_2\n");
        Assertions.assertTrue(read > 0, "read statement missing");
        Assertions.assertTrue(filter > read, "filter must follow read");
        Assertions.assertTrue(write > filter, "output must follow filter");
        Assertions.assertTrue(script.contains("df_3.to_csv('high_value.csv', index=False)"));
        Assertions.assertTrue(script.contains("import pandas as pd"));
        Assertions.assertFalse(script.contains("import numpy"));
        Assertions.assertTrue(script.endsWith("if __name__ == '__main__':\n    main()\n"));
    }

    /**
     * 场景: 工具注解跨行, Text Input 含补零的编码
     * 预期: 注解折叠进单行标题注释, 补零的编码写成字符串, 脚本里没有裸露的续行
     */
    @Test
    public void testConvert_AnnotationAndZeroPaddedValues() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxTextInput", "<Fields><Field name=\"Zip\"/></Fields><Data><r><c>02134</c></r></Data>",
                        "Load zips\nfor Q1 reporting")
                .node(2, "AlteryxFilter", "<Mode>Custom</Mode><Expression>[Code] = 007</Expression>")
                .connect(1, 2)
                .build();
        String script = converter.convert(xml).getScript();
        log.info("Generated script:\n{}", script);

        Assertions.assertTrue(script.contains("    # Tool 1: Text Input (Load zips for Q1 reporting)\n"));
        Assertions.assertFalse(script.contains("\nfor Q1 reporting"));
        Assertions.assertTrue(script.contains("['02134'],"));
        Assertions.assertTrue(script.contains("df_2 = df_1[(df_1['Code'] == 7)]"));
    }

    /**
     * 场景: 行区间
     * 预期: 每个工具的区间首行是分隔线, 第二行是该工具的标题
     */
    @Test
    public void testConvert_LineRangesPointAtToolSections() {
        ConversionResult result = converter.convert(salesPipeline());
        String[] lines = result.getScript().split("\n", -1);
        for (ToolId id : result.getPlan()) {
            LineRange range = result.getToolLineRanges().get(id);
            Assertions.assertNotNull(range, "no range for tool " + id);
            Assertions.assertTrue(lines[range.getFirst()].trim().startsWith("# Tool " + id + ":"));
            Assertions.assertFalse(lines[range.getLast() - 1].isBlank());
        }
    }

    /**
     * 场景: 两个输入按键 Join
     * 预期: 默认内连接, 结果绑定到 df_3
     */
    @Test
    public void testConvert_Join() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>orders.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>customers.xlsx|||Sheet1</File>")
                .node(3, "AlteryxJoin", "<JoinInfo connection=\"Left\"><Field field=\"CustomerID\"/></JoinInfo>"
                        + "<JoinInfo connection=\"Right\"><Field field=\"ID\"/></JoinInfo>")
                .connect(1, "Output", 3, "Left")
                .connect(2, "Output", 3, "Right")
                .build();
        String script = converter.convert(xml).getScript();
        Assertions.assertTrue(script.contains("df_2 = pd.read_excel('customers.xlsx', sheet_name='Sheet1')"));
        Assertions.assertTrue(script.contains(
                "df_3 = pd.merge(df_1, df_2, left_on=['CustomerID'], right_on=['ID'], how='inner')"));
    }

    /**
     * 场景: 同一文档转换两次, 以及多线程并发转换
     * 预期: 输出逐字节相同
     */
    @Test
    public void testConvert_Deterministic() throws Exception {
        String xml = salesPipeline();
        String first = converter.convert(xml).getScript();
        Assertions.assertEquals(first, converter.convert(xml).getScript());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> converter.convert(xml).getScript());
            }
            for (Future<String> f : pool.invokeAll(tasks)) {
                Assertions.assertEquals(first, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 场景: 公式里用到没有映射的函数
     * 预期: 脚本中出现占位调用与辅助函数, 恰好一条归属该工具的警告
     */
    @Test
    public void testConvert_UnmappedFunctionPlaceholder() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxFormula", "<FormulaFields>"
                        + "<FormulaField expression=\"GeoHash([Lat], [Lon])\" field=\"Hash\" type=\"V_WString\"/>"
                        + "</FormulaFields>")
                .connect(1, 2)
                .build();
        ConversionResult result = converter.convert(xml);

        Assertions.assertEquals(1, result.getDiagnostics().size());
        Diagnostic warning = result.getDiagnostics().get(0);
        Assertions.assertEquals(ToolId.of(2), warning.getToolId());
        Assertions.assertTrue(warning.getMessage().contains("GeoHash"));

        String script = result.getScript();
        Assertions.assertTrue(script.contains("df_2['Hash'] = unimplemented('GeoHash([Lat], [Lon])')"));
        Assertions.assertTrue(script.contains("def unimplemented(source, *args):"));
        Assertions.assertTrue(script.contains("with 1 warning(s)."));
    }

    /**
     * 场景: 自定义变量前缀
     */
    @Test
    public void testConvert_CustomPrefix() {
        ScriptConverter custom = new ConversionEngine(ConverterConfig.builder().variablePrefix("step_").build());
        String script = custom.convert(salesPipeline()).getScript();
        Assertions.assertTrue(script.contains("step_3 = step_2\n"));
        Assertions.assertFalse(script.contains("df_"));
    }

    /**
     * 场景: 环 / 悬空连线 / 格式错误
     * 预期: 致命错误直接抛出, 不产出脚本
     */
    @Test
    public void testConvert_FatalErrors() {
        String cycle = WorkflowDocuments.workflow()
                .node(1, "AlteryxSort", "")
                .node(2, "AlteryxSort", "")
                .connect(1, 2)
                .connect(2, 1)
                .build();
        Assertions.assertThrows(CycleException.class, () -> converter.convert(cycle));

        String dangling = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .connect(1, 42)
                .build();
        Assertions.assertThrows(DanglingReferenceException.class, () -> converter.convert(dangling));

        Assertions.assertThrows(DocumentParseException.class, () -> converter.convert("<not-closed>"));
    }
}

package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.WorkflowDocuments;
import cn.hjw.dev.flowscript.compile.DependencyResolver;
import cn.hjw.dev.flowscript.compile.ExecutionPlan;
import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.exception.GenerationException;
import cn.hjw.dev.flowscript.expr.ExpressionTranslator;
import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.model.ToolType;
import cn.hjw.dev.flowscript.model.WorkflowGraph;
import cn.hjw.dev.flowscript.parse.ToolTypeRegistry;
import cn.hjw.dev.flowscript.parse.WorkflowDocumentParser;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class CodeGeneratorTest {

    private static final ConverterConfig CONFIG = ConverterConfig.defaults();

    private final WorkflowDocumentParser parser = new WorkflowDocumentParser(CONFIG.getSchema(),
            ToolTypeRegistry.load(CONFIG.getToolTypeTable()));

    private final DependencyResolver resolver = new DependencyResolver();

    private GeneratedUnits generate(String xml, CodeGenerator generator) {
        WorkflowGraph graph = parser.parse(xml).getGraph();
        ExecutionPlan plan = resolver.resolve(graph);
        return generator.generate(graph, plan);
    }

    private GeneratedUnits generate(String xml) {
        return generate(xml, new CodeGenerator(CONFIG));
    }

    private static CodeUnit unit(GeneratedUnits units, int id) {
        for (CodeUnit unit : units.getUnits()) {
            if (unit.getToolId().equals(ToolId.of(id))) {
                return unit;
            }
        }
        throw new AssertionError("No code unit for tool " + id);
    }

    /**
     * 场景: Filter 的 True 与 False 两个锚点都连到下游
     * 预期: False 分支单独绑定变量, 下游按源锚点取到各自的变量
     */
    @Test
    public void testFilter_BothBranchesBound() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>sales.csv</File>")
                .node(2, "AlteryxFilter", "<Mode>Custom</Mode><Expression>[Amount] &gt; 1000</Expression>")
                .node(3, "AlteryxDbFileOutput", "<File>big.csv</File>")
                .node(4, "AlteryxDbFileOutput", "<File>small.csv</File>")
                .connect(1, 2)
                .connect(2, "True", 3, "Input")
                .connect(2, "False", 4, "Input")
                .build();
        GeneratedUnits units = generate(xml);

        Assertions.assertEquals(List.of(
                "df_2 = df_1[(df_1['Amount'] > 1000)]",
                "df_2_false = df_1[~(df_1['Amount'] > 1000)]"), unit(units, 2).getStatements());
        Assertions.assertEquals(List.of("df_2"), unit(units, 3).getInputVariables());
        Assertions.assertEquals("df_3 = df_2", unit(units, 3).getStatements().get(0));
        Assertions.assertEquals("df_4 = df_2_false", unit(units, 4).getStatements().get(0));
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Join 未指定类型, Right 连线在文档中先出现
     * 预期: 默认内连接, 左右输入按锚点而不是文档顺序确定
     */
    @Test
    public void testJoin_DefaultsToInnerJoin() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>orders.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>customers.csv</File>")
                .node(3, "AlteryxJoin", "<JoinInfo connection=\"Left\"><Field field=\"CustomerID\"/></JoinInfo>"
                        + "<JoinInfo connection=\"Right\"><Field field=\"ID\"/></JoinInfo>")
                .connect(2, "Output", 3, "Right")
                .connect(1, "Output", 3, "Left")
                .build();
        GeneratedUnits units = generate(xml);

        CodeUnit join = unit(units, 3);
        Assertions.assertEquals(
                "df_3 = pd.merge(df_1, df_2, left_on=['CustomerID'], right_on=['ID'], how='inner')",
                join.getStatements().get(0));
        Assertions.assertEquals(1, join.getStatements().size());
        Assertions.assertEquals("df_3", join.getOutputVariable());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Join 缺少键
     * 预期: 警告并透传左输入
     */
    @Test
    public void testJoin_MissingKeysPassesLeftThrough() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>b.csv</File>")
                .node(3, "AlteryxJoin", "")
                .connect(1, "Output", 3, "Left")
                .connect(2, "Output", 3, "Right")
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_3 = df_1"), unit(units, 3).getStatements());
        Assertions.assertEquals(1, units.getDiagnostics().forTool(ToolId.of(3)).size());
    }

    /**
     * 场景: 中间夹一个无法识别的工具
     * 预期: 占位片段透传上游, 下游变量链不断, 生成阶段不再重复警告
     */
    @Test
    public void testUnsupportedTool_KeepsChainIntact() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "VendorFuzzyMatch", "")
                .node(3, "AlteryxSort", "<SortInfo><Field field=\"Amount\" order=\"Descending\"/></SortInfo>")
                .connect(1, 2)
                .connect(2, 3)
                .build();
        GeneratedUnits units = generate(xml);

        CodeUnit stub = unit(units, 2);
        Assertions.assertEquals("Tool 2: Unsupported tool 'VendorFuzzyMatch'", stub.getHeader());
        Assertions.assertEquals(List.of(
                "# Manual implementation required: tool type 'VendorFuzzyMatch' has no translation",
                "df_2 = df_1"), stub.getStatements());
        Assertions.assertEquals(
                "df_3 = df_2.sort_values(by=['Amount'], ascending=[False], kind='mergesort')",
                unit(units, 3).getStatements().get(0));
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Summarize 分组求和, 另含一个不支持的动作
     * 预期: 命名聚合; 不支持的字段跳过并警告
     */
    @Test
    public void testSummarize_GroupedAggregation() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSummarize", "<SummarizeFields>"
                        + "<SummarizeField field=\"Region\" action=\"GroupBy\" rename=\"Region\"/>"
                        + "<SummarizeField field=\"Amount\" action=\"Sum\" rename=\"Total\"/>"
                        + "<SummarizeField field=\"Amount\" action=\"Percentile\" rename=\"P90\"/>"
                        + "</SummarizeFields>")
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);

        Assertions.assertEquals(List.of(
                "df_2 = df_1.groupby(['Region'], as_index=False, dropna=False).agg(**{",
                "    'Total': ('Amount', 'sum'),",
                "})"), unit(units, 2).getStatements());
        Assertions.assertEquals(1, units.getDiagnostics().size());
        Assertions.assertTrue(units.getDiagnostics().asList().get(0).getMessage().contains("Percentile"));
    }

    /**
     * 场景: Formula 依次计算两个字段, 第二个声明为字符串类型
     * 预期: 按顺序赋值, 数值结果按声明类型转换
     */
    @Test
    public void testFormula_AssignsInOrderWithCoercion() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxFormula", "<FormulaFields>"
                        + "<FormulaField expression=\"[Amount] * 2\" field=\"Double\" type=\"Double\"/>"
                        + "<FormulaField expression=\"[Double] + 1\" field=\"Label\" type=\"V_WString\"/>"
                        + "</FormulaFields>")
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);

        Assertions.assertEquals(List.of(
                "df_2 = df_1.copy()",
                "df_2['Double'] = (df_2['Amount'] * 2)",
                "df_2['Label'] = pd.Series((df_2['Double'] + 1), index=df_2.index).astype(str)"),
                unit(units, 2).getStatements());
    }

    /**
     * 场景: 工具注解跨两行
     * 预期: 标题折叠为单行, 不会把第二行带出注释
     */
    @Test
    public void testHeader_MultiLineAnnotationCollapsed() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>sales.csv</File>", "Load sales\nfor Q1 reporting")
                .build();
        CodeUnit input = unit(generate(xml), 1);
        Assertions.assertEquals("Tool 1: Input Data (Load sales for Q1 reporting)", input.getHeader());
    }

    /**
     * 场景: 公式中的整数带前导零
     * 预期: 写成 Python 3 合法的整数字面量
     */
    @Test
    public void testFilter_LeadingZeroNumberNormalized() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxFilter", "<Mode>Custom</Mode><Expression>[Code] = 007</Expression>")
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_2 = df_1[(df_1['Code'] == 7)]"), unit(units, 2).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: 简单模式过滤, 比较值是带反斜杠的 Windows 路径
     * 预期: 反斜杠原样保留, 不被当成 \n \t 转义
     */
    @Test
    public void testFilter_SimpleModeKeepsBackslashes() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxFilter", "<Mode>Simple</Mode><Simple><Field>Path</Field><Operator>=</Operator>"
                        + "<Operands><Operand>C:\\new\\table</Operand></Operands></Simple>")
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_2 = df_1[(df_1['Path'] == 'C:\\\\new\\\\table')]"),
                unit(units, 2).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: 简单模式过滤, 比较值是补零的编码
     * 预期: 按文本比较, 不转成数值
     */
    @Test
    public void testFilter_SimpleModeZeroPaddedOperandStaysText() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxFilter", "<Mode>Simple</Mode><Simple><Field>Zip</Field><Operator>=</Operator>"
                        + "<Operands><Operand>02134</Operand></Operands></Simple>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of("df_2 = df_1[(df_1['Zip'] == '02134')]"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Sort 两个键, 主键升序, 次键降序
     * 预期: by 与 ascending 保持配置顺序
     */
    @Test
    public void testSort_MultipleKeysKeepOrder() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSort", "<SortInfo><Field field=\"Region\" order=\"Ascending\"/>"
                        + "<Field field=\"Amount\" order=\"Descending\"/></SortInfo>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1.sort_values(by=['Region', 'Amount'], ascending=[True, False], kind='mergesort')"),
                unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: 默认区域设置为土耳其语, 排序方向与布尔值大写
     * 预期: 大小写转换与区域设置无关
     */
    @Test
    public void testSort_UpperCaseOrderUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            String xml = WorkflowDocuments.workflow()
                    .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                    .node(2, "AlteryxSort", "<SortInfo><Field field=\"Amount\" order=\"DESCENDING\"/></SortInfo>")
                    .node(3, "AlteryxSelect", "<SelectFields><SelectField field=\"Notes\" selected=\"FALSE\"/></SelectFields>")
                    .connect(1, 2)
                    .connect(2, 3)
                    .build();
            GeneratedUnits units = generate(xml);
            Assertions.assertEquals(List.of(
                    "df_2 = df_1.sort_values(by=['Amount'], ascending=[False], kind='mergesort')"),
                    unit(units, 2).getStatements());
            Assertions.assertEquals(List.of("df_3 = df_2.drop(columns=['Notes'])"), unit(units, 3).getStatements());
        } finally {
            Locale.setDefault(original);
        }
    }

    private String joinOfType(String joinType) {
        return WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>orders.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>customers.csv</File>")
                .node(3, "AlteryxJoin", "<JoinType>" + joinType + "</JoinType>"
                        + "<JoinInfo connection=\"Left\"><Field field=\"CustomerID\"/></JoinInfo>"
                        + "<JoinInfo connection=\"Right\"><Field field=\"ID\"/></JoinInfo>")
                .connect(1, "Output", 3, "Left")
                .connect(2, "Output", 3, "Right")
                .build();
    }

    /**
     * 场景: Join 指定 left / right / outer / full
     * 预期: 映射为对应的 how, full 与 outer 相同
     */
    @Test
    public void testJoin_Kinds() {
        Map<String, String> expected = Map.of(
                "Left", "left",
                "right", "right",
                "Outer", "outer",
                "Full", "outer");
        for (Map.Entry<String, String> e : expected.entrySet()) {
            GeneratedUnits units = generate(joinOfType(e.getKey()));
            Assertions.assertEquals(List.of("df_3 = pd.merge(df_1, df_2, left_on=['CustomerID'], right_on=['ID'], how='"
                    + e.getValue() + "')"), unit(units, 3).getStatements(), e.getKey());
            Assertions.assertTrue(units.getDiagnostics().isEmpty(), e.getKey());
        }
    }

    /**
     * 场景: Join 类型为 exclude
     * 预期: 外连接加 indicator, 只保留两侧未匹配的记录
     */
    @Test
    public void testJoin_ExcludeKeepsUnmatchedOnly() {
        Assertions.assertEquals(List.of(
                "df_3 = pd.merge(df_1, df_2, left_on=['CustomerID'], right_on=['ID'], how='outer', indicator=True)",
                "df_3 = df_3[df_3['_merge'] != 'both'].drop(columns=['_merge'])"),
                unit(generate(joinOfType("Exclude")), 3).getStatements());
    }

    /**
     * 场景: Summarize 计数去重/平均/首个/计数
     * 预期: nunique/mean/first/size, 无 rename 时用 动作_字段 命名
     */
    @Test
    public void testSummarize_OtherActions() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSummarize", "<SummarizeFields>"
                        + "<SummarizeField field=\"Region\" action=\"GroupBy\" rename=\"Region\"/>"
                        + "<SummarizeField field=\"Customer\" action=\"CountDistinct\" rename=\"Customers\"/>"
                        + "<SummarizeField field=\"Amount\" action=\"Avg\"/>"
                        + "<SummarizeField field=\"OrderDate\" action=\"First\" rename=\"FirstOrder\"/>"
                        + "<SummarizeField field=\"Amount\" action=\"Count\" rename=\"Rows\"/>"
                        + "</SummarizeFields>")
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of(
                "df_2 = df_1.groupby(['Region'], as_index=False, dropna=False).agg(**{",
                "    'Customers': ('Customer', 'nunique'),",
                "    'Avg_Amount': ('Amount', 'mean'),",
                "    'FirstOrder': ('OrderDate', 'first'),",
                "    'Rows': ('Amount', 'size'),",
                "})"), unit(units, 2).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Select 未勾选 *Unknown, 同时改类型与重命名
     * 预期: 只保留显式选中的字段, 再 astype 与 rename
     */
    @Test
    public void testSelect_UnknownFieldsDropped() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSelect", "<SelectFields>"
                        + "<SelectField field=\"Region\" selected=\"True\" rename=\"Area\"/>"
                        + "<SelectField field=\"Amount\" selected=\"True\" type=\"Double\"/>"
                        + "<SelectField field=\"Notes\" selected=\"False\"/>"
                        + "<SelectField field=\"*Unknown\" selected=\"False\"/>"
                        + "</SelectFields>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1[['Region', 'Amount']].copy()",
                "df_2 = df_2.astype({'Amount': 'float64'})",
                "df_2 = df_2.rename(columns={'Region': 'Area'})"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Select 保留 *Unknown
     * 预期: 只删除未选中的字段
     */
    @Test
    public void testSelect_UnknownFieldsKept() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSelect", "<SelectFields>"
                        + "<SelectField field=\"Notes\" selected=\"False\"/>"
                        + "<SelectField field=\"*Unknown\" selected=\"True\"/>"
                        + "</SelectFields>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of("df_2 = df_1.drop(columns=['Notes'])"), unit(generate(xml), 2).getStatements());
    }

    private static String sample(String mode, String n) {
        return "<Mode>" + mode + "</Mode><N>" + n + "</N>";
    }

    /**
     * 场景: Sample 各模式, First 带分组
     * 预期: head / tail / iloc 切片 / 固定种子随机
     */
    @Test
    public void testSample_Modes() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSample", sample("First", "5"))
                .node(3, "AlteryxSample", sample("Last", "5"))
                .node(4, "AlteryxSample", sample("Skip", "5"))
                .node(5, "AlteryxSample", sample("1 of N", "5"))
                .node(6, "AlteryxSample", sample("Random", "5"))
                .node(7, "AlteryxSample", sample("First", "5") + "<GroupFields><Field field=\"Region\"/></GroupFields>")
                .connect(1, 2).connect(1, 3).connect(1, 4).connect(1, 5).connect(1, 6).connect(1, 7)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_2 = df_1.head(5)"), unit(units, 2).getStatements());
        Assertions.assertEquals(List.of("df_3 = df_1.tail(5)"), unit(units, 3).getStatements());
        Assertions.assertEquals(List.of("df_4 = df_1.iloc[5:]"), unit(units, 4).getStatements());
        Assertions.assertEquals(List.of("df_5 = df_1.iloc[::5]"), unit(units, 5).getStatements());
        Assertions.assertEquals(List.of("df_6 = df_1.sample(n=min(5, len(df_1)), random_state=42)"),
                unit(units, 6).getStatements());
        Assertions.assertEquals(List.of("df_7 = df_1.groupby(['Region'], sort=False).head(5)"),
                unit(units, 7).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Sample 每 N 条取一条, N 配置为 0
     * 预期: 视同缺失, 警告并使用默认值
     */
    @Test
    public void testSample_NonPositiveCountFallsBack() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxSample", sample("1 of N", "0"))
                .connect(1, 2)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_2 = df_1.iloc[::100]"), unit(units, 2).getStatements());
        Assertions.assertEquals(1, units.getDiagnostics().forTool(ToolId.of(2)).size());
    }

    /**
     * 场景: Union 按名称与按位置
     * 预期: 按连线顺序拼接; ByPos 时后续输入套用第一个输入的列名
     */
    @Test
    public void testUnion_ByNameAndByPosition() {
        String byName = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>b.csv</File>")
                .node(3, "AlteryxUnion", "")
                .connect(1, 3)
                .connect(2, 3)
                .build();
        Assertions.assertEquals(List.of("df_3 = pd.concat([df_1, df_2], ignore_index=True)"),
                unit(generate(byName), 3).getStatements());

        String byPosition = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>b.csv</File>")
                .node(3, "AlteryxUnion", "<Mode>ByPos</Mode>")
                .connect(1, 3)
                .connect(2, 3)
                .build();
        Assertions.assertEquals(List.of(
                "df_3 = pd.concat([df_1, df_2.set_axis(df_1.columns[:len(df_2.columns)], axis=1)], ignore_index=True)"),
                unit(generate(byPosition), 3).getStatements());
    }

    /**
     * 场景: Unique 的 Unique 与 Duplicates 两个锚点都连到下游
     * 预期: 重复记录单独绑定变量
     */
    @Test
    public void testUnique_DuplicatesAnchor() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxUnique", "<UniqueFields><Field field=\"CustomerID\"/></UniqueFields>")
                .node(3, "AlteryxDbFileOutput", "<File>unique.csv</File>")
                .node(4, "AlteryxDbFileOutput", "<File>dupes.csv</File>")
                .connect(1, 2)
                .connect(2, "Unique", 3, "Input")
                .connect(2, "Duplicates", 4, "Input")
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of(
                "df_2 = df_1.drop_duplicates(subset=['CustomerID'])",
                "df_2_duplicates = df_1[df_1.duplicated(subset=['CustomerID'])]"), unit(units, 2).getStatements());
        Assertions.assertEquals("df_3 = df_2", unit(units, 3).getStatements().get(0));
        Assertions.assertEquals("df_4 = df_2_duplicates", unit(units, 4).getStatements().get(0));
    }

    /**
     * 场景: Record ID 默认配置, 以及自定义字段名/起始值/末尾位置
     */
    @Test
    public void testRecordId_DefaultAndCustom() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxRecordID", "")
                .node(3, "AlteryxRecordID", "<FieldName>RowNum</FieldName><StartValue>10</StartValue><Position>1</Position>")
                .connect(1, 2)
                .connect(1, 3)
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of(
                "df_2 = df_1.copy()",
                "df_2.insert(0, 'RecordID', range(1, len(df_2) + 1))"), unit(units, 2).getStatements());
        Assertions.assertEquals(List.of(
                "df_3 = df_1.copy()",
                "df_3['RowNum'] = range(10, len(df_3) + 10)"), unit(units, 3).getStatements());
    }

    /**
     * 场景: Text To Columns 拆分到三列
     * 预期: 根名加序号, 列数不足时 reindex 补齐
     */
    @Test
    public void testTextToColumns_SplitToColumns() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxTextToColumns", "<Field>Address</Field><RootName>Part</RootName>"
                        + "<Delimeters value=\",\"/><NumFields value=\"3\"/>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1.copy()",
                "df_2[['Part1', 'Part2', 'Part3']] = df_2['Address'].astype(str).str.split(',', n=2, expand=True)"
                        + ".reindex(columns=range(3))"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Text To Columns 拆分到多行, 两个分隔符
     * 预期: 字符类正则拆分后 explode
     */
    @Test
    public void testTextToColumns_SplitToRows() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxTextToColumns", "<Field>Tags</Field><Delimeters value=\",;\"/>"
                        + "<SplitToRows value=\"True\"/>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1.copy()",
                "df_2['Tags'] = df_2['Tags'].astype(str).str.split('[,;]', regex=True)",
                "df_2 = df_2.explode('Tags', ignore_index=True)"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Cross Tab 按地区分组, 季度为列头, 求平均
     */
    @Test
    public void testCrossTab_Pivot() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxCrossTab", "<GroupFields><Field field=\"Region\"/></GroupFields>"
                        + "<HeaderField field=\"Quarter\"/><DataField field=\"Sales\"/>"
                        + "<Methods><Method method=\"Avg\"/></Methods>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = pd.pivot_table(df_1, index=['Region'], columns='Quarter', values='Sales', aggfunc='mean')"
                        + ".reset_index()",
                "df_2.columns.name = None"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Transpose 一个键字段, 两个选中的数据字段
     * 预期: melt, 未选中的字段不展开
     */
    @Test
    public void testTranspose_Melt() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxTranspose", "<KeyFields><Field field=\"Region\"/></KeyFields>"
                        + "<DataFields><Field field=\"Q1\" selected=\"True\"/><Field field=\"Q2\" selected=\"True\"/>"
                        + "<Field field=\"Notes\" selected=\"False\"/></DataFields>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1.melt(id_vars=['Region'], value_vars=['Q1', 'Q2'], var_name='Name', value_name='Value')"),
                unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Text Input 含补零的邮编、普通数值、文本与空单元格
     * 预期: 补零的值保留为字符串, 其余数值按字面量写出
     */
    @Test
    public void testTextInput_Rows() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxTextInput", "<Fields><Field name=\"Zip\"/><Field name=\"Count\"/><Field name=\"City\"/></Fields>"
                        + "<Data><r><c>02134</c><c>5</c><c>Boston</c></r><r><c>10001</c><c>12</c><c></c></r></Data>")
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of(
                "df_1 = pd.DataFrame(",
                "    [",
                "        ['02134', 5, 'Boston'],",
                "        [10001, 12, None],",
                "    ],",
                "    columns=['Zip', 'Count', 'City'],",
                ")"), unit(units, 1).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: Multi-Field Formula 打开 CopyOutput, 前缀 Dbl_
     * 预期: 每个选中字段写入带前缀的新字段
     */
    @Test
    public void testMultiFieldFormula_CopyOutput() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(2, "AlteryxMultiFieldFormula", "<Expression>[_CurrentField_] * 2</Expression>"
                        + "<Fields><Field name=\"Q1\" selected=\"True\"/><Field name=\"Q2\"/>"
                        + "<Field name=\"*Unknown\" selected=\"False\"/></Fields>"
                        + "<CopyOutput value=\"True\"/><NewFieldAddOn>Dbl_</NewFieldAddOn>")
                .connect(1, 2)
                .build();
        Assertions.assertEquals(List.of(
                "df_2 = df_1.copy()",
                "df_2['Dbl_Q1'] = (df_2['Q1'] * 2)",
                "df_2['Dbl_Q2'] = (df_2['Q2'] * 2)"), unit(generate(xml), 2).getStatements());
    }

    /**
     * 场景: Append Fields, Targets 与 Source 连线
     * 预期: 笛卡尔积
     */
    @Test
    public void testAppendFields_CrossJoin() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>orders.csv</File>")
                .node(2, "AlteryxDbFileInput", "<File>rates.csv</File>")
                .node(3, "AlteryxAppendFields", "")
                .connect(2, "Output", 3, "Source")
                .connect(1, "Output", 3, "Targets")
                .build();
        Assertions.assertEquals(List.of("df_3 = df_1.merge(df_2, how='cross')"), unit(generate(xml), 3).getStatements());
    }

    /**
     * 场景: Input Data 各种文件格式
     * 预期: 按扩展名选读取函数; 分隔文本默认制表符; Excel 表名去掉反引号与 $
     */
    @Test
    public void testInputData_Formats() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>data.tsv</File>")
                .node(2, "AlteryxDbFileInput", "<File>data.txt</File><FormatSpecificOptions>"
                        + "<Delimeter>|</Delimeter><HeaderRow>False</HeaderRow></FormatSpecificOptions>")
                .node(3, "AlteryxDbFileInput", "<File>events.json</File>")
                .node(4, "AlteryxDbFileInput", "<File>facts.parquet</File>")
                .node(5, "AlteryxDbFileInput", "<File>book.xlsx|||`Sheet1$`</File>")
                .build();
        GeneratedUnits units = generate(xml);
        Assertions.assertEquals(List.of("df_1 = pd.read_csv('data.tsv', sep='\\t')"), unit(units, 1).getStatements());
        Assertions.assertEquals(List.of("df_2 = pd.read_csv('data.txt', sep='|', header=None)"), unit(units, 2).getStatements());
        Assertions.assertEquals(List.of("df_3 = pd.read_json('events.json')"), unit(units, 3).getStatements());
        Assertions.assertEquals(List.of("df_4 = pd.read_parquet('facts.parquet')"), unit(units, 4).getStatements());
        Assertions.assertEquals(List.of("df_5 = pd.read_excel('book.xlsx', sheet_name='Sheet1')"), unit(units, 5).getStatements());
        Assertions.assertTrue(units.getDiagnostics().isEmpty());
    }

    /**
     * 场景: 注释工具
     * 预期: 只有注释行, 不绑定输出变量
     */
    @Test
    public void testComment_IsDocumentationOnly() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxGuiToolkit.TextBox.TextBox", "<Text>Load data\nthen clean</Text>")
                .build();
        CodeUnit comment = unit(generate(xml), 1);
        Assertions.assertTrue(comment.isDocumentation());
        Assertions.assertEquals(List.of("# Load data", "# then clean"), comment.getStatements());
        Assertions.assertTrue(comment.getRequirements().isEmpty());
    }

    /**
     * 场景: 打开行数跟踪
     * 预期: 数据工具末尾追加 print
     */
    @Test
    public void testTraceRowCounts() {
        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .build();
        ConverterConfig config = ConverterConfig.builder().traceRowCounts(true).build();
        CodeUnit input = unit(generate(xml, new CodeGenerator(config)), 1);
        Assertions.assertEquals(List.of(
                "df_1 = pd.read_csv('a.csv')",
                "print('Tool 1:', len(df_1), 'rows')"), input.getStatements());
    }

    /**
     * 场景: 某个生成器内部抛出运行时异常
     * 预期: 被包装为带工具ID的 GenerationException
     */
    @Test
    public void testGeneratorFailure_WrappedWithToolId() {
        Map<ToolType, ToolGenerator> generators = new EnumMap<>(ToolType.class);
        for (ToolType type : ToolType.values()) {
            generators.put(type, (tool, context) -> context.newUnit().build());
        }
        generators.put(ToolType.SORT, (tool, context) -> {
            throw new IllegalArgumentException("boom");
        });
        CodeGenerator generator = new CodeGenerator(new ToolGenerators(generators), new ExpressionTranslator(), CONFIG);

        String xml = WorkflowDocuments.workflow()
                .node(1, "AlteryxDbFileInput", "<File>a.csv</File>")
                .node(5, "AlteryxSort", "")
                .connect(1, 5)
                .build();
        GenerationException e = Assertions.assertThrows(GenerationException.class, () -> generate(xml, generator));
        Assertions.assertEquals(ToolId.of(5), e.getToolId());
        Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
    }
}

package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.script.Requirement;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static cn.hjw.dev.flowscript.expr.CallRenderer.byArity;
import static cn.hjw.dev.flowscript.expr.CallRenderer.fold;
import static cn.hjw.dev.flowscript.expr.CallRenderer.template;

/**
 * 公式函数 -> pandas/numpy 的映射表
 * 有限且只读; 不在表内的函数一律生成占位符
 */
public final class FunctionTable {

    private static final Set<Requirement> NP = Collections.unmodifiableSet(EnumSet.of(Requirement.NUMPY));
    private static final Set<Requirement> PD = Collections.unmodifiableSet(EnumSet.of(Requirement.PANDAS));

    private static final FunctionTable STANDARD = buildStandard();

    private final Map<String, FunctionMapping> mappings;

    private FunctionTable(Map<String, FunctionMapping> mappings) {
        this.mappings = Collections.unmodifiableMap(mappings);
    }

    public static FunctionTable standard() {
        return STANDARD;
    }

    /**
     * 按名称查找, 忽略大小写
     */
    public Optional<FunctionMapping> lookup(String name) {
        return Optional.ofNullable(mappings.get(name.toUpperCase(Locale.ROOT)));
    }

    public Set<String> names() {
        return mappings.keySet();
    }

    private static FunctionTable buildStandard() {
        Map<String, FunctionMapping> m = new LinkedHashMap<>();

        // --- 条件与空值 ---
        put(m, FunctionMapping.builder().name("IIF").minArity(3).maxArity(3)
                .kindFromArgument(1).requirements(NP)
                .renderer(template("np.where({0}, {1}, {2})")));
        put(m, FunctionMapping.builder().name("ISNULL").minArity(1).maxArity(1)
                .resultKind(ValueKind.BOOLEAN).requirements(PD)
                .renderer(template("pd.isna({0})")));
        put(m, FunctionMapping.builder().name("ISEMPTY").minArity(1).maxArity(1)
                .resultKind(ValueKind.BOOLEAN).requirements(PD)
                .renderer(template("(pd.isna({0}) | ({0} == ''))")));
        put(m, FunctionMapping.builder().name("NULL").minArity(0).maxArity(0)
                .resultKind(ValueKind.UNKNOWN).requirements(NP)
                .renderer(template("np.nan")));

        // --- 类型转换 ---
        put(m, FunctionMapping.builder().name("TONUMBER").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(PD)
                .note("non-numeric text becomes NaN")
                .renderer(template("pd.to_numeric({0}, errors='coerce')")));
        put(m, FunctionMapping.builder().name("TOSTRING").minArity(1).maxArity(2)
                .resultKind(ValueKind.STRING)
                .renderer(byArity(1, "{r0}.astype(str)", "{r0}.round({1}).astype(str)")));

        // --- 字符串 ---
        put(m, FunctionMapping.builder().name("TRIM").minArity(1).maxArity(2)
                .resultKind(ValueKind.STRING)
                .renderer(byArity(1, "{r0}.str.strip()", "{r0}.str.strip({1})")));
        put(m, FunctionMapping.builder().name("TRIMLEFT").minArity(1).maxArity(2)
                .resultKind(ValueKind.STRING)
                .renderer(byArity(1, "{r0}.str.lstrip()", "{r0}.str.lstrip({1})")));
        put(m, FunctionMapping.builder().name("TRIMRIGHT").minArity(1).maxArity(2)
                .resultKind(ValueKind.STRING)
                .renderer(byArity(1, "{r0}.str.rstrip()", "{r0}.str.rstrip({1})")));
        put(m, FunctionMapping.builder().name("UPPERCASE").minArity(1).maxArity(1)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str.upper()")));
        put(m, FunctionMapping.builder().name("LOWERCASE").minArity(1).maxArity(1)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str.lower()")));
        put(m, FunctionMapping.builder().name("TITLECASE").minArity(1).maxArity(1)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str.title()")));
        put(m, FunctionMapping.builder().name("LENGTH").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).renderer(template("{r0}.str.len()")));
        put(m, FunctionMapping.builder().name("LEFT").minArity(2).maxArity(2)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str[:{1}]")));
        put(m, FunctionMapping.builder().name("RIGHT").minArity(2).maxArity(2)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str[-{1}:]")));
        put(m, FunctionMapping.builder().name("SUBSTRING").minArity(2).maxArity(3)
                .resultKind(ValueKind.STRING)
                .renderer(byArity(2, "{r0}.str[{1}:]", "{r0}.str[{1}:({1}) + ({2})]")));
        put(m, FunctionMapping.builder().name("CONTAINS").minArity(2).maxArity(3)
                .resultKind(ValueKind.BOOLEAN)
                .renderer(byArity(2,
                        "{r0}.str.contains({1}, case=False, regex=False)",
                        "{r0}.str.contains({1}, case=not ({2}), regex=False)")));
        put(m, FunctionMapping.builder().name("STARTSWITH").minArity(2).maxArity(2)
                .resultKind(ValueKind.BOOLEAN)
                .note("compared case-insensitively")
                .renderer(template("{r0}.str.lower().str.startswith({r1}.lower())")));
        put(m, FunctionMapping.builder().name("ENDSWITH").minArity(2).maxArity(2)
                .resultKind(ValueKind.BOOLEAN)
                .note("compared case-insensitively")
                .renderer(template("{r0}.str.lower().str.endswith({r1}.lower())")));
        put(m, FunctionMapping.builder().name("REPLACE").minArity(3).maxArity(3)
                .resultKind(ValueKind.STRING)
                .renderer(template("{r0}.str.replace({1}, {2}, regex=False)")));
        put(m, FunctionMapping.builder().name("REGEX_MATCH").minArity(2).maxArity(3)
                .resultKind(ValueKind.BOOLEAN)
                .renderer(byArity(2,
                        "{r0}.str.fullmatch({1})",
                        "{r0}.str.fullmatch({1}, case=not ({2}))")));
        put(m, FunctionMapping.builder().name("REGEX_REPLACE").minArity(3).maxArity(3)
                .resultKind(ValueKind.STRING)
                .note("replacement back-references use Python syntax")
                .renderer(template("{r0}.str.replace({1}, {2}, regex=True)")));
        put(m, FunctionMapping.builder().name("PADLEFT").minArity(3).maxArity(3)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str.rjust({1}, {2})")));
        put(m, FunctionMapping.builder().name("PADRIGHT").minArity(3).maxArity(3)
                .resultKind(ValueKind.STRING).renderer(template("{r0}.str.ljust({1}, {2})")));

        // --- 数学 ---
        unaryMath(m, "ABS", "np.abs");
        unaryMath(m, "CEIL", "np.ceil");
        unaryMath(m, "FLOOR", "np.floor");
        unaryMath(m, "SQRT", "np.sqrt");
        unaryMath(m, "EXP", "np.exp");
        unaryMath(m, "LOG", "np.log");
        unaryMath(m, "LOG10", "np.log10");
        put(m, FunctionMapping.builder().name("ROUND").minArity(2).maxArity(2)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .note("rounds half to even")
                .renderer(template("(np.round(({0}) / ({1})) * ({1}))")));
        put(m, FunctionMapping.builder().name("POW").minArity(2).maxArity(2)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .renderer(template("np.power({0}, {1})")));
        put(m, FunctionMapping.builder().name("MOD").minArity(2).maxArity(2)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .renderer(template("np.mod({0}, {1})")));
        put(m, FunctionMapping.builder().name("MIN").minArity(2).maxArity(FunctionMapping.VARIADIC)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .renderer(fold("np.minimum")));
        put(m, FunctionMapping.builder().name("MAX").minArity(2).maxArity(FunctionMapping.VARIADIC)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .renderer(fold("np.maximum")));
        put(m, FunctionMapping.builder().name("RANDINT").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .note("one random value for the whole column")
                .renderer(template("np.random.randint(0, ({0}) + 1)")));

        // --- 日期 ---
        put(m, FunctionMapping.builder().name("DATETIMENOW").minArity(0).maxArity(0)
                .resultKind(ValueKind.DATE).requirements(PD)
                .renderer(template("pd.Timestamp.now()")));
        put(m, FunctionMapping.builder().name("DATETIMETODAY").minArity(0).maxArity(0)
                .resultKind(ValueKind.DATE).requirements(PD)
                .renderer(template("pd.Timestamp.today().normalize()")));
        put(m, FunctionMapping.builder().name("DATETIMEPARSE").minArity(2).maxArity(2)
                .resultKind(ValueKind.DATE).requirements(PD)
                .note("format specifiers must follow strftime")
                .renderer(template("pd.to_datetime({0}, format={1}, errors='coerce')")));
        put(m, FunctionMapping.builder().name("TODATE").minArity(1).maxArity(1)
                .resultKind(ValueKind.DATE).requirements(PD)
                .renderer(template("pd.to_datetime({0}, errors='coerce').dt.normalize()")));
        put(m, FunctionMapping.builder().name("DATETIMEADD").minArity(3).maxArity(3)
                .resultKind(ValueKind.DATE).requirements(PD)
                .note("month and year units are not supported by to_timedelta")
                .renderer(template("(pd.to_datetime({0}) + pd.to_timedelta({1}, unit={2}))")));
        put(m, FunctionMapping.builder().name("DATETIMEDIFF").minArity(3).maxArity(3)
                .resultKind(ValueKind.NUMERIC).requirements(PD)
                .renderer(template("((pd.to_datetime({0}) - pd.to_datetime({1})) / pd.Timedelta(1, unit={2}))")));
        put(m, FunctionMapping.builder().name("DATETIMEYEAR").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(PD)
                .renderer(template("pd.to_datetime({0}).dt.year")));
        put(m, FunctionMapping.builder().name("DATETIMEMONTH").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(PD)
                .renderer(template("pd.to_datetime({0}).dt.month")));
        put(m, FunctionMapping.builder().name("DATETIMEDAY").minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(PD)
                .renderer(template("pd.to_datetime({0}).dt.day")));
        put(m, FunctionMapping.builder().name("DATETIMEFORMAT").minArity(2).maxArity(2)
                .resultKind(ValueKind.STRING).requirements(PD)
                .note("format specifiers must follow strftime")
                .renderer(template("pd.to_datetime({0}).dt.strftime({1})")));

        return new FunctionTable(m);
    }

    private static void unaryMath(Map<String, FunctionMapping> m, String name, String target) {
        put(m, FunctionMapping.builder().name(name).minArity(1).maxArity(1)
                .resultKind(ValueKind.NUMERIC).requirements(NP)
                .renderer(template(target + "({0})")));
    }

    private static void put(Map<String, FunctionMapping> m, FunctionMapping.FunctionMappingBuilder builder) {
        FunctionMapping mapping = builder.build();
        m.put(mapping.getName(), mapping);
    }
}

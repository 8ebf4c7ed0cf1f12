package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.expr.ValueKind;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.Locale;
import java.util.Map;

/**
 * 工作流字段类型 -> 表达式值类型 / pandas dtype
 */
final class FieldTypes {

    private static final Map<String, ValueKind> KINDS = Map.ofEntries(
            Map.entry("byte", ValueKind.NUMERIC),
            Map.entry("int16", ValueKind.NUMERIC),
            Map.entry("int32", ValueKind.NUMERIC),
            Map.entry("int64", ValueKind.NUMERIC),
            Map.entry("float", ValueKind.NUMERIC),
            Map.entry("double", ValueKind.NUMERIC),
            Map.entry("fixeddecimal", ValueKind.NUMERIC),
            Map.entry("string", ValueKind.STRING),
            Map.entry("wstring", ValueKind.STRING),
            Map.entry("v_string", ValueKind.STRING),
            Map.entry("v_wstring", ValueKind.STRING),
            Map.entry("date", ValueKind.DATE),
            Map.entry("datetime", ValueKind.DATE),
            Map.entry("time", ValueKind.DATE),
            Map.entry("bool", ValueKind.BOOLEAN));

    private static final Map<String, String> DTYPES = Map.ofEntries(
            Map.entry("byte", "Int64"),
            Map.entry("int16", "Int64"),
            Map.entry("int32", "Int64"),
            Map.entry("int64", "Int64"),
            Map.entry("float", "float64"),
            Map.entry("double", "float64"),
            Map.entry("fixeddecimal", "float64"),
            Map.entry("string", "string"),
            Map.entry("wstring", "string"),
            Map.entry("v_string", "string"),
            Map.entry("v_wstring", "string"),
            Map.entry("bool", "boolean"));

    private FieldTypes() {
    }

    static ValueKind kindOf(String fieldType) {
        if (fieldType == null) {
            return ValueKind.UNKNOWN;
        }
        return KINDS.getOrDefault(fieldType.trim().toLowerCase(Locale.ROOT), ValueKind.UNKNOWN);
    }

    /**
     * astype 可用的 dtype; 日期类型与未知类型返回 null
     */
    static String dtypeOf(String fieldType) {
        if (fieldType == null) {
            return null;
        }
        return DTYPES.get(fieldType.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 按声明类型转换表达式结果, 类型一致或无法判断时原样返回
     * @param frame 目标 DataFrame, 标量结果需要按它的行索引展开
     */
    static String coerce(String code, ValueKind actual, String fieldType, String frame) {
        ValueKind declared = kindOf(fieldType);
        if (declared == ValueKind.UNKNOWN || declared == actual) {
            return code;
        }
        switch (declared) {
            case NUMERIC:
                return actual == ValueKind.STRING ? "pd.to_numeric(" + code + ", errors='coerce')" : code;
            case STRING:
                if (actual == ValueKind.NUMERIC || actual == ValueKind.DATE || actual == ValueKind.BOOLEAN) {
                    return "pd.Series(" + code + ", index=" + frame + ".index).astype(str)";
                }
                return code;
            case DATE:
                return actual == ValueKind.STRING ? "pd.to_datetime(" + code + ", errors='coerce')" : code;
            default:
                return code;
        }
    }

    static String dtypeLiteral(String fieldType) {
        String dtype = dtypeOf(fieldType);
        return dtype == null ? null : PythonSyntax.string(dtype);
    }
}

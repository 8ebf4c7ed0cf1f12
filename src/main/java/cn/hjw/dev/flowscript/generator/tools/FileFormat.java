package cn.hjw.dev.flowscript.generator.tools;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * 按扩展名区分的文件格式
 */
@Getter
@RequiredArgsConstructor
enum FileFormat {

    CSV("read_csv", "to_csv"),
    DELIMITED("read_csv", "to_csv"),
    EXCEL("read_excel", "to_excel"),
    JSON("read_json", "to_json"),
    PARQUET("read_parquet", "to_parquet"),
    UNKNOWN("read_csv", "to_csv");

    private final String reader;
    private final String writer;

    static FileFormat of(String path) {
        String ext = StringUtils.substringAfterLast(path, ".").toLowerCase(Locale.ROOT);
        switch (ext) {
            case "csv":
                return CSV;
            case "txt":
            case "tsv":
            case "dat":
                return DELIMITED;
            case "xlsx":
            case "xls":
            case "xlsm":
                return EXCEL;
            case "json":
                return JSON;
            case "parquet":
                return PARQUET;
            default:
                return UNKNOWN;
        }
    }

    /**
     * 文件路径可能带有表名后缀: {@code C:\data\book.xlsx|||`Sheet1$`}
     */
    static String pathPart(String file) {
        return StringUtils.substringBefore(file, "|||").trim();
    }

    /**
     * 表名后缀, 去掉反引号与结尾的 $; 没有时返回 null
     */
    static String sheetPart(String file) {
        if (!file.contains("|||")) {
            return null;
        }
        String sheet = StringUtils.substringAfter(file, "|||").trim();
        sheet = StringUtils.strip(sheet, "`");
        sheet = StringUtils.removeEnd(sheet, "$");
        return StringUtils.trimToNull(sheet);
    }

    /**
     * 配置中的分隔符写法: \t 为制表符, \s 为空格
     */
    static String decodeDelimiter(String raw) {
        switch (raw) {
            case "\\t":
                return "\t";
            case "\\s":
                return " ";
            default:
                return raw;
        }
    }
}

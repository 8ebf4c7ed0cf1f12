package cn.hjw.dev.flowscript.cli;

import cn.hjw.dev.flowscript.ConversionResult;
import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.engine.ConversionEngine;
import cn.hjw.dev.flowscript.exception.FlowScriptException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行入口
 * <pre>
 * flowscript -i workflow.yxmd -o workflow.py -d report.json
 * </pre>
 * 退出码: 0 成功, 1 转换失败 (无脚本输出), 2 参数或文件读写错误
 */
@Slf4j
public class FlowScriptCli {

    static final int EXIT_OK = 0;
    static final int EXIT_CONVERSION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String CMD_SYNTAX = "flowscript -i <workflow> [-o <script>] [-d <report>] [--trace] [--prefix <prefix>]";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        System.exit(new FlowScriptCli().run(args, System.out, System.err));
    }

    private static Options declareOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("workflow")
                .desc("Workflow document to convert").build());
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("script")
                .desc("Python script to write (default: standard output)").build());
        options.addOption(Option.builder("d").longOpt("diagnostics").hasArg().argName("report")
                .desc("JSON diagnostics report to write").build());
        options.addOption(Option.builder().longOpt("trace")
                .desc("Print row counts after each tool in the generated script").build());
        options.addOption(Option.builder().longOpt("prefix").hasArg().argName("prefix")
                .desc("Variable name prefix (default: df_)").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show usage").build());
        return options;
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Options options = declareOptions();
        CommandLine cmdLine;
        try {
            cmdLine = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            usage(options, err);
            return EXIT_USAGE;
        }
        if (cmdLine.hasOption("h")) {
            usage(options, out);
            return EXIT_OK;
        }
        if (!cmdLine.hasOption("i")) {
            err.println("Missing required option: i");
            usage(options, err);
            return EXIT_USAGE;
        }

        ConverterConfig.ConverterConfigBuilder config = ConverterConfig.builder()
                .traceRowCounts(cmdLine.hasOption("trace"));
        if (cmdLine.hasOption("prefix")) {
            config.variablePrefix(cmdLine.getOptionValue("prefix"));
        }

        Path input = Paths.get(cmdLine.getOptionValue("i"));
        Path report = cmdLine.hasOption("d") ? Paths.get(cmdLine.getOptionValue("d")) : null;
        try {
            String document = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            ConversionResult result;
            try {
                result = new ConversionEngine(config.build()).convert(document);
            } catch (FlowScriptException e) {
                err.println("Conversion failed: " + e.getMessage());
                if (report != null) {
                    writeReport(report, DiagnosticsReport.failure(e.getMessage()));
                }
                return EXIT_CONVERSION_FAILED;
            }

            if (cmdLine.hasOption("o")) {
                Files.write(Paths.get(cmdLine.getOptionValue("o")), result.getScript().getBytes(StandardCharsets.UTF_8));
            } else {
                out.print(result.getScript());
            }
            if (report != null) {
                writeReport(report, DiagnosticsReport.of(result));
            }
            result.getDiagnostics().forEach(d -> err.println(d));
            return EXIT_OK;
        } catch (IOException e) {
            log.error("I/O failure while converting {}", input, e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private void writeReport(Path path, DiagnosticsReport report) throws IOException {
        mapper.writeValue(path.toFile(), report);
    }

    private static void usage(Options options, PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, CMD_SYNTAX, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}

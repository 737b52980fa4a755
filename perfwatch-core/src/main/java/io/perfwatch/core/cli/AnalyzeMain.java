package io.perfwatch.core.cli;

import io.perfwatch.api.analysis.EmptyInputException;
import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.SampleBatch;
import io.perfwatch.api.analysis.Verdict;
import io.perfwatch.api.analysis.VerdictThresholds;
import io.perfwatch.api.report.ReportRenderer;
import io.perfwatch.core.analysis.DefaultResultAnalyzer;
import io.perfwatch.core.analysis.SampleSources;
import io.perfwatch.core.report.HtmlReportRenderer;
import io.perfwatch.core.report.JsonReportRenderer;
import io.perfwatch.core.report.TextReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analyzes a load test result file and exits with a code matching the verdict.
 * <p>
 * Run with:
 * <pre>{@code
 * java -cp perfwatch-core.jar io.perfwatch.core.cli.AnalyzeMain results.jtl \
 *   --html target/perf-report.html --json target/perf-report.json
 * }</pre>
 * Exit codes: 0 PASS, 2 UNSTABLE, 1 FAIL, 3 no usable samples, 4 usage or I/O error.
 */
public final class AnalyzeMain {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeMain.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_UNSTABLE = 2;
    static final int EXIT_EMPTY = 3;
    static final int EXIT_ERROR = 4;

    private static final String USAGE = """
            Usage: AnalyzeMain <samples-file> [options]
              --html <file>                  write an HTML report
              --json <file>                  write a JSON report
              --text <file>                  write a text report
              --pass-success-rate <pct>      default 95
              --pass-max-avg-ms <ms>         default 1000
              --unstable-success-rate <pct>  default 90
              --unstable-max-avg-ms <ms>     default 2000
            """;

    private AnalyzeMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(USAGE);
            return EXIT_ERROR;
        }

        if (!Files.isRegularFile(options.input())) {
            err.println("Sample file not found: " + options.input());
            return EXIT_ERROR;
        }

        try {
            SampleBatch batch = SampleSources.forPath(options.input()).read();
            PerformanceReport report = new DefaultResultAnalyzer(options.thresholds()).analyze(batch);

            out.print(new TextReportRenderer().render(report));
            for (Map.Entry<ReportRenderer, Path> output : options.outputs().entrySet()) {
                output.getKey().generate(report, output.getValue());
            }

            log.info("Verdict for {}: {}", options.input(), report.verdict());
            return exitCode(report.verdict());
        } catch (EmptyInputException e) {
            err.println(e.getMessage());
            return EXIT_EMPTY;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            log.error("Analysis of {} failed", options.input(), e);
            err.println("Analysis failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    static int exitCode(Verdict verdict) {
        return switch (verdict) {
            case PASS -> EXIT_PASS;
            case UNSTABLE -> EXIT_UNSTABLE;
            case FAIL -> EXIT_FAIL;
        };
    }

    record Options(Path input, VerdictThresholds thresholds, Map<ReportRenderer, Path> outputs) {

        static Options parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("Missing samples file");
            }
            Path input = null;
            VerdictThresholds defaults = VerdictThresholds.defaults();
            double passRate = defaults.passMinSuccessRatePct();
            double passAvg = defaults.passMaxAvgResponseMs();
            double unstableRate = defaults.unstableMinSuccessRatePct();
            double unstableAvg = defaults.unstableMaxAvgResponseMs();
            Map<ReportRenderer, Path> outputs = new LinkedHashMap<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    if (input != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    input = Path.of(arg);
                    continue;
                }
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                String value = args[++i];
                switch (arg) {
                    case "--html" -> outputs.put(new HtmlReportRenderer(), Path.of(value));
                    case "--json" -> outputs.put(new JsonReportRenderer(), Path.of(value));
                    case "--text" -> outputs.put(new TextReportRenderer(), Path.of(value));
                    case "--pass-success-rate" -> passRate = number(arg, value);
                    case "--pass-max-avg-ms" -> passAvg = number(arg, value);
                    case "--unstable-success-rate" -> unstableRate = number(arg, value);
                    case "--unstable-max-avg-ms" -> unstableAvg = number(arg, value);
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            if (input == null) {
                throw new IllegalArgumentException("Missing samples file");
            }
            return new Options(input, new VerdictThresholds(passRate, passAvg, unstableRate, unstableAvg), outputs);
        }

        private static double number(String option, String value) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
            }
        }
    }
}

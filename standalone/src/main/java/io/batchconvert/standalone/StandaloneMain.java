package io.batchconvert.standalone;

import io.batchconvert.standalone.cli.ConverterApp;
import io.batchconvert.standalone.cli.ExportKind;
import io.batchconvert.standalone.config.ConfigLoader;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line batch converter.
 *
 * <p>
 * Usage:
 * <ul>
 * <li>{@code batch-convert --job jobs.json [--config batch-convert.yaml]}</li>
 * <li>{@code batch-convert --export <kind> --in score.mscz [--out result.json]
 * [--arg value] [--config batch-convert.yaml]}, see {@link ExportKind}</li>
 * </ul>
 * Exit status: 0 success, 1 startup failure, 2 job file rejected, 3 one or
 * more jobs (or the export) failed.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** Runs the converter and returns the exit status instead of exiting. */
    public static int execute(String[] args) {
        ExportRequest export;
        Path jobFile = null;
        ConverterApp app;
        try {
            export = ExportRequest.parse(args);
            if (export == null) {
                jobFile = ConfigLoader.resolveJobPath(args);
            }
            app = ConverterApp.create(ConfigLoader.resolveConfigPath(args));
        } catch (RuntimeException e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            return ConverterApp.EXIT_STARTUP_FAILED;
        }
        if (export != null) {
            return app.export(export.kind(), export.input(), export.output(), export.argument());
        }
        return app.run(jobFile);
    }

    /** The {@code --export} invocation, or {@code null} from {@link #parse} for a batch run. */
    private record ExportRequest(ExportKind kind, Path input, Path output, String argument) {

        static ExportRequest parse(String[] args) {
            Optional<String> export = ConfigLoader.resolveOption(args, "--export");
            if (export.isEmpty()) {
                return null;
            }
            ExportKind kind = ExportKind.fromOption(export.get());
            Path input = Path.of(required(args, "--in"));
            Path output = kind.hasOutput() ? Path.of(required(args, "--out")) : null;
            String argument = ConfigLoader.resolveOption(args, "--arg").orElse(null);
            if (argument == null && (kind == ExportKind.TRANSPOSE || kind == ExportKind.SOURCE)) {
                throw new IllegalArgumentException("--export " + kind.option() + " requires --arg <value>");
            }
            return new ExportRequest(kind, input, output, argument);
        }

        private static String required(String[] args, String option) {
            return ConfigLoader.resolveOption(args, option)
                    .orElseThrow(() -> new IllegalArgumentException(option + " <file> is required"));
        }
    }
}

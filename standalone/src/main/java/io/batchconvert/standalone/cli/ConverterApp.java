package io.batchconvert.standalone.cli;

import io.batchconvert.core.engine.BackendExports;
import io.batchconvert.core.engine.BatchConverter;
import io.batchconvert.core.engine.ConversionDispatcher;
import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.job.JobFileParser;
import io.batchconvert.core.model.BatchResult;
import io.batchconvert.core.model.ConverterSettings;
import io.batchconvert.core.spi.ProgressListener;
import io.batchconvert.standalone.cli.PluginLoader.ConverterPlugins;
import io.batchconvert.standalone.config.ConfigLoader;
import io.batchconvert.standalone.config.ConverterConfig;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one command-line batch run.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Resolve {@code --config} and {@code --job}</li>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} / {@code logging.level}</li>
 * <li>Discover loader, writers and optional plugins</li>
 * <li>Assemble the dispatcher and batch converter</li>
 * <li>Run the batch and map the result to an exit code</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.batchconvert.standalone.StandaloneMain} so that tests
 * can drive a full run without {@code System.exit}.
 */
public final class ConverterApp {

    private static final Logger LOG = LoggerFactory.getLogger(ConverterApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILED = 1;
    public static final int EXIT_REJECTED = 2;
    public static final int EXIT_JOBS_FAILED = 3;

    private final BatchConverter converter;
    private final ConversionDispatcher dispatcher;
    private final BackendExports backendExports;
    private final ConverterConfig config;

    private ConverterApp(
            BatchConverter converter,
            ConversionDispatcher dispatcher,
            BackendExports backendExports,
            ConverterConfig config) {
        this.converter = converter;
        this.dispatcher = dispatcher;
        this.backendExports = backendExports;
        this.config = config;
    }

    /**
     * Executes the startup sequence with {@link System#getenv} as the env overlay.
     *
     * @throws io.batchconvert.standalone.config.ConfigLoadException if the configuration is invalid
     * @throws ConverterStartupException if the plugins cannot be assembled
     */
    public static ConverterApp create(Path configPath) {
        return create(configPath, System::getenv, Thread.currentThread().getContextClassLoader());
    }

    /**
     * Executes the startup sequence.
     *
     * @param configPath  YAML configuration file
     * @param envLookup   environment variable lookup function
     * @param classLoader class loader used for plugin discovery
     * @return an application ready to run batches
     */
    public static ConverterApp create(Path configPath, Function<String, String> envLookup, ClassLoader classLoader) {
        long startTime = System.nanoTime();

        ConverterConfig config = ConfigLoader.load(configPath, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);

        ConverterPlugins plugins = PluginLoader.discover(classLoader);
        ConverterSettings settings = config.toSettings();
        if (settings.hasExtension() && plugins.extensionRunner() == null) {
            throw new ConverterStartupException(
                    "converter.extension is set but no ExtensionRunner is registered: " + settings.extension());
        }

        ConversionDispatcher.Builder dispatcherBuilder = ConversionDispatcher.builder()
                .loader(plugins.loader())
                .writers(plugins.writers())
                .transposer(plugins.transposer())
                .extensionRunner(plugins.extensionRunner())
                .settings(settings);
        plugins.projectWriters().forEach(dispatcherBuilder::projectWriter);
        ConversionDispatcher dispatcher = dispatcherBuilder.build();
        BackendExports backendExports = plugins.backendExporter() != null
                ? new BackendExports(plugins.backendExporter(), settings)
                : null;
        JobFileParser parser = new JobFileParser(plugins.transposer());
        BatchConverter converter = new BatchConverter(parser, dispatcher, config.parallelism());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "batch-convert started: writers={}, parallelism={}, force={}, startupMs={}",
                plugins.writers().kinds(),
                config.parallelism(),
                config.forceMode(),
                elapsedMs);
        return new ConverterApp(converter, dispatcher, backendExports, config);
    }

    /**
     * Runs the batch described by {@code jobFile}.
     *
     * @return the process exit code
     */
    public int run(Path jobFile) {
        return run(jobFile, new LoggingProgressListener());
    }

    /** Runs the batch with a caller-supplied listener and returns the process exit code. */
    public int run(Path jobFile, ProgressListener listener) {
        BatchResult result = converter.run(jobFile, listener);
        if (!result.isOk()) {
            LOG.error("batch-convert finished with errors:\n{}", result.message());
        }
        return exitCode(result);
    }

    /**
     * Runs a single-document export instead of a batch.
     *
     * @param kind     the export to run
     * @param input    input document
     * @param output   output file, or {@code null} for {@link ExportKind#SOURCE}
     * @param argument highlight configuration, transform options or new source, depending on
     *                 {@code kind}; may be {@code null} where optional
     * @return {@link #EXIT_OK}, {@link #EXIT_JOBS_FAILED} if the export failed, or
     *     {@link #EXIT_STARTUP_FAILED} if the plugin it needs is not registered
     */
    public int export(ExportKind kind, Path input, Path output, String argument) {
        if (kind.requiresBackend() && backendExports == null) {
            LOG.error("export.unavailable export={} detail=no BackendExporter registered", kind.option());
            return EXIT_STARTUP_FAILED;
        }
        try {
            switch (kind) {
                case PROJECT -> dispatcher.exportProject(input, output);
                case MEDIA -> backendExports.exportMedia(input, output, argument != null ? Path.of(argument) : null);
                case META -> backendExports.exportMeta(input, output);
                case PARTS -> backendExports.exportParts(input, output);
                case PARTS_PDFS -> backendExports.exportPartsPdfs(input, output);
                case TRANSPOSE -> backendExports.exportTranspose(input, output, argument);
                case SOURCE -> backendExports.updateSource(input, argument);
            }
        } catch (ConvertException e) {
            LOG.error(
                    "export.failed export={} input={} code={} detail={}",
                    kind.option(),
                    input,
                    e.code(),
                    e.getMessage());
            return EXIT_JOBS_FAILED;
        }
        return EXIT_OK;
    }

    /** Requests cancellation of a running batch. */
    public void cancel() {
        converter.cancel();
    }

    /** The dispatcher for single-file, part and project exports outside a batch. */
    public ConversionDispatcher dispatcher() {
        return dispatcher;
    }

    /** Backend exports, present when a {@code BackendExporter} is registered. */
    public Optional<BackendExports> backendExports() {
        return Optional.ofNullable(backendExports);
    }

    public ConverterConfig config() {
        return config;
    }

    static int exitCode(BatchResult result) {
        return switch (result.type()) {
            case SUCCESS -> EXIT_OK;
            case FAILED -> EXIT_JOBS_FAILED;
            case REJECTED -> EXIT_REJECTED;
        };
    }
}

package io.batchconvert.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.batchconvert.core.error.ConvertException;
import io.batchconvert.core.error.ConvertTypeUnknownException;
import io.batchconvert.core.error.InputLoadException;
import io.batchconvert.core.error.OutputOpenException;
import io.batchconvert.core.error.OutputWriteException;
import io.batchconvert.core.error.TransformOptionsException;
import io.batchconvert.core.error.TransposeException;
import io.batchconvert.core.error.UnexpectedConversionException;
import io.batchconvert.core.error.UnsupportedPartTargetException;
import io.batchconvert.core.model.ConversionJob;
import io.batchconvert.core.model.ConverterSettings;
import io.batchconvert.core.model.OutputSpec;
import io.batchconvert.core.model.OutputTarget;
import io.batchconvert.core.model.WriterOptions;
import io.batchconvert.core.spi.Document;
import io.batchconvert.core.spi.DocumentLoader;
import io.batchconvert.core.spi.DocumentWriter;
import io.batchconvert.core.spi.ExtensionRunner;
import io.batchconvert.core.spi.LoadedDocument;
import io.batchconvert.core.spi.ProjectWriter;
import io.batchconvert.core.spi.TransformOptions;
import io.batchconvert.core.spi.Transposer;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Converts a single job: resolves the writer, loads the input, applies the optional sound profile
 * and transform, then produces the output with the {@link ConversionStrategy} the request calls
 * for.
 *
 * <p>
 * The loaded document is handed explicitly to every writer and extension call and is closed when
 * the job ends, on success and on every failure path. No state is shared between jobs, so one
 * dispatcher can serve several jobs concurrently as long as its collaborators are thread-safe.
 *
 * <p>
 * Every failure surfaces as a {@link ConvertException}. The first failure aborts the job; files
 * already written are left in place.
 */
public final class ConversionDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionDispatcher.class);
    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /** MDC key holding the input path of the job being converted. */
    static final String MDC_JOB_INPUT = "job_input";

    /** MDC key holding the output of the job being converted. */
    static final String MDC_JOB_OUTPUT = "job_output";

    private final WriterRegistry writers;
    private final DocumentLoader loader;
    private final Transposer transposer;
    private final ExtensionRunner extensionRunner;
    private final ConverterSettings settings;
    private final Set<String> nativeKinds;
    private final Map<String, ProjectWriter> projectWriters;

    private ConversionDispatcher(Builder builder) {
        this.writers = builder.writers;
        this.loader = builder.loader;
        this.transposer = builder.transposer;
        this.extensionRunner = builder.extensionRunner;
        this.settings = builder.settings;
        this.projectWriters = Map.copyOf(builder.projectWriters);
        Set<String> declared = loader.nativeSuffixes();
        this.nativeKinds = declared == null
                ? Set.of()
                : declared.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings shared by every job converted by this dispatcher. */
    public ConverterSettings settings() {
        return settings;
    }

    /** The transposer used for transform options, or {@code null} if none is configured. */
    public Transposer transposer() {
        return transposer;
    }

    /**
     * Converts one job.
     *
     * @param job the job to convert
     * @throws ConvertTypeUnknownException    if no writer handles the output kind; the input is not
     *                                        loaded in that case
     * @throws InputLoadException             if the loader fails
     * @throws TransposeException             if the transform cannot be applied
     * @throws UnsupportedPartTargetException if a templated output targets a kind that has no parts
     * @throws OutputOpenException            if an output file cannot be opened
     * @throws OutputWriteException           if a writer or the native save fails
     * @throws ConvertException               for any other collaborator error (e.g. an extension)
     */
    public void convert(ConversionJob job) {
        Objects.requireNonNull(job, "job must not be null");
        OutputSpec output = job.output();
        String kind = output.kind();
        DocumentWriter writer = writers.getWriter(kind).orElseThrow(() -> new ConvertTypeUnknownException(kind));

        MDC.put(MDC_JOB_INPUT, job.input().toString());
        MDC.put(MDC_JOB_OUTPUT, output.display());
        long startNanos = System.nanoTime();
        try (LoadedDocument document = load(job.input())) {
            prepare(document, job.transform());

            ConversionStrategy strategy = ConversionStrategy.select(
                    output.isTemplated(),
                    settings.hasExtension(),
                    nativeKinds.contains(kind),
                    settings.isPageSegmented(kind));
            switch (strategy) {
                case PER_PART -> convertParts(writer, document, (OutputSpec.Templated) output);
                case EXTENSION -> convertByExtension(writer, document, singlePath(output));
                case NATIVE_SAVE -> saveNative(document, singlePath(output));
                case PAGE_BY_PAGE -> convertPageByPage(writer, document, singlePath(output), WriterOptions.DEFAULT);
                case WHOLE_DOCUMENT -> convertWhole(writer, document, singlePath(output));
            }

            LOG.info(
                    "job.converted input={} output={} strategy={} duration_ms={}",
                    job.input(),
                    output.display(),
                    strategy,
                    (System.nanoTime() - startNanos) / 1_000_000);
        } finally {
            MDC.remove(MDC_JOB_INPUT);
            MDC.remove(MDC_JOB_OUTPUT);
        }
    }

    /**
     * Converts a single file, parsing the transform options from JSON text first.
     *
     * @param input         input document
     * @param output        output path in wire form (may be templated)
     * @param transformJson transform options as a JSON object, or {@code null}/blank for none
     * @throws TransformOptionsException if the options are not valid JSON or are rejected by the
     *                                   transposer
     * @see #convert(ConversionJob)
     */
    public void convert(Path input, String output, String transformJson) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        TransformOptions transform = parseTransformOptions(transformJson);
        convert(new ConversionJob(input, OutputSpec.parse(output.replace('\\', '/')), transform));
    }

    /**
     * Exports every part of the input to its own file, regardless of the configured extension or
     * native format.
     *
     * @param input  input document
     * @param output templated output naming the part files
     * @throws ConvertTypeUnknownException    if no writer handles the output kind
     * @throws InputLoadException             if the loader fails
     * @throws UnsupportedPartTargetException if the kind has no per-part export
     */
    public void convertParts(Path input, OutputSpec.Templated output) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        String kind = output.kind();
        DocumentWriter writer = writers.getWriter(kind).orElseThrow(() -> new ConvertTypeUnknownException(kind));
        try (LoadedDocument document = load(input)) {
            convertParts(writer, document, output);
        }
    }

    /**
     * Renders the whole project with a {@link ProjectWriter}, e.g. to a video. The input is loaded
     * without the batch style and without force mode, and no sound profile or extension is applied.
     *
     * @param input  input document
     * @param output file written by the project writer
     * @throws ConvertTypeUnknownException if no project writer handles the output kind
     * @throws InputLoadException          if the loader fails
     * @throws OutputWriteException        if the project writer fails
     */
    public void exportProject(Path input, Path output) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        String kind = new OutputSpec.Single(output).kind();
        ProjectWriter writer = projectWriters.get(kind);
        if (writer == null) {
            throw new ConvertTypeUnknownException(kind);
        }
        try (LoadedDocument project = load(input, null, false)) {
            try {
                writer.write(project, output);
            } catch (IOException | RuntimeException e) {
                LOG.error("output.write_failed path={} detail={}", output, e.getMessage());
                throw new OutputWriteException(output, e);
            }
            LOG.info("project.exported input={} output={}", input, output);
        }
    }

    private TransformOptions parseTransformOptions(String transformJson) {
        if (transformJson == null || transformJson.isBlank()) {
            return null;
        }
        JsonNode node;
        try {
            node = JSON_MAPPER.readTree(transformJson);
        } catch (JsonProcessingException e) {
            throw new TransformOptionsException("Transform options are not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new TransformOptionsException("Transform options must be a JSON object");
        }
        if (node.isEmpty()) {
            return null;
        }
        if (transposer == null) {
            throw new TransformOptionsException("Transform options given but no transposer is available");
        }
        return transposer.parseOptions(node);
    }

    private LoadedDocument load(Path input) {
        return load(input, settings.stylePath(), settings.forceMode());
    }

    private LoadedDocument load(Path input, Path stylePath, boolean forceMode) {
        LoadedDocument document;
        try {
            document = loader.load(input, stylePath, forceMode);
        } catch (IOException | RuntimeException e) {
            LOG.error("input.load_failed path={} detail={}", input, e.getMessage());
            throw new InputLoadException(input, e);
        }
        if (document == null) {
            throw new UnexpectedConversionException("Document loader returned no document for " + input);
        }
        return document;
    }

    private void prepare(LoadedDocument document, TransformOptions transform) {
        if (settings.hasSoundProfile()) {
            document.applySoundProfile(settings.soundProfile());
        }
        if (transform != null) {
            if (transposer == null) {
                throw new TransposeException("Job has transform options but no transposer is available");
            }
            try {
                transposer.apply(document, transform);
            } catch (TransposeException e) {
                LOG.error("transform.failed detail={}", e.getMessage());
                throw e;
            }
        }
    }

    // --- Strategies ---

    private void convertParts(DocumentWriter writer, LoadedDocument document, OutputSpec.Templated output) {
        String kind = output.kind();
        if (!settings.supportsParts(kind)) {
            throw new UnsupportedPartTargetException(kind);
        }
        boolean paged = settings.isPageSegmented(kind);
        for (Document part : document.parts()) {
            Path partPath = resolvePartPath(output, part);
            if (paged) {
                convertPageByPage(writer, part, partPath, WriterOptions.perPart());
            } else {
                write(writer, part, partPath, null, WriterOptions.perPart());
            }
        }
    }

    private static Path resolvePartPath(OutputSpec.Templated output, Document part) {
        try {
            return OutputPathResolver.resolvePart(output, part.name());
        } catch (InvalidPathException e) {
            LOG.error("output.open_failed path={} part={} detail={}", output.display(), part.name(), e.getMessage());
            throw new OutputOpenException(output.display().replace(OutputSpec.PLACEHOLDER, part.name()), e);
        }
    }

    private void convertByExtension(DocumentWriter writer, LoadedDocument document, Path output) {
        // the extension may modify the document, so it runs before the write
        extensionRunner.perform(document, settings.extension());
        write(writer, document, output, null, WriterOptions.DEFAULT);
    }

    private void saveNative(LoadedDocument document, Path output) {
        try {
            document.save(output);
        } catch (IOException | RuntimeException e) {
            LOG.error("output.save_failed path={} detail={}", output, e.getMessage());
            throw new OutputWriteException(output, e);
        }
    }

    private void convertPageByPage(DocumentWriter writer, Document document, Path output, WriterOptions options) {
        int pages = document.pageCount();
        for (int i = 0; i < pages; i++) {
            Path pagePath = OutputPathResolver.resolvePage(output, i);
            write(writer, document, pagePath, output, options.withPage(i));
        }
    }

    private void convertWhole(DocumentWriter writer, Document document, Path output) {
        write(writer, document, output, null, WriterOptions.DEFAULT);
    }

    private void write(DocumentWriter writer, Document document, Path path, Path dirPath, WriterOptions options) {
        OutputTarget target;
        try {
            target = OutputTarget.open(path);
        } catch (IOException | RuntimeException e) {
            LOG.error("output.open_failed path={} detail={}", path, e.getMessage());
            throw new OutputOpenException(path, e);
        }
        try (target) {
            if (dirPath != null) {
                target.setMeta(OutputTarget.META_DIR_PATH, dirPath.toString());
            }
            target.setMeta(OutputTarget.META_FILE_PATH, path.toString());
            writer.write(document, target, options);
        } catch (IOException | RuntimeException e) {
            LOG.error("output.write_failed path={} detail={}", path, e.getMessage());
            throw new OutputWriteException(path, e);
        }
        LOG.debug("output.written path={} unit={} page={}", path, options.unit(), options.pageNumber());
    }

    private static String normalizeKind(String suffix) {
        String bare = suffix.startsWith(".") ? suffix.substring(1) : suffix;
        return bare.toLowerCase(Locale.ROOT);
    }

    private static Path singlePath(OutputSpec output) {
        return ((OutputSpec.Single) output).path();
    }

    /** Builder for {@link ConversionDispatcher}. */
    public static final class Builder {
        private WriterRegistry writers;
        private DocumentLoader loader;
        private Transposer transposer;
        private ExtensionRunner extensionRunner;
        private ConverterSettings settings = ConverterSettings.DEFAULT;
        private final Map<String, ProjectWriter> projectWriters = new HashMap<>();

        Builder() {}

        /** Adds a project writer under each of its suffixes; a later writer takes over a suffix. */
        public Builder projectWriter(ProjectWriter writer) {
            Objects.requireNonNull(writer, "writer must not be null");
            writer.suffixes().forEach(suffix -> projectWriters.put(normalizeKind(suffix), writer));
            return this;
        }

        public Builder writers(WriterRegistry writers) {
            this.writers = writers;
            return this;
        }

        public Builder loader(DocumentLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder transposer(Transposer transposer) {
            this.transposer = transposer;
            return this;
        }

        public Builder extensionRunner(ExtensionRunner extensionRunner) {
            this.extensionRunner = extensionRunner;
            return this;
        }

        public Builder settings(ConverterSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Builds the dispatcher.
         *
         * @throws NullPointerException  if the writer registry, loader or settings are missing
         * @throws IllegalStateException if an extension is configured without an extension runner
         */
        public ConversionDispatcher build() {
            Objects.requireNonNull(writers, "writers must not be null");
            Objects.requireNonNull(loader, "loader must not be null");
            Objects.requireNonNull(settings, "settings must not be null");
            if (settings.hasExtension() && extensionRunner == null) {
                throw new IllegalStateException(
                        "extension " + settings.extension() + " is configured but no extension runner is available");
            }
            return new ConversionDispatcher(this);
        }
    }
}

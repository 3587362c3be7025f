package io.batchconvert.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.batchconvert.core.error.JobFileOpenException;
import io.batchconvert.core.error.JobFileParseException;
import io.batchconvert.core.error.TransformOptionsException;
import io.batchconvert.core.model.ConversionJob;
import io.batchconvert.core.model.OutputSpec;
import io.batchconvert.core.spi.TransformOptions;
import io.batchconvert.core.spi.Transposer;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses batch job files into an ordered list of {@link ConversionJob}s.
 *
 * <p>
 * A job file is a JSON array of objects:
 *
 * <pre>
 * [
 *   { "in": "score.mscz", "out": "score.pdf" },
 *   { "in": "score.mscz", "transpose": { ... }, "out": ["score.png", ["parts/", "pdf"]] }
 * ]
 * </pre>
 *
 * <p>
 * An array-valued {@code out} expands into one job per element, in element order, right where
 * the entry is declared. A {@code [prefix, suffix]} element declares a templated output with one
 * file per part. Input and output paths have backslashes normalized to {@code /}.
 *
 * <p>
 * Transform options ({@code transpose}, or its alias {@code transform}) are parsed by the
 * configured {@link Transposer}. A single invalid payload fails the whole file.
 *
 * <p>
 * Thread-safe if the {@link Transposer} is.
 */
public final class JobFileParser {

    /** Canonical key of the transform options of a job. */
    static final String TRANSPOSE_KEY = "transpose";

    /** Accepted alias of {@link #TRANSPOSE_KEY}. */
    static final String TRANSFORM_KEY = "transform";

    private static final String SCHEMA_RESOURCE = "/schemas/batch-job.schema.json";
    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema JOB_FILE_SCHEMA = loadSchema();

    private final Transposer transposer;

    /** Creates a parser that rejects any job carrying transform options. */
    public JobFileParser() {
        this(null);
    }

    /**
     * Creates a parser backed by the given transposer.
     *
     * @param transposer collaborator that parses transform options, or {@code null} if none is
     *                   available
     */
    public JobFileParser(Transposer transposer) {
        this.transposer = transposer;
    }

    /**
     * Reads and parses the job file at the given path.
     *
     * @param jobFile path to the JSON job file
     * @return jobs in declaration order
     * @throws JobFileOpenException       if the file cannot be read
     * @throws JobFileParseException      if the content is not a well-formed job array
     * @throws TransformOptionsException if any transform payload is invalid
     */
    public List<ConversionJob> parse(Path jobFile) {
        Objects.requireNonNull(jobFile, "jobFile must not be null");
        String source = jobFile.toString();
        byte[] content;
        try {
            content = Files.readAllBytes(jobFile);
        } catch (IOException e) {
            throw new JobFileOpenException(source, e);
        }
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new JobFileParseException("Malformed JSON in batch job file: " + e.getMessage(), e, source);
        }
        return parseTree(root, source);
    }

    /**
     * Parses job-file content held in memory.
     *
     * @param json   JSON text
     * @param source identifier of the content, used in error messages
     * @return jobs in declaration order
     * @throws JobFileParseException      if the content is not a well-formed job array
     * @throws TransformOptionsException if any transform payload is invalid
     */
    public List<ConversionJob> parse(String json, String source) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JobFileParseException("Malformed JSON in batch job file: " + e.getOriginalMessage(), e, source);
        }
        return parseTree(root, source);
    }

    private List<ConversionJob> parseTree(JsonNode root, String source) {
        if (root == null || !root.isArray()) {
            throw new JobFileParseException("Batch job file must contain a JSON array of jobs", source);
        }
        validate(root, source);

        List<ConversionJob> jobs = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : root) {
            expandEntry(entry, index++, source, jobs);
        }
        return List.copyOf(jobs);
    }

    private void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = JOB_FILE_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new JobFileParseException("Invalid batch job file: " + details, source);
        }
    }

    private void expandEntry(JsonNode entry, int index, String source, List<ConversionJob> jobs) {
        Path input = toPath(entry.get("in").asText(), index, source);
        TransformOptions transform = parseTransform(entry, index);

        JsonNode out = entry.get("out");
        if (out.isTextual()) {
            jobs.add(new ConversionJob(input, toOutput(out.asText(), index, source), transform));
            return;
        }
        for (JsonNode item : out) {
            OutputSpec output;
            if (item.isTextual()) {
                output = toOutput(item.asText(), index, source);
            } else {
                output = toTemplate(item.get(0).asText(), item.get(1).asText(), index, source);
            }
            jobs.add(new ConversionJob(input, output, transform));
        }
    }

    private TransformOptions parseTransform(JsonNode entry, int index) {
        JsonNode node = entry.has(TRANSPOSE_KEY) ? entry.get(TRANSPOSE_KEY) : entry.get(TRANSFORM_KEY);
        if (node == null || node.isEmpty()) {
            return null;
        }
        if (transposer == null) {
            throw new TransformOptionsException(
                    "Job #" + index + " declares transform options but no transposer is available");
        }
        TransformOptions options;
        try {
            options = transposer.parseOptions(node);
        } catch (TransformOptionsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformOptionsException(
                    "Transposer failed to parse the options of job #" + index + ": " + e.getMessage(), e);
        }
        if (options == null) {
            throw new TransformOptionsException("Transposer returned no options for job #" + index);
        }
        return options;
    }

    private static Path toPath(String raw, int index, String source) {
        try {
            return Path.of(normalizeSeparators(raw));
        } catch (InvalidPathException e) {
            throw new JobFileParseException("Job #" + index + " has an invalid input path: " + raw, e, source);
        }
    }

    private static OutputSpec toOutput(String raw, int index, String source) {
        try {
            return OutputSpec.parse(normalizeSeparators(raw));
        } catch (InvalidPathException e) {
            throw new JobFileParseException("Job #" + index + " has an invalid output path: " + raw, e, source);
        }
    }

    private static OutputSpec toTemplate(String prefix, String suffix, int index, String source) {
        try {
            return OutputSpec.templated(normalizeSeparators(prefix), suffix);
        } catch (IllegalArgumentException e) {
            throw new JobFileParseException(
                    "Job #" + index + " has an invalid part output [" + prefix + ", " + suffix + "]", e, source);
        }
    }

    /** Converts user-supplied (possibly Windows-style) separators to {@code /}. */
    static String normalizeSeparators(String path) {
        return path.replace('\\', '/');
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = JobFileParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }
}

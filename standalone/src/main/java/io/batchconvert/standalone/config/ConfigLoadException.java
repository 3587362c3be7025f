package io.batchconvert.standalone.config;

/**
 * Raised while building a {@link ConverterConfig}, before any plugin is
 * discovered. Typical causes:
 * <ul>
 * <li>no {@code batch-convert.yaml} at the resolved {@code --config} path</li>
 * <li>YAML that does not parse, or a root that is not a mapping</li>
 * <li>{@code converter.page-kinds} / {@code converter.part-kinds} given as a
 * scalar instead of a list</li>
 * <li>{@code BATCH_PARALLELISM} that is not an integer, or a parallelism
 * below 1</li>
 * <li>a {@code converter.extension} that is not a valid URI, or an unknown
 * {@code logging.format}</li>
 * </ul>
 * {@link io.batchconvert.standalone.StandaloneMain} reports it as a startup
 * failure (exit status 1).
 */
public final class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** A rejected value or missing file, with no underlying exception. */
    public ConfigLoadException(String message) {
        super(message);
    }

    /** A failure caused by YAML parsing or value conversion. */
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

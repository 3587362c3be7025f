package io.batchconvert.standalone.config;

import io.batchconvert.core.model.ConverterSettings;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration of the command-line converter.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances.
 *
 * @param stylePath          style file applied to every loaded document, or {@code null}
 * @param forceMode          load documents even if they look damaged or too new
 * @param soundProfile       sound profile applied before conversion, or {@code null}
 * @param extension          extension URI run instead of the plain writer, or {@code null}
 * @param pageSegmentedKinds output kinds written one file per page
 * @param partKinds          output kinds allowed for templated (per-part) outputs
 * @param parallelism        number of jobs converted at the same time
 * @param loggingFormat      json or text
 * @param loggingLevel       root log level
 */
public record ConverterConfig(
        String stylePath,
        boolean forceMode,
        String soundProfile,
        String extension,
        List<String> pageSegmentedKinds,
        List<String> partKinds,
        int parallelism,
        String loggingFormat,
        String loggingLevel) {

    public ConverterConfig {
        pageSegmentedKinds = List.copyOf(pageSegmentedKinds);
        partKinds = List.copyOf(partKinds);
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maps this configuration onto the settings shared by every conversion.
     *
     * @throws ConfigLoadException if the extension is not a valid URI
     */
    public ConverterSettings toSettings() {
        URI extensionUri = null;
        if (extension != null && !extension.isBlank()) {
            try {
                extensionUri = URI.create(extension.trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid converter.extension URI: " + extension, e);
            }
        }
        return ConverterSettings.builder()
                .stylePath(stylePath != null && !stylePath.isBlank() ? Path.of(stylePath) : null)
                .forceMode(forceMode)
                .soundProfile(soundProfile)
                .extension(extensionUri)
                .pageSegmentedKinds(pageSegmentedKinds)
                .partKinds(partKinds)
                .build();
    }

    /** Builder for {@link ConverterConfig}. */
    public static final class Builder {

        private String stylePath;
        private boolean forceMode;
        private String soundProfile;
        private String extension;
        private List<String> pageSegmentedKinds = List.of("png", "svg");
        private List<String> partKinds = List.of("pdf", "png", "mp3");
        private int parallelism = 1;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder stylePath(String stylePath) {
            this.stylePath = stylePath;
            return this;
        }

        public Builder forceMode(boolean forceMode) {
            this.forceMode = forceMode;
            return this;
        }

        public Builder soundProfile(String soundProfile) {
            this.soundProfile = soundProfile;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder pageSegmentedKinds(List<String> pageSegmentedKinds) {
            this.pageSegmentedKinds = pageSegmentedKinds;
            return this;
        }

        public Builder partKinds(List<String> partKinds) {
            this.partKinds = partKinds;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ConverterConfig build() {
            if (parallelism < 1) {
                throw new ConfigLoadException("batch.parallelism must be at least 1, got: " + parallelism);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got: " + loggingFormat);
            }
            return new ConverterConfig(
                    stylePath,
                    forceMode,
                    soundProfile,
                    extension,
                    pageSegmentedKinds,
                    partKinds,
                    parallelism,
                    loggingFormat,
                    loggingLevel);
        }
    }
}

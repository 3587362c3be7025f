package io.batchconvert.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings shared by every job of a batch. Use {@link #builder()} to construct instances.
 *
 * @param stylePath          style/template file handed to the loader, or {@code null}
 * @param forceMode          load even if version/compatibility checks fail
 * @param soundProfile       sound profile applied to every loaded document, or {@code null}
 * @param extension          extension run against each document before a whole-document write,
 *                           or {@code null}
 * @param pageSegmentedKinds output kinds written one file per page
 * @param partKinds          output kinds that accept a templated (per-part) output
 */
public record ConverterSettings(
        Path stylePath,
        boolean forceMode,
        String soundProfile,
        URI extension,
        Set<String> pageSegmentedKinds,
        Set<String> partKinds) {

    /** Page-oriented kinds: raster and vector page images. */
    public static final Set<String> DEFAULT_PAGE_SEGMENTED_KINDS = Set.of("png", "svg");

    /** Kinds that can be exported per part: documents, page images, audio. */
    public static final Set<String> DEFAULT_PART_KINDS = Set.of("pdf", "png", "mp3");

    /** Defaults: no style, no force, no sound profile, no extension. */
    public static final ConverterSettings DEFAULT = builder().build();

    public ConverterSettings {
        pageSegmentedKinds = normalizeKinds(pageSegmentedKinds, DEFAULT_PAGE_SEGMENTED_KINDS);
        partKinds = normalizeKinds(partKinds, DEFAULT_PART_KINDS);
        if (soundProfile != null && soundProfile.isBlank()) {
            soundProfile = null;
        }
    }

    public boolean hasSoundProfile() {
        return soundProfile != null;
    }

    public boolean hasExtension() {
        return extension != null;
    }

    public boolean isPageSegmented(String kind) {
        return pageSegmentedKinds.contains(kind);
    }

    public boolean supportsParts(String kind) {
        return partKinds.contains(kind);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<String> normalizeKinds(Collection<String> kinds, Set<String> defaults) {
        if (kinds == null) {
            return defaults;
        }
        return kinds.stream()
                .map(kind -> kind.startsWith(".") ? kind.substring(1) : kind)
                .map(kind -> kind.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Builder for {@link ConverterSettings}. */
    public static final class Builder {
        private Path stylePath;
        private boolean forceMode;
        private String soundProfile;
        private URI extension;
        private Set<String> pageSegmentedKinds = DEFAULT_PAGE_SEGMENTED_KINDS;
        private Set<String> partKinds = DEFAULT_PART_KINDS;

        Builder() {}

        public Builder stylePath(Path stylePath) {
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

        public Builder extension(URI extension) {
            this.extension = extension;
            return this;
        }

        public Builder pageSegmentedKinds(Collection<String> kinds) {
            this.pageSegmentedKinds = kinds == null ? null : Set.copyOf(kinds);
            return this;
        }

        public Builder partKinds(Collection<String> kinds) {
            this.partKinds = kinds == null ? null : Set.copyOf(kinds);
            return this;
        }

        public ConverterSettings build() {
            return new ConverterSettings(
                    stylePath, forceMode, soundProfile, extension, pageSegmentedKinds, partKinds);
        }
    }
}

package io.batchconvert.core.engine;

import io.batchconvert.core.model.OutputSpec;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Derives concrete output file names: part files from a templated output and page files from a
 * single output. Pure functions; the same inputs always give the same path.
 *
 * <p>
 * Two parts with the same display name resolve to the same file; the later one overwrites the
 * earlier.
 */
public final class OutputPathResolver {

    private OutputPathResolver() {
        // utility class
    }

    /**
     * Resolves the file for one part: every placeholder in the name pattern is replaced by the
     * part name and the suffix is appended.
     *
     * @param output   templated output
     * @param partName display name of the part
     * @return the part's output file
     */
    public static Path resolvePart(OutputSpec.Templated output, String partName) {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(partName, "partName must not be null");
        String baseName = output.namePattern().replace(OutputSpec.PLACEHOLDER, partName);
        String fileName = output.suffix().isEmpty() ? baseName : baseName + "." + output.suffix();
        return output.directory() != null ? output.directory().resolve(fileName) : Path.of(fileName);
    }

    /**
     * Resolves the file for one page: {@code <dir>/<base>-<n>.<suffix>} with a 1-based page
     * number {@code n}.
     *
     * @param output    the output the page files derive from
     * @param pageIndex 0-based page index
     * @return the page's output file
     */
    public static Path resolvePage(Path output, int pageIndex) {
        Objects.requireNonNull(output, "output must not be null");
        if (pageIndex < 0) {
            throw new IllegalArgumentException("pageIndex must not be negative, got: " + pageIndex);
        }
        Path fileName = output.getFileName();
        String name = fileName != null ? fileName.toString() : "";
        int dot = name.lastIndexOf('.');
        String baseName = dot >= 0 ? name.substring(0, dot) : name;
        String suffix = dot >= 0 ? name.substring(dot) : "";
        String pageName = baseName + "-" + (pageIndex + 1) + suffix;
        Path parent = output.getParent();
        return parent != null ? parent.resolve(pageName) : Path.of(pageName);
    }
}

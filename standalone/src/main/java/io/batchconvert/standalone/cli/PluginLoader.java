package io.batchconvert.standalone.cli;

import io.batchconvert.core.engine.WriterRegistry;
import io.batchconvert.core.spi.BackendExporter;
import io.batchconvert.core.spi.DocumentLoader;
import io.batchconvert.core.spi.DocumentWriter;
import io.batchconvert.core.spi.ExtensionRunner;
import io.batchconvert.core.spi.ProjectWriter;
import io.batchconvert.core.spi.Transposer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the conversion collaborators registered under {@code META-INF/services}.
 *
 * <p>
 * Exactly one {@link DocumentLoader} is required. Every {@link DocumentWriter} is
 * registered; when two writers claim the same suffix the one found last wins. A
 * {@link Transposer}, an {@link ExtensionRunner} and a {@link BackendExporter} are optional,
 * at most one of each. Any number of {@link ProjectWriter}s may be registered.
 */
public final class PluginLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PluginLoader.class);

    /** The collaborators found on the class path. */
    public record ConverterPlugins(
            DocumentLoader loader,
            WriterRegistry writers,
            Transposer transposer,
            ExtensionRunner extensionRunner,
            List<ProjectWriter> projectWriters,
            BackendExporter backendExporter) {

        public ConverterPlugins {
            Objects.requireNonNull(loader, "loader must not be null");
            Objects.requireNonNull(writers, "writers must not be null");
            projectWriters = projectWriters == null ? List.of() : List.copyOf(projectWriters);
        }
    }

    private PluginLoader() {
        // utility class
    }

    /** Discovers plugins with the thread context class loader. */
    public static ConverterPlugins discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Discovers plugins visible to the given class loader.
     *
     * @throws ConverterStartupException if the loader count is not exactly one, no writer is
     *     registered, more than one optional plugin is found, or a provider cannot be instantiated
     */
    public static ConverterPlugins discover(ClassLoader classLoader) {
        List<DocumentLoader> loaders = load(DocumentLoader.class, classLoader);
        if (loaders.size() != 1) {
            throw new ConverterStartupException(
                    "Exactly one DocumentLoader must be registered, found " + loaders.size() + ": " + names(loaders));
        }

        WriterRegistry writers = new WriterRegistry();
        for (DocumentWriter writer : load(DocumentWriter.class, classLoader)) {
            try {
                writers.register(writer);
            } catch (IllegalArgumentException e) {
                throw new ConverterStartupException(
                        "Invalid DocumentWriter " + writer.getClass().getName() + ": " + e.getMessage(), e);
            }
        }
        if (writers.size() == 0) {
            throw new ConverterStartupException("No DocumentWriter registered");
        }

        Transposer transposer = atMostOne(Transposer.class, classLoader);
        ExtensionRunner extensionRunner = atMostOne(ExtensionRunner.class, classLoader);
        BackendExporter backendExporter = atMostOne(BackendExporter.class, classLoader);
        List<ProjectWriter> projectWriters = load(ProjectWriter.class, classLoader);
        for (ProjectWriter writer : projectWriters) {
            if (writer.suffixes() == null || writer.suffixes().isEmpty()) {
                throw new ConverterStartupException(
                        "Invalid ProjectWriter " + writer.getClass().getName() + ": no suffix declared");
            }
        }

        LOG.info(
                "plugins.discovered loader={} writers={} project_writers={} transposer={} extension_runner={}"
                        + " backend={}",
                loaders.get(0).getClass().getName(),
                writers.kinds(),
                names(projectWriters),
                transposer != null ? transposer.getClass().getName() : "none",
                extensionRunner != null ? extensionRunner.getClass().getName() : "none",
                backendExporter != null ? backendExporter.getClass().getName() : "none");
        return new ConverterPlugins(
                loaders.get(0), writers, transposer, extensionRunner, projectWriters, backendExporter);
    }

    private static <T> T atMostOne(Class<T> type, ClassLoader classLoader) {
        List<T> found = load(type, classLoader);
        if (found.size() > 1) {
            throw new ConverterStartupException(
                    "At most one " + type.getSimpleName() + " may be registered, found: " + names(found));
        }
        return found.isEmpty() ? null : found.get(0);
    }

    private static <T> List<T> load(Class<T> type, ClassLoader classLoader) {
        List<T> found = new ArrayList<>();
        try {
            ServiceLoader.load(type, classLoader).forEach(found::add);
        } catch (ServiceConfigurationError e) {
            throw new ConverterStartupException("Cannot load " + type.getSimpleName() + " providers", e);
        }
        return found;
    }

    private static String names(List<?> providers) {
        return providers.stream().map(p -> p.getClass().getName()).collect(Collectors.joining(", ", "[", "]"));
    }
}

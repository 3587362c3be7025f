package io.batchconvert.core.engine;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.batchconvert.core.error.ErrorCode;
import io.batchconvert.core.error.ExtensionException;
import io.batchconvert.core.error.OutputWriteException;
import io.batchconvert.core.error.UnexpectedConversionException;
import io.batchconvert.core.model.ConverterSettings;
import io.batchconvert.core.spi.BackendExporter;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BackendExports")
class BackendExportsTest {

    private static final Path STYLE = Path.of("house.mss");
    private static final Path IN = Path.of("score.mscz");
    private static final Path OUT = Path.of("out/score.json");

    private BackendExporter backend;
    private BackendExports exports;

    @BeforeEach
    void setUp() {
        backend = mock(BackendExporter.class);
        ConverterSettings settings =
                ConverterSettings.builder().stylePath(STYLE).forceMode(true).build();
        exports = new BackendExports(backend, settings);
    }

    @Nested
    @DisplayName("Delegation")
    class Delegation {

        @Test
        @DisplayName("Media export passes the highlight config with the shared style and force mode")
        void media() throws IOException {
            Path highlights = Path.of("highlights.json");

            exports.exportMedia(IN, OUT, highlights);

            verify(backend).exportMedia(IN, OUT, highlights, STYLE, true);
        }

        @Test
        @DisplayName("Meta, parts and part PDFs use the shared style and force mode")
        void metaAndParts() throws IOException {
            exports.exportMeta(IN, OUT);
            exports.exportParts(IN, OUT);
            exports.exportPartsPdfs(IN, OUT);

            verify(backend).exportMeta(IN, OUT, STYLE, true);
            verify(backend).exportParts(IN, OUT, STYLE, true);
            verify(backend).exportPartsPdfs(IN, OUT, STYLE, true);
        }

        @Test
        @DisplayName("Transpose export forwards the options JSON untouched")
        void transpose() throws IOException {
            exports.exportTranspose(IN, OUT, "{\"semitones\": 2}");

            verify(backend).exportTranspose(IN, OUT, "{\"semitones\": 2}", STYLE, true);
        }

        @Test
        @DisplayName("Source update forwards the new source and force mode")
        void updateSource() throws IOException {
            exports.updateSource(IN, "https://example.org/score/42");

            verify(backend).updateSource(IN, "https://example.org/score/42", true);
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("I/O failure → OUT_FILE_FAILED_WRITE naming the output")
        void ioFailure() throws IOException {
            doThrow(new IOException("disk full")).when(backend).exportMeta(any(), any(), any(), anyBoolean());

            assertThatThrownBy(() -> exports.exportMeta(IN, OUT))
                    .isInstanceOf(OutputWriteException.class)
                    .hasMessageContaining(OUT.toString())
                    .extracting("code")
                    .isEqualTo(ErrorCode.OUT_FILE_FAILED_WRITE);
        }

        @Test
        @DisplayName("ConvertException from the backend is propagated unchanged")
        void convertExceptionPropagated() throws IOException {
            ExtensionException failure = new ExtensionException("plugin refused");
            doThrow(failure).when(backend).exportParts(any(), any(), any(), anyBoolean());

            assertThatThrownBy(() -> exports.exportParts(IN, OUT)).isSameAs(failure);
        }

        @Test
        @DisplayName("Any other runtime failure → UNKNOWN_ERROR")
        void runtimeFailure() throws IOException {
            doThrow(new IllegalStateException("renderer gone"))
                    .when(backend)
                    .exportPartsPdfs(any(), any(), any(), anyBoolean());

            assertThatThrownBy(() -> exports.exportPartsPdfs(IN, OUT))
                    .isInstanceOf(UnexpectedConversionException.class)
                    .hasMessageContaining("parts_pdfs")
                    .extracting("code")
                    .isEqualTo(ErrorCode.UNKNOWN_ERROR);
        }

        @Test
        @DisplayName("Missing transform options are refused before delegating")
        void transposeNeedsOptions() {
            assertThatThrownBy(() -> exports.exportTranspose(IN, OUT, null)).isInstanceOf(NullPointerException.class);
        }
    }
}

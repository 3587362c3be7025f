package io.batchconvert.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import io.batchconvert.standalone.cli.ConverterApp;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("StandaloneMain")
class StandaloneMainTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing --job → startup failure exit code")
    void missingJobArgument() {
        assertThat(StandaloneMain.execute(new String[0])).isEqualTo(ConverterApp.EXIT_STARTUP_FAILED);
    }

    @Test
    @DisplayName("Missing config file → startup failure exit code")
    void missingConfig() {
        String[] args = {"--config", tempDir.resolve("absent.yaml").toString(), "--job", "jobs.json"};

        assertThat(StandaloneMain.execute(args)).isEqualTo(ConverterApp.EXIT_STARTUP_FAILED);
    }

    @Test
    @DisplayName("Unknown --export value → startup failure exit code")
    void unknownExport() {
        String[] args = {"--export", "hologram", "--in", "a.tdoc", "--out", "a.json"};

        assertThat(StandaloneMain.execute(args)).isEqualTo(ConverterApp.EXIT_STARTUP_FAILED);
    }

    @Test
    @DisplayName("--export transpose without --arg → startup failure exit code")
    void transposeNeedsArgument() {
        String[] args = {"--export", "transpose", "--in", "a.tdoc", "--out", "a.json"};

        assertThat(StandaloneMain.execute(args)).isEqualTo(ConverterApp.EXIT_STARTUP_FAILED);
    }

    @Test
    @DisplayName("--export meta writes the JSON summary and exits 0")
    void metaExport() throws IOException {
        Path config = tempDir.resolve("batch-convert.yaml");
        Files.writeString(config, "logging:\n  level: WARN\n");
        Path input = tempDir.resolve("duo.tdoc");
        Files.writeString(input, "title: Duo\npart: Flute\n");
        Path output = tempDir.resolve("duo.json");

        String[] args = {
            "--config", config.toString(), "--export", "meta", "--in", input.toString(), "--out", output.toString()
        };

        assertThat(StandaloneMain.execute(args)).isEqualTo(ConverterApp.EXIT_OK);
        assertThat(Files.readString(output)).contains("\"title\":\"Duo\"");
    }

    @Test
    @DisplayName("Empty job file → success exit code")
    void emptyBatch() throws IOException {
        Path config = tempDir.resolve("batch-convert.yaml");
        Files.writeString(config, "logging:\n  level: WARN\n");
        Path jobs = tempDir.resolve("jobs.json");
        Files.writeString(jobs, "[]");

        String[] args = {"--config", config.toString(), "--job", jobs.toString()};

        assertThat(StandaloneMain.execute(args)).isEqualTo(ConverterApp.EXIT_OK);
    }
}

package io.batchconvert.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.batchconvert.core.error.BatchConvertException;
import io.batchconvert.core.error.ErrorCode;
import io.batchconvert.core.job.JobFileParser;
import io.batchconvert.core.model.BatchResult;
import io.batchconvert.core.model.ConversionJob;
import io.batchconvert.core.model.ConverterSettings;
import io.batchconvert.core.model.JobFailure;
import io.batchconvert.core.model.OutputSpec;
import io.batchconvert.core.spi.ProgressListener;
import io.batchconvert.core.spi.Transposer;
import io.batchconvert.core.testkit.FakeDocument;
import io.batchconvert.core.testkit.FakeDocumentLoader;
import io.batchconvert.core.testkit.FakeTransposer;
import io.batchconvert.core.testkit.RecordingProgressListener;
import io.batchconvert.core.testkit.RecordingWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

/**
 * Tests for {@link BatchConverter}: fail-soft job handling, rejection of
 * unusable job files, listener contract, parallel runs and cancellation.
 */
@DisplayName("BatchConverter")
class BatchConverterTest {

    @TempDir
    Path tempDir;

    private FakeDocumentLoader loader;
    private RecordingWriter writer;
    private ConversionDispatcher dispatcher;
    private RecordingProgressListener listener;

    @BeforeEach
    void setUp() {
        loader = new FakeDocumentLoader();
        writer = new RecordingWriter("pdf");
        WriterRegistry writers = new WriterRegistry();
        writers.register(writer);
        dispatcher = ConversionDispatcher.builder()
                .loader(loader)
                .writers(writers)
                .transposer(new FakeTransposer())
                .build();
        listener = new RecordingProgressListener();
        loader.register("a.mscz", new FakeDocument("A", 1));
        loader.register("c.mscz", new FakeDocument("C", 1));
    }

    private BatchConverter converter() {
        return new BatchConverter(new JobFileParser(new FakeTransposer()), dispatcher);
    }

    private Path jobFile(String json) throws IOException {
        Path file = tempDir.resolve("jobs.json");
        Files.writeString(file, json);
        return file;
    }

    private ConversionJob job(String input, String output) {
        return ConversionJob.of(Path.of(input), new OutputSpec.Single(tempDir.resolve(output)));
    }

    @Nested
    @DisplayName("Fail-soft jobs")
    class FailSoft {

        @Test
        @DisplayName("All jobs succeed → SUCCESS, every output written")
        void allSucceed() {
            BatchResult result = converter().run(List.of(job("a.mscz", "a.pdf"), job("c.mscz", "c.pdf")), listener);

            assertThat(result.isOk()).isTrue();
            assertThat(result.jobCount()).isEqualTo(2);
            assertThat(result.code()).isNull();
            assertThat(tempDir.resolve("a.pdf")).exists();
            assertThat(tempDir.resolve("c.pdf")).exists();
        }

        @Test
        @DisplayName("Middle job fails → later jobs still run, one failure line naming it")
        void middleFailureDoesNotStopBatch() {
            BatchResult result = converter()
                    .run(
                            List.of(job("a.mscz", "a.pdf"), job("missing.mscz", "b.pdf"), job("c.mscz", "c.pdf")),
                            listener);

            assertThat(result.type()).isEqualTo(BatchResult.Type.FAILED);
            assertThat(result.code()).isEqualTo(ErrorCode.CONVERT_FAILED);
            assertThat(result.failures()).hasSize(1);
            JobFailure failure = result.failures().get(0);
            assertThat(failure.input()).isEqualTo(Path.of("missing.mscz"));
            assertThat(failure.code()).isEqualTo(ErrorCode.IN_FILE_FAILED_LOAD);
            assertThat(result.message())
                    .startsWith("failed convert, err: [IN_FILE_FAILED_LOAD]")
                    .contains("in: missing.mscz", "out: " + tempDir.resolve("b.pdf"));
            assertThat(tempDir.resolve("c.pdf")).exists();
        }

        @Test
        @DisplayName("Failures are reported in job order")
        void failuresInJobOrder() {
            BatchResult result = converter()
                    .run(List.of(job("x.mscz", "x.pdf"), job("a.mscz", "a.xyz"), job("y.mscz", "y.pdf")), listener);

            assertThat(result.failures())
                    .extracting(JobFailure::code)
                    .containsExactly(
                            ErrorCode.IN_FILE_FAILED_LOAD, ErrorCode.CONVERT_TYPE_UNKNOWN, ErrorCode.IN_FILE_FAILED_LOAD);
        }

        @Test
        @DisplayName("throwIfFailed raises the aggregate with every failure")
        void throwIfFailed() {
            BatchResult result = converter().run(List.of(job("x.mscz", "x.pdf"), job("y.mscz", "y.pdf")), listener);

            assertThatThrownBy(result::throwIfFailed).isInstanceOfSatisfying(BatchConvertException.class, e -> {
                assertThat(e.failures()).hasSize(2);
                assertThat(e.getMessage()).contains("x.mscz").contains("y.mscz");
            });
        }

        @Test
        @DisplayName("Unexpected runtime error in a collaborator → UNKNOWN_ERROR, batch continues")
        void unexpectedRuntimeError() {
            FakeDocument exploding = new FakeDocument("Boom", 1) {
                @Override
                public void applySoundProfile(String soundProfile) {
                    throw new IllegalStateException("unexpected");
                }
            };
            loader.register("boom.mscz", exploding);
            ConversionDispatcher withProfile = ConversionDispatcher.builder()
                    .loader(loader)
                    .writers(registryOf(writer))
                    .settings(ConverterSettings.builder().soundProfile("Basic").build())
                    .build();

            BatchResult result = new BatchConverter(new JobFileParser(), withProfile)
                    .run(List.of(job("boom.mscz", "b.pdf"), job("a.mscz", "a.pdf")), listener);

            assertThat(result.failures()).extracting(JobFailure::code).containsExactly(ErrorCode.UNKNOWN_ERROR);
            assertThat(tempDir.resolve("a.pdf")).exists();
        }

        private WriterRegistry registryOf(RecordingWriter recordingWriter) {
            WriterRegistry registry = new WriterRegistry();
            registry.register(recordingWriter);
            return registry;
        }
    }

    @Nested
    @DisplayName("Job file")
    class JobFile {

        @Test
        @DisplayName("Job file expands and runs every output")
        void runsJobFile() throws IOException {
            Path file = jobFile("[ { \"in\": \"a.mscz\", \"out\": [\"" + tempDir.resolve("a1.pdf") + "\", \""
                    + tempDir.resolve("a2.pdf") + "\"] } ]");

            BatchResult result = converter().run(file, listener);

            assertThat(result.isOk()).isTrue();
            assertThat(writer.paths()).containsExactly(tempDir.resolve("a1.pdf"), tempDir.resolve("a2.pdf"));
        }

        @Test
        @DisplayName("Unreadable job file → REJECTED with BATCH_JOB_FILE_FAILED_OPEN, nothing converted")
        void missingJobFile() {
            BatchResult result = converter().run(tempDir.resolve("nope.json"), listener);

            assertThat(result.type()).isEqualTo(BatchResult.Type.REJECTED);
            assertThat(result.code()).isEqualTo(ErrorCode.BATCH_JOB_FILE_FAILED_OPEN);
            assertThat(loader.loaded()).isEmpty();
            assertThat(listener.events()).containsExactly("start", "finish");
        }

        @Test
        @DisplayName("Malformed job file → REJECTED with BATCH_JOB_FILE_FAILED_PARSE")
        void malformedJobFile() throws IOException {
            BatchResult result = converter().run(jobFile("{ not json"), listener);

            assertThat(result.code()).isEqualTo(ErrorCode.BATCH_JOB_FILE_FAILED_PARSE);
            assertThat(writer.writes()).isEmpty();
        }

        @Test
        @DisplayName("Invalid transform options anywhere → REJECTED before the first job")
        void invalidTransformRejectsBatch() throws IOException {
            Path file = jobFile("""
                    [
                      { "in": "a.mscz", "out": "a.pdf" },
                      { "in": "c.mscz", "transpose": { "semitones": "x" }, "out": "c.pdf" }
                    ]
                    """);

            BatchResult result = converter().run(file, listener);

            assertThat(result.code()).isEqualTo(ErrorCode.TRANSFORM_OPTIONS_INVALID);
            assertThat(loader.loaded()).isEmpty();
        }

        @Test
        @DisplayName("Valid array followed by trailing garbage → REJECTED, no job runs")
        void trailingContentRejected() throws IOException {
            Path file = jobFile("[ { \"in\": \"a.mscz\", \"out\": \"a.pdf\" } ] }{ garbage");

            BatchResult result = converter().run(file, listener);

            assertThat(result.type()).isEqualTo(BatchResult.Type.REJECTED);
            assertThat(result.code()).isEqualTo(ErrorCode.BATCH_JOB_FILE_FAILED_PARSE);
            assertThat(loader.loaded()).isEmpty();
            assertThat(listener.events()).containsExactly("start", "finish");
        }

        @Test
        @DisplayName("Transposer crashing while parsing options → REJECTED, finish still notified")
        void transposerCrashRejectsBatch() throws IOException {
            Transposer crashing = mock(Transposer.class);
            when(crashing.parseOptions(any())).thenThrow(new IllegalStateException("boom"));
            Path file = jobFile("[ { \"in\": \"a.mscz\", \"transpose\": { \"semitones\": 1 }, \"out\": \"a.pdf\" } ]");

            BatchResult result = new BatchConverter(new JobFileParser(crashing), dispatcher).run(file, listener);

            assertThat(result.type()).isEqualTo(BatchResult.Type.REJECTED);
            assertThat(result.code()).isEqualTo(ErrorCode.TRANSFORM_OPTIONS_INVALID);
            assertThat(listener.events()).containsExactly("start", "finish");
            assertThat(loader.loaded()).isEmpty();
        }

        @Test
        @DisplayName("Unexpected parser error → REJECTED with UNKNOWN_ERROR, finish notified exactly once")
        void unexpectedParserError() {
            JobFileParser parser = mock(JobFileParser.class);
            when(parser.parse(any(Path.class))).thenThrow(new IllegalStateException("boom"));

            BatchResult result = new BatchConverter(parser, dispatcher).run(tempDir.resolve("jobs.json"), listener);

            assertThat(result.type()).isEqualTo(BatchResult.Type.REJECTED);
            assertThat(result.code()).isEqualTo(ErrorCode.UNKNOWN_ERROR);
            assertThat(listener.events()).containsExactly("start", "finish");
            assertThat(listener.results()).containsExactly(result);
        }

        @Test
        @DisplayName("Empty job array → SUCCESS with zero jobs")
        void emptyBatch() throws IOException {
            BatchResult result = converter().run(jobFile("[]"), listener);

            assertThat(result.isOk()).isTrue();
            assertThat(result.jobCount()).isZero();
            assertThat(listener.events()).containsExactly("start", "finish");
        }

        @Test
        @DisplayName("Running the same job file twice gives the same result and bytes")
        void rerunIsIdempotent() throws IOException {
            Path output = tempDir.resolve("a.pdf");
            Path file = jobFile("[ { \"in\": \"a.mscz\", \"out\": \"" + output + "\" } ]");
            BatchConverter converter = converter();

            BatchResult first = converter.run(file, null);
            byte[] bytes = Files.readAllBytes(output);
            BatchResult second = converter.run(file, null);

            assertThat(second.type()).isEqualTo(first.type());
            assertThat(Files.readAllBytes(output)).isEqualTo(bytes);
        }
    }

    @Nested
    @DisplayName("Progress listener")
    class Listener {

        @Test
        @DisplayName("start, one progress per job with a 1-based counter, finish exactly once")
        void eventSequence() {
            converter().run(List.of(job("a.mscz", "a.pdf"), job("missing.mscz", "m.pdf")), listener);

            assertThat(listener.events())
                    .containsExactly("start", "1/2 a.mscz", "2/2 missing.mscz", "finish");
            assertThat(listener.results()).hasSize(1);
            assertThat(listener.results().get(0).type()).isEqualTo(BatchResult.Type.FAILED);
        }

        @Test
        @DisplayName("Listener calls are ordered start → progress → finish")
        void mockedListenerOrder() {
            ProgressListener mockListener = mock(ProgressListener.class);

            converter().run(List.of(job("a.mscz", "a.pdf")), mockListener);

            InOrder order = inOrder(mockListener);
            order.verify(mockListener).start();
            order.verify(mockListener).progress(1, 1, "a.mscz");
            order.verify(mockListener).finish(any(BatchResult.class));
        }

        @Test
        @DisplayName("Throwing listener does not affect the batch")
        void throwingListener() {
            ProgressListener mockListener = mock(ProgressListener.class);
            doThrow(new IllegalStateException("ui gone")).when(mockListener).start();
            doThrow(new IllegalStateException("ui gone"))
                    .when(mockListener)
                    .progress(anyLong(), anyLong(), anyString());

            BatchResult result = converter().run(List.of(job("a.mscz", "a.pdf"), job("c.mscz", "c.pdf")), mockListener);

            assertThat(result.isOk()).isTrue();
            verify(mockListener, times(2)).progress(anyLong(), anyLong(), anyString());
            verify(mockListener).finish(result);
        }
    }

    @Nested
    @DisplayName("Parallel runs")
    class Parallel {

        @Test
        @DisplayName("Parallel run converts every job and reports failures in job order")
        void parallelKeepsOrder() {
            List<ConversionJob> jobs = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                String input = i % 3 == 1 ? "missing-" + i + ".mscz" : "doc-" + i + ".mscz";
                if (i % 3 != 1) {
                    loader.register(input, new FakeDocument("Doc" + i, 1));
                }
                jobs.add(job(input, "out-" + i + ".pdf"));
            }

            BatchResult result = new BatchConverter(new JobFileParser(), dispatcher, 4).run(jobs, listener);

            assertThat(result.jobCount()).isEqualTo(12);
            assertThat(result.failures())
                    .extracting(failure -> failure.input().toString())
                    .containsExactly("missing-1.mscz", "missing-4.mscz", "missing-7.mscz", "missing-10.mscz");
            assertThat(writer.writes()).hasSize(8);
            assertThat(listener.events()).first().isEqualTo("start");
            assertThat(listener.events()).last().isEqualTo("finish");
            assertThat(listener.events()).hasSize(14);
        }

        @Test
        @DisplayName("Parallelism below one is refused")
        void invalidParallelism() {
            assertThatThrownBy(() -> new BatchConverter(new JobFileParser(), dispatcher, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancel during a job → remaining jobs recorded as CANCELLED")
        void cancelSkipsRemainingJobs() {
            BatchConverter converter = converter();
            ProgressListener cancelling = new ProgressListener() {
                @Override
                public void start() {}

                @Override
                public void progress(long current, long total, String label) {
                    if (current == 1) {
                        converter.cancel();
                    }
                }

                @Override
                public void finish(BatchResult result) {}
            };

            BatchResult result =
                    converter.run(List.of(job("a.mscz", "a.pdf"), job("c.mscz", "c.pdf")), cancelling);

            assertThat(tempDir.resolve("a.pdf")).exists();
            assertThat(tempDir.resolve("c.pdf")).doesNotExist();
            assertThat(result.failures()).extracting(JobFailure::code).containsExactly(ErrorCode.CANCELLED);
            assertThat(converter.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("A new run clears an earlier cancel request")
        void cancelResetsOnRun() {
            BatchConverter converter = converter();
            converter.cancel();

            BatchResult result = converter.run(List.of(job("a.mscz", "a.pdf")), listener);

            assertThat(result.isOk()).isTrue();
            assertThat(converter.isCancelled()).isFalse();
        }
    }
}

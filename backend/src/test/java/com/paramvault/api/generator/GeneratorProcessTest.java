package com.paramvault.api.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paramvault.api.exception.GeneratorIpcException;
import com.paramvault.api.exception.GeneratorStartupException;
import com.paramvault.api.support.FakeGeneratorMain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeneratorProcess")
class GeneratorProcessTest {

    private GeneratorProcess generator;

    @AfterEach
    void tearDown() {
        if (generator != null) {
            generator.stop();
        }
    }

    private GeneratorProcess fake(String mode) {
        return fake(mode, Duration.ofSeconds(5));
    }

    private GeneratorProcess fake(String mode, Duration responseTimeout) {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        List<String> command = List.of(java, "-cp", System.getProperty("java.class.path"),
                FakeGeneratorMain.class.getName(), mode);
        generator = new GeneratorProcess(command, Duration.ofSeconds(20), responseTimeout,
                Duration.ofMillis(500), 4096, new ObjectMapper());
        return generator;
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("should reach READY when the process announces readiness")
        void shouldBecomeReady() {
            GeneratorProcess process = fake("normal");

            process.start();

            assertThat(process.state()).isEqualTo(GeneratorState.READY);
            assertThat(process.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should be a no-op when already running")
        void shouldNotRestartLiveProcess() {
            GeneratorProcess process = fake("normal");
            process.start();
            List<String> first = process.requestBatch(1);

            process.start();
            List<String> second = process.requestBatch(1);

            // Same process keeps counting, a restart would reissue tok-1
            assertThat(first).containsExactly("tok-1");
            assertThat(second).containsExactly("tok-2");
        }

        @Test
        @DisplayName("should fail with captured stderr when the readiness line is wrong")
        void shouldRejectWrongReadinessLine() {
            GeneratorProcess process = fake("bad-ready");

            assertThatThrownBy(process::start)
                    .isInstanceOf(GeneratorStartupException.class)
                    .hasMessageContaining("NOT-READY")
                    .satisfies(e -> assertThat(((GeneratorStartupException) e).getStderr())
                            .contains("license check failed"));
            assertThat(process.state()).isEqualTo(GeneratorState.FAILED);
        }

        @Test
        @DisplayName("should fail when the process exits without output")
        void shouldFailOnEarlyExit() {
            GeneratorProcess process = fake("silent-exit");

            assertThatThrownBy(process::start)
                    .isInstanceOf(GeneratorStartupException.class)
                    .hasMessageContaining("exited before signalling readiness")
                    .satisfies(e -> assertThat(((GeneratorStartupException) e).getStderr())
                            .contains("missing runtime library"));
        }

        @Test
        @DisplayName("should fail and kill the process when readiness times out")
        void shouldTimeOutWaitingForReadiness() {
            String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
            generator = new GeneratorProcess(
                    List.of(java, "-cp", System.getProperty("java.class.path"), FakeGeneratorMain.class.getName(), "hang"),
                    Duration.ofSeconds(2), Duration.ofSeconds(1), Duration.ofMillis(200), 1024, new ObjectMapper());

            assertThatThrownBy(generator::start)
                    .isInstanceOf(GeneratorStartupException.class)
                    .hasMessageContaining("did not signal readiness");
            assertThat(generator.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should fail when the executable cannot be spawned")
        void shouldFailOnMissingExecutable() {
            generator = new GeneratorProcess(List.of("/nonexistent/generator-binary", "server"),
                    Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofMillis(200), 1024, new ObjectMapper());

            assertThatThrownBy(generator::start)
                    .isInstanceOf(GeneratorStartupException.class)
                    .hasMessageContaining("Failed to spawn generator");
            assertThat(generator.state()).isEqualTo(GeneratorState.FAILED);
        }
    }

    @Nested
    @DisplayName("requestBatch")
    class RequestBatch {

        @Test
        @DisplayName("should start lazily and parse the array after the diagnostic prefix")
        void shouldStartLazilyAndParse() {
            GeneratorProcess process = fake("normal");

            List<String> batch = process.requestBatch(3);

            assertThat(batch).containsExactly("tok-1", "tok-2", "tok-3");
            assertThat(process.state()).isEqualTo(GeneratorState.READY);
        }

        @Test
        @DisplayName("should reject non-positive batch sizes")
        void shouldRejectNonPositiveSize() {
            GeneratorProcess process = fake("normal");

            assertThatThrownBy(() -> process.requestBatch(0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(process.state()).isEqualTo(GeneratorState.STOPPED);
        }

        @Test
        @DisplayName("should raise IPC error and clear the process when the stream closes")
        void shouldFailOnClosedStream() {
            GeneratorProcess process = fake("die-on-request");

            assertThatThrownBy(() -> process.requestBatch(2))
                    .isInstanceOf(GeneratorIpcException.class)
                    .hasMessageContaining("closed its output stream")
                    .satisfies(e -> assertThat(((GeneratorIpcException) e).getStderr())
                            .contains("segfault in worker"));

            assertThat(process.state()).isEqualTo(GeneratorState.FAILED);
            assertThat(process.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should restart on the next request after an IPC failure")
        void shouldRestartAfterFailure() {
            // die-on-request dies again after restart, so a second IPC error proves a fresh process answered READY
            GeneratorProcess process = fake("die-on-request");

            assertThatThrownBy(() -> process.requestBatch(1)).isInstanceOf(GeneratorIpcException.class);
            assertThatThrownBy(() -> process.requestBatch(1))
                    .isInstanceOf(GeneratorIpcException.class)
                    .hasMessageContaining("closed its output stream");
        }

        @Test
        @DisplayName("should raise IPC error on output without a JSON array")
        void shouldFailOnGarbage() {
            GeneratorProcess process = fake("garbage");

            assertThatThrownBy(() -> process.requestBatch(1))
                    .isInstanceOf(GeneratorIpcException.class)
                    .hasMessageContaining("No JSON array");
            assertThat(process.state()).isEqualTo(GeneratorState.FAILED);
        }

        @Test
        @DisplayName("should serialize concurrent requests on the single pipe")
        void shouldSerializeConcurrentRequests() throws Exception {
            GeneratorProcess process = fake("normal");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Callable<List<String>>> calls = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    calls.add(() -> process.requestBatch(2));
                }

                List<String> all = new ArrayList<>();
                for (Future<List<String>> future : pool.invokeAll(calls)) {
                    List<String> batch = future.get();
                    assertThat(batch).hasSize(2);
                    all.addAll(batch);
                }

                // Interleaved pipes would lose or duplicate lines
                assertThat(all).hasSize(16).doesNotHaveDuplicates();
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("should be idempotent when nothing is running")
        void shouldBeIdempotent() {
            GeneratorProcess process = fake("normal");

            process.stop();
            process.stop();

            assertThat(process.state()).isEqualTo(GeneratorState.STOPPED);
        }

        @Test
        @DisplayName("should terminate a running generator")
        void shouldTerminate() {
            GeneratorProcess process = fake("normal");
            process.start();

            process.stop();

            assertThat(process.state()).isEqualTo(GeneratorState.STOPPED);
            assertThat(process.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should force-kill a generator that ignores termination")
        void shouldForceKill() {
            GeneratorProcess process = fake("stubborn");
            process.start();

            long started = System.nanoTime();
            process.stop();
            long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

            assertThat(process.state()).isEqualTo(GeneratorState.STOPPED);
            assertThat(elapsedMillis).isLessThan(10_000);
        }

        @Test
        @DisplayName("should allow a new start after stop")
        void shouldRestartAfterStop() {
            GeneratorProcess process = fake("normal");
            process.requestBatch(1);
            process.stop();

            List<String> batch = process.requestBatch(1);

            assertThat(batch).containsExactly("tok-1");
        }
    }
}

package com.paramvault.api.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paramvault.api.exception.GeneratorIpcException;
import com.paramvault.api.exception.GeneratorStartupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one long-lived generator process and speaks its line protocol:
 * the process prints {@code READY} once, then answers each {@code cluster <N>}
 * command with a single line holding a JSON array of credentials.
 *
 * Two locks guard the process. The communication lock serializes request/response
 * cycles on the pipes; the lifecycle lock guards spawn, teardown and stop. When both
 * are needed the communication lock is taken first. {@link #stop()} only takes the
 * lifecycle lock so it can kill a process that is stuck mid-request.
 */
@Slf4j
@Component
public class GeneratorProcess implements CredentialGenerator {

    static final String READY_SIGNAL = "READY";
    static final String BATCH_COMMAND = "cluster";

    private static final long STDERR_DRAIN_MILLIS = 500;

    private final List<String> command;
    private final Duration startupTimeout;
    private final Duration responseTimeout;
    private final Duration stopTimeout;
    private final int stderrBufferChars;
    private final BatchParser batchParser;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final ReentrantLock commLock = new ReentrantLock();

    private volatile GeneratorState state = GeneratorState.STOPPED;

    // Guarded by lifecycleLock
    private Process process;
    private BufferedWriter stdin;
    private BufferedReader stdout;
    private StderrCollector stderrCollector;
    private Thread stderrThread;
    private ExecutorService stdoutReader;

    @Autowired
    public GeneratorProcess(
            @Value("${generator.executable-path}") String executablePath,
            @Value("${generator.args:server}") String[] args,
            @Value("${generator.startup-timeout:30s}") Duration startupTimeout,
            @Value("${generator.response-timeout:60s}") Duration responseTimeout,
            @Value("${generator.stop-timeout:3s}") Duration stopTimeout,
            @Value("${generator.stderr-buffer-chars:8192}") int stderrBufferChars,
            ObjectMapper objectMapper) {
        this(buildCommand(executablePath, args), startupTimeout, responseTimeout, stopTimeout,
                stderrBufferChars, objectMapper);
    }

    public GeneratorProcess(List<String> command,
                            Duration startupTimeout,
                            Duration responseTimeout,
                            Duration stopTimeout,
                            int stderrBufferChars,
                            ObjectMapper objectMapper) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Generator command must not be empty");
        }
        this.command = List.copyOf(command);
        this.startupTimeout = startupTimeout;
        this.responseTimeout = responseTimeout;
        this.stopTimeout = stopTimeout;
        this.stderrBufferChars = stderrBufferChars;
        this.batchParser = new BatchParser(objectMapper);
    }

    private static List<String> buildCommand(String executablePath, String[] args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executablePath);
        Arrays.stream(args).filter(a -> !a.isBlank()).forEach(cmd::add);
        return cmd;
    }

    @Override
    public GeneratorState state() {
        return state;
    }

    @Override
    public void start() {
        lifecycleLock.lock();
        try {
            if (process != null && process.isAlive() && state.isLive()) {
                return;
            }
            // Leftovers from a process that died on its own
            if (process != null) {
                teardown();
            }

            state = GeneratorState.STARTING;
            log.info("Starting credential generator: {}", command);

            Process started;
            try {
                started = new ProcessBuilder(command).start();
            } catch (IOException e) {
                state = GeneratorState.FAILED;
                throw new GeneratorStartupException("Failed to spawn generator " + command.get(0), "", e);
            }
            attach(started);

            String readyLine;
            try {
                readyLine = readLine(stdout, stdoutReader, startupTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                String stderr = teardown();
                state = GeneratorState.FAILED;
                throw new GeneratorStartupException("Interrupted while waiting for generator readiness", stderr, e);
            } catch (IOException | TimeoutException e) {
                String stderr = teardown();
                state = GeneratorState.FAILED;
                throw new GeneratorStartupException("Generator did not signal readiness", stderr, e);
            }

            if (readyLine == null || !READY_SIGNAL.equals(readyLine.strip())) {
                String stderr = teardown();
                state = GeneratorState.FAILED;
                String reason = readyLine == null
                        ? "Generator exited before signalling readiness"
                        : "Unexpected readiness line from generator: " + BatchParser.preview(readyLine);
                throw new GeneratorStartupException(reason, stderr);
            }

            state = GeneratorState.READY;
            log.info("Credential generator is ready (pid {})", started.pid());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public List<String> requestBatch(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }

        commLock.lock();
        try {
            start();

            Process current;
            BufferedWriter writer;
            BufferedReader reader;
            ExecutorService readerThread;
            lifecycleLock.lock();
            try {
                if (process == null || !state.isLive()) {
                    throw new GeneratorIpcException("Generator stopped before the request was sent", "");
                }
                current = process;
                writer = stdin;
                reader = stdout;
                readerThread = stdoutReader;
                state = GeneratorState.BUSY;
            } finally {
                lifecycleLock.unlock();
            }

            try {
                writer.write(BATCH_COMMAND + " " + batchSize + "\n");
                writer.flush();

                String line = readLine(reader, readerThread, responseTimeout);
                if (line == null) {
                    throw new IOException("Generator closed its output stream");
                }

                List<String> batch = batchParser.parse(line);
                markReady(current);
                log.debug("Generator returned {} credentials for batch size {}", batch.size(), batchSize);
                return batch;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw fail(current, "Interrupted while waiting for generator response", e);
            } catch (IOException | TimeoutException e) {
                throw fail(current, "Error communicating with generator: " + describe(e), e);
            }
        } finally {
            commLock.unlock();
        }
    }

    @Override
    public void stop() {
        lifecycleLock.lock();
        try {
            if (process == null) {
                state = GeneratorState.STOPPED;
                return;
            }

            if (process.isAlive()) {
                state = GeneratorState.STOPPING;
                log.info("Stopping credential generator (pid {})", process.pid());
                process.destroy();
                try {
                    if (!process.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("Generator did not exit within {}ms, killing it", stopTimeout.toMillis());
                        process.destroyForcibly();
                        process.waitFor();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    process.destroyForcibly();
                }
            }

            teardown();
            state = GeneratorState.STOPPED;
            log.info("Credential generator stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void markReady(Process current) {
        lifecycleLock.lock();
        try {
            if (process == current && state == GeneratorState.BUSY) {
                state = GeneratorState.READY;
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Tears down the process that failed, unless it was already replaced or stopped,
     * and builds the exception to throw. The next request restarts lazily.
     */
    private GeneratorIpcException fail(Process failed, String message, Exception cause) {
        lifecycleLock.lock();
        try {
            String stderr = "";
            if (process == failed) {
                stderr = teardown();
                state = GeneratorState.FAILED;
            }
            log.warn("{}. Generator will be restarted on next request.", message);
            return new GeneratorIpcException(message, stderr, cause);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void attach(Process started) {
        process = started;
        stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
        stdout = new BufferedReader(new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8));

        stderrCollector = new StderrCollector(started.getErrorStream(), stderrBufferChars);
        stderrThread = new Thread(stderrCollector, "generator-stderr-" + started.pid());
        stderrThread.setDaemon(true);
        stderrThread.start();

        stdoutReader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "generator-stdout-" + started.pid());
            t.setDaemon(true);
            return t;
        });
    }

    private static String readLine(BufferedReader reader, ExecutorService readerThread, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        Future<String> pending;
        try {
            pending = readerThread.submit(reader::readLine);
        } catch (RejectedExecutionException e) {
            throw new IOException("Generator output is no longer readable", e);
        }
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to read generator output", e.getCause());
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TimeoutException("No output from generator within " + timeout.toMillis() + "ms");
        }
    }

    /**
     * Kills the process if needed, releases its pipes and returns captured stderr.
     * Caller must hold the lifecycle lock.
     */
    private String teardown() {
        Process dying = process;
        if (dying == null) {
            return "";
        }

        if (dying.isAlive()) {
            dying.destroyForcibly();
        }
        try {
            dying.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            stderrThread.join(STDERR_DRAIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        String stderr = stderrCollector.snapshot();
        closeQuietly(dying);
        stdoutReader.shutdownNow();

        process = null;
        stdin = null;
        stdout = null;
        stderrCollector = null;
        stderrThread = null;
        stdoutReader = null;
        return stderr;
    }

    // Closes the raw pipes; the buffered wrappers may still be locked by a pending read
    private void closeQuietly(Process dying) {
        try {
            dying.getOutputStream().close();
        } catch (IOException e) {
            log.trace("Generator stdin already closed: {}", e.getMessage());
        }
        try {
            dying.getInputStream().close();
        } catch (IOException e) {
            log.trace("Generator stdout already closed: {}", e.getMessage());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

package com.paramvault.api.generator;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a child process error stream so the child never blocks on a full pipe,
 * keeping the most recent output for error reports.
 */
@Slf4j
class StderrCollector implements Runnable {

    private final InputStream stream;
    private final int capacity;
    private final StringBuilder tail = new StringBuilder();

    StderrCollector(InputStream stream, int capacity) {
        this.stream = stream;
        this.capacity = capacity;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("generator stderr: {}", line);
                append(line);
            }
        } catch (IOException e) {
            // Stream closed by teardown
            log.trace("Generator stderr stream closed: {}", e.getMessage());
        }
    }

    private synchronized void append(String line) {
        tail.append(line).append('\n');
        int overflow = tail.length() - capacity;
        if (overflow > 0) {
            tail.delete(0, overflow);
        }
    }

    synchronized String snapshot() {
        return tail.toString();
    }
}

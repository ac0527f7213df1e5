package com.eyelevel.docpipeline.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an external command with a timeout, draining stdout and stderr on separate threads.
 */
@Component
@Slf4j
public class ProcessExecutor {

    /**
     * Upper bound on captured stdout/stderr, enough for error messages.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;
    private static final long STREAM_DRAIN_SECONDS = 10;

    /**
     * @param command        the command and its arguments.
     * @param contextInfo    log prefix.
     * @param timeoutMinutes maximum run time before the process is killed.
     * @param processName    short name used in logs and messages, e.g. "gs".
     * @throws IOException          if the process cannot start or times out.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
            throws IOException, InterruptedException {

        Process process = new ProcessBuilder(command).start();
        StringBuilder stdoutCapture = new StringBuilder();
        StringBuilder stderrCapture = new StringBuilder();

        ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, processName + "-stream");
            thread.setDaemon(true);
            return thread;
        });
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new IOException(processName + " process timeout after " + timeoutMinutes + " minutes.");
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * @param exitCode zero on success.
     * @param stdout   captured standard output, truncated.
     * @param stderr   captured standard error, truncated.
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}

package io.playengine.process;

import io.playengine.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command on a terminal, forwards everything it prints and answers password prompts.
 * <p>
 * A pump thread reads the terminal; this thread scans a bounded window of recent output against
 * the prompt table and checks the cancel flag and deadline between reads. Every prompt key is
 * answered at most once.
 */
public final class InteractiveProcessRunner implements ProcessRunner {
    private static final Logger LOG = LoggerFactory.getLogger(InteractiveProcessRunner.class);
    private static final int WINDOW_CHARS = 4096;
    public static final String TIMEOUT_EXPLANATION = "Job terminated due to timeout";

    private final TerminalLauncher launcher;
    private final long pollIntervalMs;

    public InteractiveProcessRunner(TerminalLauncher launcher, long pollIntervalMs) {
        this.launcher = launcher;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
    }

    @Override
    public ProcessOutcome run(ProcessRequest request) throws IOException, InterruptedException {
        TerminalProcess process = launcher.launch(request.args(), request.cwd(), request.env());
        LOG.debug("Started {} {} in {}", request.job().kind(), request.job().id(), request.cwd());

        BlockingQueue<Chunk> chunks = new LinkedBlockingQueue<>();
        Thread pump = new Thread(() -> pumpOutput(process.output(), chunks),
                "pty-reader-" + request.job().kind() + "-" + request.job().id());
        pump.setDaemon(true);
        pump.start();

        long deadline = request.timeoutSeconds() > 0
                ? System.nanoTime() + TimeUnit.SECONDS.toNanos(request.timeoutSeconds())
                : Long.MAX_VALUE;
        StringBuilder window = new StringBuilder();
        Set<String> answered = new HashSet<>();
        boolean canceled = false;
        boolean timedOut = false;
        try {
            while (true) {
                Chunk chunk = chunks.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (chunk != null && chunk.eof()) {
                    break;
                }
                if (chunk != null) {
                    request.stdout().write(chunk.text());
                    request.stdout().flush();
                    window.append(chunk.text());
                    answerPrompts(window, answered, request, process.input());
                    if (window.length() > WINDOW_CHARS) {
                        window.delete(0, window.length() - WINDOW_CHARS);
                    }
                }
                if (request.cancelCheck().isCanceled()) {
                    canceled = true;
                    break;
                }
                if (System.nanoTime() > deadline) {
                    timedOut = true;
                    break;
                }
            }
        } catch (InterruptedException | IOException | RuntimeException e) {
            // The caller tears down the private data dir next; the child must not outlive it.
            LOG.warn("Terminating {} {} after {}", request.job().kind(), request.job().id(), e.toString());
            process.terminate();
            throw e;
        }

        if (canceled || timedOut) {
            LOG.info("Terminating {} {}: {}", request.job().kind(), request.job().id(),
                    canceled ? "canceled" : "timed out");
            process.terminate();
            drain(chunks, request);
            if (canceled) {
                return ProcessOutcome.of(JobStatus.CANCELED, exitValueOr(process, -1));
            }
            return new ProcessOutcome(JobStatus.FAILED, exitValueOr(process, -1), TIMEOUT_EXPLANATION);
        }

        process.waitFor(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        int rc = process.exitValue();
        return ProcessOutcome.of(rc == 0 ? JobStatus.SUCCESSFUL : JobStatus.FAILED, rc);
    }

    private static void answerPrompts(StringBuilder window, Set<String> answered, ProcessRequest request,
                                      OutputStream input) throws IOException {
        PasswordPromptMap.PromptMatch match;
        while ((match = request.prompts().firstMatch(window, answered)) != null) {
            answered.add(match.key());
            String value = request.passwords().getOrDefault(match.key(), "");
            input.write((value + "\n").getBytes(StandardCharsets.UTF_8));
            input.flush();
            LOG.debug("Answered prompt {} for {} {}", match.key(), request.job().kind(), request.job().id());
            window.delete(0, match.end());
        }
    }

    private static void pumpOutput(InputStream output, BlockingQueue<Chunk> chunks) {
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(output, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buffer)) >= 0) {
                if (n > 0) {
                    chunks.add(new Chunk(new String(buffer, 0, n), false));
                }
            }
        } catch (IOException e) {
            // A pty reports EIO once the child side is closed.
            LOG.debug("Terminal output closed: {}", e.getMessage());
        } finally {
            chunks.add(Chunk.END);
        }
    }

    // Whatever the child printed before it died still belongs in the captured output.
    private void drain(BlockingQueue<Chunk> chunks, ProcessRequest request) throws InterruptedException {
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(pollIntervalMs, 500L));
        try {
            while (System.nanoTime() < until) {
                Chunk chunk = chunks.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (chunk != null && chunk.eof()) {
                    return;
                }
                if (chunk != null) {
                    request.stdout().write(chunk.text());
                }
            }
        } catch (IOException e) {
            LOG.debug("Failed to drain output of {} {}: {}", request.job().kind(), request.job().id(), e.getMessage());
        }
    }

    private static int exitValueOr(TerminalProcess process, int fallback) {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return fallback;
        }
    }

    private record Chunk(String text, boolean eof) {
        private static final Chunk END = new Chunk("", true);
    }
}

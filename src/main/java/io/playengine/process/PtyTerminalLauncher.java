package io.playengine.process;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/** Starts children on a fresh pseudo-terminal so interactive password prompts are shown. */
public final class PtyTerminalLauncher implements TerminalLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(PtyTerminalLauncher.class);
    private static final long TERMINATE_GRACE_MS = 5_000L;

    private final int columns;
    private final int rows;

    public PtyTerminalLauncher(int columns, int rows) {
        this.columns = Math.max(20, columns);
        this.rows = Math.max(5, rows);
    }

    @Override
    public TerminalProcess launch(List<String> args, Path cwd, Map<String, String> env) throws IOException {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        PtyProcess process = new PtyProcessBuilder(args.toArray(new String[0]))
                .setEnvironment(new HashMap<>(env))
                .setDirectory(cwd.toString())
                .setRedirectErrorStream(true)
                .setInitialColumns(columns)
                .setInitialRows(rows)
                .start();
        return new PtyTerminalProcess(process);
    }

    private static final class PtyTerminalProcess implements TerminalProcess {
        private final PtyProcess process;

        private PtyTerminalProcess(PtyProcess process) {
            this.process = process;
        }

        @Override
        public InputStream output() {
            return process.getInputStream();
        }

        @Override
        public OutputStream input() {
            return process.getOutputStream();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return process.waitFor(timeout, unit);
        }

        @Override
        public int exitValue() {
            return process.exitValue();
        }

        @Override
        public void terminate() {
            descendants().forEach(ProcessHandle::destroy);
            process.destroy();
            try {
                if (!process.waitFor(TERMINATE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    descendants().forEach(ProcessHandle::destroyForcibly);
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        private Stream<ProcessHandle> descendants() {
            try {
                return ProcessHandle.of(process.pid()).map(ProcessHandle::descendants).orElseGet(Stream::empty);
            } catch (UnsupportedOperationException e) {
                LOG.debug("No process handle for terminal child: {}", e.getMessage());
                return Stream.empty();
            }
        }
    }
}

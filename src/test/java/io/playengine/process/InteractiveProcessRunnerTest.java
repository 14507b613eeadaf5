package io.playengine.process;

import io.playengine.model.Job;
import io.playengine.model.JobStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class InteractiveProcessRunnerTest {
    private static final PasswordPromptMap PROMPTS = PasswordPromptMap.builder()
            .prompt("Enter passphrase for .*:\\s*?$", "ssh_key_unlock")
            .prompt("SSH password:\\s*?$", "ssh_password")
            .prompt("Vault password:\\s*?$", "vault_password")
            .build();

    @Test
    void answersEachPromptOnceAndForwardsOutput() throws Exception {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("Enter passphrase for /tmp/key: ");
            t.awaitLine();
            t.print("\nSSH password: ");
            t.awaitLine();
            t.print("\nEnter passphrase for /tmp/key: \nPLAY RECAP\n");
            t.exit(0);
        });
        StringWriter stdout = new StringWriter();

        ProcessOutcome outcome = runner(terminal).run(request(stdout,
                Map.of("ssh_key_unlock", "unlock-me", "ssh_password", "pw"), CancelCheck.NEVER, 0L));

        Assertions.assertEquals(JobStatus.SUCCESSFUL, outcome.status());
        Assertions.assertEquals(0, outcome.exitCode());
        Assertions.assertEquals(List.of("unlock-me", "pw"), terminal.answers);
        Assertions.assertTrue(stdout.toString().contains("PLAY RECAP"));
        Assertions.assertTrue(stdout.toString().startsWith("Enter passphrase for /tmp/key: "));
    }

    @Test
    void missingPasswordIsAnsweredWithEmptyLine() throws Exception {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("Vault password: ");
            t.awaitLine();
            t.exit(0);
        });

        runner(terminal).run(request(new StringWriter(), Map.of(), CancelCheck.NEVER, 0L));

        Assertions.assertEquals(List.of(""), terminal.answers);
    }

    @Test
    void nonzeroExitIsFailed() throws Exception {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("fatal: unreachable\n");
            t.exit(4);
        });

        ProcessOutcome outcome = runner(terminal).run(request(new StringWriter(), Map.of(), CancelCheck.NEVER, 0L));

        Assertions.assertEquals(JobStatus.FAILED, outcome.status());
        Assertions.assertEquals(4, outcome.exitCode());
        Assertions.assertNull(outcome.explanation());
    }

    @Test
    void cancelFlagTerminatesTheProcess() throws Exception {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("TASK [long running] ****\n");
            t.awaitExit();
        });
        AtomicBoolean cancel = new AtomicBoolean(false);
        StringWriter stdout = new StringWriter();
        Thread canceler = new Thread(() -> {
            try {
                Thread.sleep(150L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancel.set(true);
        });
        canceler.start();

        ProcessOutcome outcome = runner(terminal).run(request(stdout, Map.of(), cancel::get, 0L));

        Assertions.assertEquals(JobStatus.CANCELED, outcome.status());
        Assertions.assertTrue(terminal.terminated.get());
        Assertions.assertTrue(stdout.toString().contains("long running"));
        canceler.join();
    }

    @Test
    void timeoutFailsWithExplanation() throws Exception {
        ScriptedTerminal terminal = new ScriptedTerminal(ScriptedTerminal::awaitExit);

        ProcessOutcome outcome = runner(terminal).run(request(new StringWriter(), Map.of(), CancelCheck.NEVER, 1L));

        Assertions.assertEquals(JobStatus.FAILED, outcome.status());
        Assertions.assertEquals(InteractiveProcessRunner.TIMEOUT_EXPLANATION, outcome.explanation());
        Assertions.assertTrue(terminal.terminated.get());
    }

    @Test
    void failedPromptAnswerTerminatesTheProcess() {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("SSH password: ");
            t.awaitExit();
        }).failingInput(new IOException("Input/output error"));

        IOException error = Assertions.assertThrows(IOException.class, () -> runner(terminal).run(
                request(new StringWriter(), Map.of("ssh_password", "pw"), CancelCheck.NEVER, 0L)));

        Assertions.assertEquals("Input/output error", error.getMessage());
        Assertions.assertTrue(terminal.terminated.get());
        Assertions.assertFalse(terminal.isAlive());
    }

    @Test
    void failingCancelCheckTerminatesTheProcess() {
        ScriptedTerminal terminal = new ScriptedTerminal(t -> {
            t.print("TASK [long running] ****\n");
            t.awaitExit();
        });
        CancelCheck broken = () -> {
            throw new IllegalStateException("job store unavailable");
        };

        Assertions.assertThrows(IllegalStateException.class,
                () -> runner(terminal).run(request(new StringWriter(), Map.of(), broken, 0L)));

        Assertions.assertTrue(terminal.terminated.get());
    }

    private static InteractiveProcessRunner runner(ScriptedTerminal terminal) {
        return new InteractiveProcessRunner((args, cwd, env) -> terminal.start(), 20L);
    }

    private static ProcessRequest request(StringWriter stdout, Map<String, String> passwords, CancelCheck cancel,
                                          long timeoutSeconds) {
        return new ProcessRequest(
                Job.of(1L, "site.yml", Path.of("/tmp")),
                List.of("ansible-playbook", "site.yml"),
                Path.of("/tmp"),
                Map.of(),
                PROMPTS,
                passwords,
                stdout,
                cancel,
                timeoutSeconds
        );
    }

    @FunctionalInterface
    private interface Script {
        void play(ScriptedTerminal terminal) throws Exception;
    }

    /** A fake terminal whose child side is played by a script thread. */
    private static final class ScriptedTerminal implements TerminalProcess {
        private final Script script;
        private final PipedOutputStream childOut = new PipedOutputStream();
        private final PipedInputStream output;
        private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        private final List<String> answers = new CopyOnWriteArrayList<>();
        private final CountDownLatch exited = new CountDownLatch(1);
        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private volatile int exitCode = Integer.MIN_VALUE;
        private volatile IOException inputFailure;

        private final OutputStream input = new OutputStream() {
            private final ByteArrayOutputStream line = new ByteArrayOutputStream();

            @Override
            public synchronized void write(int b) throws IOException {
                if (inputFailure != null) {
                    throw inputFailure;
                }
                if (b == '\n') {
                    String text = line.toString(StandardCharsets.UTF_8);
                    line.reset();
                    answers.add(text);
                    lines.add(text);
                } else {
                    line.write(b);
                }
            }
        };

        private ScriptedTerminal(Script script) {
            this.script = script;
            try {
                this.output = new PipedInputStream(childOut, 64 * 1024);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        private ScriptedTerminal failingInput(IOException failure) {
            this.inputFailure = failure;
            return this;
        }

        private ScriptedTerminal start() {
            Thread child = new Thread(() -> {
                try {
                    script.play(this);
                } catch (Exception e) {
                    exit(-1);
                }
            }, "scripted-terminal");
            child.setDaemon(true);
            child.start();
            return this;
        }

        void print(String text) throws IOException {
            childOut.write(text.getBytes(StandardCharsets.UTF_8));
            childOut.flush();
        }

        void awaitLine() throws InterruptedException {
            if (lines.poll(5, TimeUnit.SECONDS) == null) {
                throw new IllegalStateException("prompt was never answered");
            }
        }

        void awaitExit() throws InterruptedException {
            exited.await(10, TimeUnit.SECONDS);
        }

        synchronized void exit(int code) {
            if (exitCode != Integer.MIN_VALUE) {
                return;
            }
            exitCode = code;
            try {
                childOut.close();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            exited.countDown();
        }

        @Override
        public InputStream output() {
            return output;
        }

        @Override
        public OutputStream input() {
            return input;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(Math.min(timeout, 10_000L), TimeUnit.MILLISECONDS);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("still running");
            }
            return exitCode;
        }

        @Override
        public void terminate() {
            terminated.set(true);
            exit(-15);
        }
    }
}

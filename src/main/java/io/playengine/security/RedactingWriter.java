package io.playengine.security;

import java.io.IOException;
import java.io.Writer;

/**
 * Line-buffered writer that redacts each complete line before passing it on. A trailing partial line
 * is flushed redacted on {@link #close()}.
 */
public final class RedactingWriter extends Writer {
    private final Writer delegate;
    private final SecretRedactor redactor;
    private final StringBuilder pending = new StringBuilder();
    private boolean closed;

    public RedactingWriter(Writer delegate, SecretRedactor redactor) {
        this.delegate = delegate;
        this.redactor = redactor;
    }

    @Override
    public synchronized void write(char[] cbuf, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("writer closed");
        }
        for (int i = off; i < off + len; i++) {
            char c = cbuf[i];
            pending.append(c);
            if (c == '\n') {
                delegate.write(redactor.redact(pending.toString()));
                pending.setLength(0);
            }
        }
    }

    @Override
    public synchronized void flush() throws IOException {
        delegate.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (pending.length() > 0) {
                delegate.write(redactor.redact(pending.toString()));
                pending.setLength(0);
            }
            delegate.flush();
        } finally {
            delegate.close();
        }
    }
}

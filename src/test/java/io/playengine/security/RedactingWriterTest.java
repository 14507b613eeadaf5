package io.playengine.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

final class RedactingWriterTest {

    @Test
    void secretSplitAcrossWritesIsStillRedacted() throws Exception {
        StringWriter sink = new StringWriter();
        RedactingWriter writer = new RedactingWriter(sink, SecretRedactor.of(List.of("hunter2")));

        writer.write("password is hun");
        writer.flush();
        Assertions.assertEquals("", sink.toString());
        writer.write("ter2\nnext line");
        Assertions.assertEquals("password is " + SecretRedactor.HIDDEN + "\n", sink.toString());
        writer.close();

        Assertions.assertEquals("password is " + SecretRedactor.HIDDEN + "\nnext line", sink.toString());
        writer.close();
    }
}

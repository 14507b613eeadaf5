package io.playengine.security;

import io.playengine.util.Jsons;
import io.playengine.util.ShellQuoting;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SecretRedactorTest {

    @Test
    void redactsEveryOccurrenceLongestFirst() {
        SecretRedactor redactor = SecretRedactor.of(List.of("abc", "abcdef", "", "  "));

        Assertions.assertEquals("x " + SecretRedactor.HIDDEN + " y " + SecretRedactor.HIDDEN,
                redactor.redact("x abcdef y abc"));
        Assertions.assertEquals(List.of("abcdef", "abc"), redactor.secrets());
        Assertions.assertEquals("nothing here", redactor.redact("nothing here"));
    }

    @Test
    void escapedFormsInsideJsonAndShellScriptsAreRedacted() {
        String secret = "S3cr\"et\\Value'x";
        SecretRedactor redactor = SecretRedactor.of(List.of(secret));

        String extraVars = Jsons.toCompactJson(Map.of("password", secret));
        Assertions.assertEquals("{\"password\":\"" + SecretRedactor.HIDDEN + "\"}", redactor.redact(extraVars));

        String script = ShellQuoting.commandLine("ansible-playbook", "-e", extraVars, "site.yml");
        Assertions.assertFalse(redactor.redact(script).contains("S3cr"));
        Assertions.assertFalse(redactor.redact(Jsons.toCompactJson(List.of("sh", "-c", script))).contains("S3cr"));
        Assertions.assertFalse(redactor.redact(Jsons.toCompactJson(List.of("-e", extraVars))).contains("S3cr"));
    }

    @Test
    void noneLeavesTextAlone() {
        Assertions.assertTrue(SecretRedactor.none().isEmpty());
        Assertions.assertEquals("s3cr3t", SecretRedactor.none().redact("s3cr3t"));
    }

    @Test
    void multiLineSecretsAlsoMatchLineByLine() {
        String pem = "-----BEGIN KEY-----\nMIIBOgIBAAJBAK\n-----END KEY-----";
        SecretRedactor redactor = SecretRedactor.of(List.of(pem));

        Assertions.assertEquals(SecretRedactor.HIDDEN, redactor.redact(pem));
        Assertions.assertEquals("line: " + SecretRedactor.HIDDEN + "\n", redactor.redact("line: MIIBOgIBAAJBAK\n"));
    }

    @Test
    void redactsNestedStructures() {
        SecretRedactor redactor = SecretRedactor.of(List.of("pw1"));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("args", List.of("-e", "{\"p\":\"pw1\"}"));
        fields.put("nested", Map.of("k", "pw1"));
        fields.put("count", 3);

        Map<String, Object> out = redactor.redact(fields);

        Assertions.assertEquals(List.of("-e", "{\"p\":\"" + SecretRedactor.HIDDEN + "\"}"), out.get("args"));
        Assertions.assertEquals(Map.of("k", SecretRedactor.HIDDEN), out.get("nested"));
        Assertions.assertEquals(3, out.get("count"));
    }

    @Test
    void safeEnvHidesSensitiveKeysAndPasswordUrls() {
        SecretRedactor redactor = SecretRedactor.of(List.of("value-secret"));
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AWS_SECRET_KEY", "x");
        env.put("MY_API_ENDPOINT", "x");
        env.put("AWS_ACCESS_KEY_ID", "AKIA");
        env.put("REST_API_URL", "http://localhost");
        env.put("ANSIBLE_HOST_KEY_CHECKING", "False");
        env.put("ANSIBLE_NET_PASSWORD", "x");
        env.put("PROXY", "http://user:pw@proxy:3128");
        env.put("PLAIN", "has value-secret inside");
        env.put("HOME", "/root");

        Map<String, String> safe = redactor.safeEnv(env);

        Assertions.assertEquals(SecretRedactor.HIDDEN, safe.get("AWS_SECRET_KEY"));
        Assertions.assertEquals(SecretRedactor.HIDDEN, safe.get("MY_API_ENDPOINT"));
        Assertions.assertEquals("AKIA", safe.get("AWS_ACCESS_KEY_ID"));
        Assertions.assertEquals("http://localhost", safe.get("REST_API_URL"));
        Assertions.assertEquals("False", safe.get("ANSIBLE_HOST_KEY_CHECKING"));
        Assertions.assertEquals(SecretRedactor.HIDDEN, safe.get("ANSIBLE_NET_PASSWORD"));
        Assertions.assertEquals(SecretRedactor.HIDDEN, safe.get("PROXY"));
        Assertions.assertEquals("has " + SecretRedactor.HIDDEN + " inside", safe.get("PLAIN"));
        Assertions.assertEquals("/root", safe.get("HOME"));
        Assertions.assertEquals("x", env.get("AWS_SECRET_KEY"));
    }
}

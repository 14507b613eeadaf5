package io.playengine.credential;

/** A credential could not be turned into process inputs. Fatal for the run, never retried. */
public class CredentialInjectionException extends RuntimeException {
    public CredentialInjectionException(String message) {
        super(message);
    }

    public CredentialInjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

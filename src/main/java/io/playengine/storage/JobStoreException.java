package io.playengine.storage;

public class JobStoreException extends RuntimeException {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.isolation.lab.harness;

public abstract class HarnessException extends RuntimeException {

    protected HarnessException(String message) {
        super(message);
    }

    protected HarnessException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}

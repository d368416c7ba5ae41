package io.isolation.lab.harness;

public class LockTimeoutException extends HarnessException {

    public LockTimeoutException(String message) {
        super(message);
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.LOCK_TIMEOUT;
    }
}

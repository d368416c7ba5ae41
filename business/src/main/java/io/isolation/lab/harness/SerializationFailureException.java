package io.isolation.lab.harness;

public class SerializationFailureException extends HarnessException {

    public SerializationFailureException(String message) {
        super(message);
    }

    public SerializationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERIALIZATION_FAILURE;
    }
}

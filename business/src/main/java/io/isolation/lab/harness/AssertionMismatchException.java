package io.isolation.lab.harness;

public class AssertionMismatchException extends HarnessException {

    public AssertionMismatchException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ASSERTION_MISMATCH;
    }
}

package io.isolation.lab.harness;

public class StepExecutionException extends HarnessException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STEP_EXECUTION;
    }
}

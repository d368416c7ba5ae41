package io.isolation.lab.harness;

public class ActorMisuseException extends HarnessException {

    public ActorMisuseException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ACTOR_MISUSE;
    }
}

package io.isolation.lab.harness;

import java.util.Objects;

public record ActorSpec(String role, IsolationLevel isolationLevel) {

    public ActorSpec {
        Objects.requireNonNull(role, "role cannot be null");
        Objects.requireNonNull(isolationLevel, "isolationLevel cannot be null");
        if (role.isBlank()) throw new IllegalArgumentException("role cannot be blank");
    }
}

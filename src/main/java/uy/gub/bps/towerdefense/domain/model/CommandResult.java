package uy.gub.bps.towerdefense.domain.model;

import java.util.Objects;

public record CommandResult<T>(T value, CommandFailure failure) {

    public static <T> CommandResult<T> ok(T value) {
        return new CommandResult<>(value, null);
    }

    public static <T> CommandResult<T> failed(CommandFailure failure) {
        return new CommandResult<>(null, Objects.requireNonNull(failure));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public <U> CommandResult<U> withValue(U other) {
        return isSuccess() ? ok(other) : failed(failure);
    }
}

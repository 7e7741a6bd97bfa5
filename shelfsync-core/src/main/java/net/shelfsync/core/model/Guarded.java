package net.shelfsync.core.model;

public record Guarded<T>(GuardStatus status, T value) {
    public static <T> Guarded<T> applied(T value) { return new Guarded<>(GuardStatus.APPLIED, value); }

    public static <T> Guarded<T> rejected(GuardStatus status) { return new Guarded<>(status, null); }
}

package net.shelfsync.core.model;

public record ApplyResult(Status status, String reason) {
    public enum Status { APPLIED, UNCHANGED, FAILED }

    public static ApplyResult applied() { return new ApplyResult(Status.APPLIED, null); }

    public static ApplyResult unchanged() { return new ApplyResult(Status.UNCHANGED, null); }

    public static ApplyResult failed(String reason) { return new ApplyResult(Status.FAILED, reason); }
}

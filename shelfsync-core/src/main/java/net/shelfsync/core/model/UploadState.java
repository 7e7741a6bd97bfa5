package net.shelfsync.core.model;

public enum UploadState {
    INITIAL, QUEUED, UPLOADING;

    public static UploadState from(String s) {
        if (s == null) return null;
        return UploadState.valueOf(s.toUpperCase());
    }

    public String code() { return name(); }
}

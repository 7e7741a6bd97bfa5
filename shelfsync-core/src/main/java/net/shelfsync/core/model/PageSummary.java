package net.shelfsync.core.model;

/** 한 번의 태스크 호출(한 페이지) 처리 결과 집계 */
public record PageSummary(int processed, int applied, int unchanged, int failed) {
    public static final PageSummary EMPTY = new PageSummary(0, 0, 0, 0);

    public PageSummary plus(ApplyResult.Status status) {
        return switch (status) {
            case APPLIED -> new PageSummary(processed + 1, applied + 1, unchanged, failed);
            case UNCHANGED -> new PageSummary(processed + 1, applied, unchanged + 1, failed);
            case FAILED -> new PageSummary(processed + 1, applied, unchanged, failed + 1);
        };
    }

    public boolean foundUnchanged() {
        return unchanged > 0;
    }
}

package net.shelfsync.core.model;

import java.util.List;

/** 한 페이지 분량의 레코드와 다음 커서(null = 마지막 페이지) */
public record Page(List<FeedRecord> records, String nextCursor) {
    public Page {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean last() {
        return nextCursor == null;
    }
}

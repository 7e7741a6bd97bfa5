package net.shelfsync.core.spi;

import net.shelfsync.core.model.CompletionEvent;

/** 커서 순회가 끝났을 때 다운스트림 단계(예: reap)에 보내는 신호 */
@FunctionalInterface
public interface CompletionListener {
    void onComplete(CompletionEvent event) throws Exception;

    static CompletionListener none() {
        return event -> { };
    }
}

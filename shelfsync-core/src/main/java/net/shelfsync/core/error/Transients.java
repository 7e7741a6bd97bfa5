package net.shelfsync.core.error;

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 예외가 "잠시 후 같은 인자로 다시 돌리면 될" 실패인지 판정한다.
 * 원인 체인 전체를 본다(래핑된 SQLException 포함).
 */
public final class Transients {
    private static final int MAX_DEPTH = 16;

    private Transients() {
    }

    public static boolean isTransient(Throwable t) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable cur = t; cur != null && seen.size() < MAX_DEPTH && seen.add(cur); cur = cur.getCause()) {
            if (cur instanceof TransientFailureException) return true;
            if (cur instanceof StorageException se && se.retryable()) return true;
            if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) return true;
        }
        return false;
    }
}

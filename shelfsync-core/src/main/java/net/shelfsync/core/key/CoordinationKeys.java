package net.shelfsync.core.key;

import java.util.ArrayList;
import java.util.List;

/**
 * 코디네이션 스토어 키 형식: {component}:{type}:{part...}
 */
public final class CoordinationKeys {
    public static final String COMPONENT = "shelfsync";
    public static final String UPLOAD = "upload";
    public static final String IDENTIFIER_SET = "IdentifierSet";

    private CoordinationKeys() {}

    public static String of(String type, List<String> parts) {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("key type is required");
        var all = new ArrayList<String>(parts.size() + 2);
        all.add(COMPONENT);
        all.add(type);
        for (String p : parts) {
            if (p == null) throw new IllegalArgumentException("key part must not be null: " + type + parts);
            all.add(p);
        }
        return String.join(":", all);
    }

    public static String lock(String lockType, String... resource) {
        return of(lockType, List.of(resource));
    }

    public static String uploadSession(String sessionId) {
        return of(UPLOAD, List.of(sessionId));
    }

    /** 로그용: 세션 키 + 출력 키 */
    public static String uploadBuffer(String sessionId, String outputKey) {
        return of(UPLOAD, List.of(sessionId, outputKey));
    }

    public static String identifierSet(String resourceId, String runId) {
        return of(IDENTIFIER_SET, List.of(resourceId, runId));
    }
}

package net.shelfsync.core.model;

import java.time.Duration;

/** 세션 변경 가드: 락 소유 토큰 + 호출자가 알고 있는 update number */
public record SessionGuard(String token, long expectedUpdateNumber, Duration sessionTtl) {
}

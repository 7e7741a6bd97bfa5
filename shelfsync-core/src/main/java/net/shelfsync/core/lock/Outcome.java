package net.shelfsync.core.lock;

/**
 * 락 범위 안에서 실행된 본문의 결과.
 * Superseded는 "의도한 조기 종료"로 정상 종료 경로를 타고, Failed는 에러 정리 경로를 탄다.
 */
public interface Outcome<T> {

    record Completed<T>(T value) implements Outcome<T> {}

    record Superseded<T>(String reason) implements Outcome<T> {}

    record Failed<T>(String reason) implements Outcome<T> {}

    static <T> Outcome<T> completed(T value) { return new Completed<>(value); }

    static <T> Outcome<T> superseded(String reason) { return new Superseded<>(reason); }

    static <T> Outcome<T> failed(String reason) { return new Failed<>(reason); }

    default boolean failed() {
        return this instanceof Failed;
    }

    /** Completed면 값, 아니면 null */
    default T valueOrNull() {
        return this instanceof Completed<T> c ? c.value() : null;
    }
}

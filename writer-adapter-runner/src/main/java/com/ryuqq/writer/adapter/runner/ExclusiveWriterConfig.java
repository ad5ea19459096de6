package com.ryuqq.writer.adapter.runner;

/**
 * ExclusiveWriter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>handoffRecheckMs: 작업 인계 대기 중 worker 활성 여부를 재확인하는 간격 (기본 50ms)</li>
 *   <li>idleLingerMs: 큐가 비었을 때 worker가 종료 전 추가로 대기하는 시간 (기본 0ms = 즉시 종료)</li>
 *   <li>threadNamePrefix: worker 스레드 및 WorkerToken 이름 접두사 (기본 "exclusive-writer")</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>짧은 작업이 몰려 들어오는 경우: idleLingerMs 증가 (0 → 5), worker 재생성 감소</li>
 *   <li>handoffRecheckMs는 worker 종료 직후 인계가 지연될 수 있는 최대 시간이기도 함</li>
 * </ul>
 *
 * @author Writer Team
 * @since 1.0.0
 * @param handoffRecheckMs 인계 재확인 간격 (밀리초, 양수여야 함)
 * @param idleLingerMs 유휴 대기 시간 (밀리초, 0 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (빈 문자열 불가)
 */
public record ExclusiveWriterConfig(
    long handoffRecheckMs,
    long idleLingerMs,
    String threadNamePrefix
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: handoffRecheckMs=50ms, idleLingerMs=0ms, threadNamePrefix="exclusive-writer"</p>
     */
    public ExclusiveWriterConfig() {
        this(50, 0, "exclusive-writer");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExclusiveWriterConfig {
        if (handoffRecheckMs <= 0) {
            throw new IllegalArgumentException(
                "handoffRecheckMs must be positive (current: " + handoffRecheckMs + ")"
            );
        }
        if (idleLingerMs < 0) {
            throw new IllegalArgumentException(
                "idleLingerMs cannot be negative (current: " + idleLingerMs + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * handoffRecheckMs만 변경한 새 인스턴스 생성.
     */
    public ExclusiveWriterConfig withHandoffRecheckMs(long handoffRecheckMs) {
        return new ExclusiveWriterConfig(handoffRecheckMs, idleLingerMs, threadNamePrefix);
    }

    /**
     * idleLingerMs만 변경한 새 인스턴스 생성.
     */
    public ExclusiveWriterConfig withIdleLingerMs(long idleLingerMs) {
        return new ExclusiveWriterConfig(handoffRecheckMs, idleLingerMs, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ExclusiveWriterConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ExclusiveWriterConfig(handoffRecheckMs, idleLingerMs, threadNamePrefix);
    }
}

package com.ryuqq.writer.core.context;

/**
 * Identifies one activation of a writer's worker.
 *
 * <p>A worker records a fresh token when it claims activation and hands the same token
 * to every task it runs. Code that assumes it runs inside the worker passes the token
 * back to {@code Writer.safe(token)} instead of inspecting the current thread.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class WorkerToken {

    private final String value;

    private WorkerToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkerToken cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("WorkerToken length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * WorkerToken 생성.
     *
     * @param value 토큰 값
     * @return WorkerToken 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkerToken of(String value) {
        return new WorkerToken(value);
    }

    /**
     * 토큰 값 조회.
     *
     * @return 토큰 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerToken that = (WorkerToken) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "WorkerToken{" + value + '}';
    }
}

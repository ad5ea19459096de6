package com.ryuqq.writer.application.writer;

import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.spi.Database;
import com.ryuqq.writer.core.spi.Transaction;
import com.ryuqq.writer.core.work.TokenAwareWork;
import com.ryuqq.writer.core.work.TransactionWork;

/**
 * 쓰기 작업 실행자.
 *
 * <p>호출자가 제출한 쓰기 작업을 실행하고, 작업의 결과(성공 또는 예외)를 제출한 호출자에게
 * 그대로 돌려줍니다. 호출은 작업이 끝날 때까지 블로킹됩니다.</p>
 *
 * <p><strong>실행 모드:</strong></p>
 * <ul>
 *   <li>database + txn 모두 제공 → 제공된 txn으로 실행 (commit/rollback은 호출자 책임)</li>
 *   <li>database만 제공 → 새 트랜잭션을 열어 실행, 성공 시 commit / 실패 시 rollback</li>
 *   <li>그 외 → 제공된 txn(없으면 null)을 그대로 전달</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Writer writer = ExclusiveWriter.create();
 *
 * writer.submit(database, null, txn -&gt; {
 *     JdbcTransaction jdbc = (JdbcTransaction) txn;
 *     try (PreparedStatement stmt = jdbc.connection().prepareStatement(sql)) {
 *         stmt.executeUpdate();
 *     }
 * });
 * </pre>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public interface Writer {

    /**
     * 쓰기 작업을 제출하고 완료될 때까지 대기.
     *
     * @param database 트랜잭션을 열 데이터베이스 (null 가능)
     * @param txn 이미 열린 트랜잭션 (null 가능)
     * @param work 실행할 작업
     * @param <E> work가 던질 수 있는 checked 예외
     * @throws E work가 실패한 경우 (work가 던진 예외 그대로)
     * @throws com.ryuqq.writer.core.exception.WriterNotInitialisedException 초기화되지 않은 경우
     * @throws com.ryuqq.writer.core.exception.TransactionException 트랜잭션 begin/commit 실패 시
     * @throws IllegalArgumentException work가 null인 경우
     */
    <E extends Exception> void submit(Database database, Transaction txn, TransactionWork<E> work) throws E;

    /**
     * 쓰기 작업을 제출하고 완료될 때까지 대기 (WorkerToken 전달).
     *
     * <p>작업은 자신을 실행 중인 worker의 토큰을 받으며, {@link #safe(WorkerToken)}로
     * 자신이 worker 안에서 실행 중인지 확인할 수 있습니다.</p>
     *
     * @param database 트랜잭션을 열 데이터베이스 (null 가능)
     * @param txn 이미 열린 트랜잭션 (null 가능)
     * @param work 실행할 작업
     * @param <E> work가 던질 수 있는 checked 예외
     * @throws E work가 실패한 경우 (work가 던진 예외 그대로)
     */
    <E extends Exception> void submit(Database database, Transaction txn, TokenAwareWork<E> work) throws E;

    /**
     * 실행 컨텍스트 진단.
     *
     * <p>token이 현재 활성 worker의 토큰과 같으면 빈 문자열을, 다르면 두 토큰을 담은
     * 진단 문자열을 반환합니다. 스케줄링에는 영향을 주지 않습니다.</p>
     *
     * @param token 확인할 토큰 (null 가능)
     * @return 일치하면 "", 아니면 비어 있지 않은 진단 문자열
     */
    String safe(WorkerToken token);
}

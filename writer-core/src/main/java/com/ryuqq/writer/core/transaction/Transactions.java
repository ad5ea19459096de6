package com.ryuqq.writer.core.transaction;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.spi.Database;
import com.ryuqq.writer.core.spi.Transaction;
import com.ryuqq.writer.core.work.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped transaction helpers.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * withTransaction(database, work)
 *   ↓
 * database.begin() → txn           (실패 시 work 실행 없이 예외 전파)
 *   ↓
 * work.execute(txn)
 *   ├─ 성공 → txn.commit()          (commit 실패 시 TransactionException 전파)
 *   └─ 실패 → txn.rollback()        (rollback 실패는 suppressed로 첨부, work 예외를 그대로 전파)
 * </pre>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class Transactions {

    private static final Logger log = LoggerFactory.getLogger(Transactions.class);

    private Transactions() {
    }

    /**
     * Runs {@code work} inside a new transaction opened on {@code database}.
     *
     * <p>The transaction is committed when the work returns normally and rolled back when
     * it throws. The work's exception always wins over a rollback failure.</p>
     *
     * @param database 트랜잭션을 열 데이터베이스
     * @param work 실행할 작업
     * @param <E> work가 던질 수 있는 checked 예외
     * @throws E work가 실패한 경우 (동일 인스턴스)
     * @throws TransactionException begin 또는 commit 실패 시
     * @throws IllegalArgumentException database 또는 work가 null인 경우
     */
    public static <E extends Exception> void withTransaction(Database database, TransactionWork<E> work) throws E {
        if (database == null) {
            throw new IllegalArgumentException("database cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        Transaction txn = database.begin();
        try {
            work.execute(txn);
        } catch (Exception | Error e) {
            rollbackAfterFailure(txn, e);
            throw e;
        }
        endTransaction(txn, true);
    }

    /**
     * Ends a transaction: commit when {@code succeeded}, otherwise rollback.
     *
     * @param txn 종료할 트랜잭션
     * @param succeeded 작업 성공 여부
     * @throws TransactionException commit 또는 rollback 실패 시
     * @throws IllegalArgumentException txn이 null인 경우
     */
    public static void endTransaction(Transaction txn, boolean succeeded) {
        if (txn == null) {
            throw new IllegalArgumentException("txn cannot be null");
        }
        if (succeeded) {
            txn.commit();
        } else {
            txn.rollback();
        }
    }

    private static void rollbackAfterFailure(Transaction txn, Throwable failure) {
        try {
            endTransaction(txn, false);
        } catch (RuntimeException rollbackFailure) {
            log.warn("Rollback failed after work failure, keeping the work failure: {}", rollbackFailure.getMessage());
            failure.addSuppressed(rollbackFailure);
        }
    }
}

package com.ryuqq.writer.adapter.runner;

import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.spi.Database;
import com.ryuqq.writer.core.spi.Transaction;
import com.ryuqq.writer.core.transaction.Transactions;
import com.ryuqq.writer.core.work.TokenAwareWork;

import java.util.concurrent.CompletableFuture;

/**
 * 제출된 쓰기 작업 한 건과 결과 슬롯.
 *
 * <p>결과 슬롯은 정확히 한 번 채워집니다: 성공 시 null, 실패 시 work가 던진 예외.</p>
 *
 * @param <E> work가 던질 수 있는 checked 예외
 * @author Writer Team
 * @since 1.0.0
 */
final class WriteTask<E extends Exception> {

    private final Database database;
    private final Transaction txn;
    private final TokenAwareWork<E> work;
    private final CompletableFuture<Throwable> result = new CompletableFuture<>();

    WriteTask(Database database, Transaction txn, TokenAwareWork<E> work) {
        this.database = database;
        this.txn = txn;
        this.work = work;
    }

    /**
     * 실행 모드 선택 후 work 실행.
     *
     * <ul>
     *   <li>database + txn → 제공된 txn으로 직접 실행</li>
     *   <li>database만 → Transactions.withTransaction (commit / rollback)</li>
     *   <li>그 외 → 제공된 txn (없으면 null)</li>
     * </ul>
     *
     * @param token 실행 중인 worker의 토큰
     * @throws E work가 실패한 경우
     */
    void execute(WorkerToken token) throws E {
        if (database != null && txn != null) {
            work.execute(token, txn);
        } else if (database != null) {
            Transactions.<E>withTransaction(database, scoped -> work.execute(token, scoped));
        } else {
            work.execute(token, txn);
        }
    }

    /**
     * 실행 후 결과 슬롯을 채움. 어떤 실패도 슬롯으로만 전달됩니다.
     *
     * @param token 실행 중인 worker의 토큰
     * @return 실패 원인 (성공 시 null)
     */
    Throwable run(WorkerToken token) {
        Throwable failure = null;
        try {
            execute(token);
        } catch (Throwable t) {
            failure = t;
        }
        result.complete(failure);
        return failure;
    }

    /**
     * 결과 대기 후 실패 시 동일한 예외를 다시 던짐.
     *
     * <p>인계된 작업은 취소할 수 없으므로 대기 중 인터럽트를 무시하고,
     * 대기가 끝난 뒤 인터럽트 플래그를 복원합니다.</p>
     *
     * @throws E work가 실패한 경우
     */
    void awaitResult() throws E {
        Throwable failure = result.join();
        if (failure != null) {
            rethrow(failure);
        }
    }

    private void rethrow(Throwable failure) throws E {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        // E는 소거되어 검사할 수 없지만, work.execute의 throws 절상 남은 checked 예외는 E뿐
        @SuppressWarnings("unchecked")
        E checked = (E) failure;
        throw checked;
    }
}

package com.ryuqq.writer.core.work;

import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.spi.Transaction;

/**
 * Write work that also receives the token of the worker running it.
 *
 * <p>Code paths that assume they already run inside the writer's worker take the token
 * as an explicit argument and may check it with {@code Writer.safe(token)}.</p>
 *
 * @param <E> the checked exception the work may throw
 * @author Writer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TokenAwareWork<E extends Exception> {

    /**
     * Executes the work.
     *
     * @param token the token of the executing worker
     * @param txn the transaction to write through, may be null
     * @throws E when the work fails
     */
    void execute(WorkerToken token, Transaction txn) throws E;

    /**
     * Adapts plain work to a token-aware one that ignores the token.
     *
     * @param work the work to adapt
     * @param <E> the checked exception the work may throw
     * @return token-aware work delegating to {@code work}
     */
    static <E extends Exception> TokenAwareWork<E> of(TransactionWork<E> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        return (token, txn) -> work.execute(txn);
    }
}

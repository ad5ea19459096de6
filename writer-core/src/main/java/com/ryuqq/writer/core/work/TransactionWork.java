package com.ryuqq.writer.core.work;

import com.ryuqq.writer.core.spi.Transaction;

/**
 * A unit of write work executed against a transaction.
 *
 * <p>The transaction argument is {@code null} when the task was submitted without
 * a database and without a transaction; work submitted that way must tolerate it.</p>
 *
 * @param <E> the checked exception the work may throw
 * @author Writer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionWork<E extends Exception> {

    /**
     * Executes the work.
     *
     * @param txn the transaction to write through, may be null
     * @throws E when the work fails
     */
    void execute(Transaction txn) throws E;
}

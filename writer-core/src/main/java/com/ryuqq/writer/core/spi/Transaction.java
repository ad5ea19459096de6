package com.ryuqq.writer.core.spi;

import com.ryuqq.writer.core.exception.TransactionException;

/**
 * An open unit of work against a {@link Database}.
 *
 * <p>A transaction is owned by exactly one task for the duration of its execution.
 * It ends with either {@link #commit()} or {@link #rollback()}; implementations reject
 * a second end call with {@link IllegalStateException}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>commit() and rollback() release any resource held by the transaction (e.g. JDBC connection)</li>
 *   <li>Failures are reported as {@link TransactionException}, never as checked exceptions</li>
 * </ul>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public interface Transaction {

    /**
     * Commits the transaction.
     *
     * @throws TransactionException if the underlying store rejects the commit
     * @throws IllegalStateException if the transaction has already ended
     */
    void commit();

    /**
     * Rolls back the transaction.
     *
     * @throws TransactionException if the underlying store rejects the rollback
     * @throws IllegalStateException if the transaction has already ended
     */
    void rollback();
}

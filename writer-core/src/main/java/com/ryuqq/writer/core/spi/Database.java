package com.ryuqq.writer.core.spi;

import com.ryuqq.writer.core.exception.TransactionException;

/**
 * Data store handle SPI.
 *
 * <p>The writer only needs to open transactions against the store; everything the task
 * does inside the transaction is opaque to it.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * Transaction txn = database.begin();
 *   ... work(txn) ...
 * txn.commit();   // or txn.rollback() on failure
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: begin() may be called from any thread</li>
 *   <li>Each call returns a new, independent transaction</li>
 * </ul>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public interface Database {

    /**
     * Opens a new transaction.
     *
     * @return the open transaction
     * @throws TransactionException if a transaction cannot be opened
     */
    Transaction begin();
}

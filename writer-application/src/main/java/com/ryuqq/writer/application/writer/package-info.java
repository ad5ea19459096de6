/**
 * Caller-facing writer contract.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ExclusiveWriter, PassThroughWriter)
 *   ↓ implements
 * application (Writer interface)
 *   ↓ depends on
 * core (Database, Transaction, TransactionWork, WorkerToken, Transactions)
 * </pre>
 *
 * @author Writer Team
 * @since 1.0.0
 */
package com.ryuqq.writer.application.writer;

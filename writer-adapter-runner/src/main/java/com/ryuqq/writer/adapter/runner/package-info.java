/**
 * Runner Adapter Layer - Writer 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.writer.adapter.runner.ExclusiveWriter} - 단일 worker 배타적 writer (SQLite 등)</li>
 *   <li>{@link com.ryuqq.writer.adapter.runner.PassThroughWriter} - 호출 스레드 직접 실행 writer (동시 쓰기 허용 저장소)</li>
 * </ul>
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
package com.ryuqq.writer.adapter.runner;

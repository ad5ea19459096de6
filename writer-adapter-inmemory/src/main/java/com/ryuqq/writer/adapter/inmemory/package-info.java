/**
 * In-memory adapter for the data store SPI.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.writer.adapter.inmemory.InMemoryDatabase} - 트랜잭션 생성 및 종료 상태 기록</li>
 *   <li>{@link com.ryuqq.writer.adapter.inmemory.InMemoryTransaction} - commit 시에만 반영되는 쓰기 기록</li>
 * </ul>
 *
 * <p>테스트와 참조 구현 용도이며 프로덕션 사용에 적합하지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.adapter.inmemory;

package com.ryuqq.writer.adapter.inmemory;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.spi.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Database} SPI for testing and reference purposes.
 *
 * <p>Every transaction it opens is tracked, so tests can assert whether a task's
 * transaction was committed, rolled back, or left alone.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>transactions:</strong> ConcurrentHashMap&lt;Long, InMemoryTransaction&gt; - every transaction by id</li>
 *   <li><strong>committedWrites:</strong> CopyOnWriteArrayList&lt;String&gt; - writes of committed transactions, in commit order</li>
 * </ul>
 *
 * <p><strong>Failure Injection:</strong></p>
 * <ul>
 *   <li>{@link #failNextBegin()} - next begin() throws TransactionException(BEGIN_FAILED)</li>
 *   <li>{@link #failNextCommit()} - next commit() throws TransactionException(COMMIT_FAILED)</li>
 *   <li>{@link #failNextRollback()} - next rollback() throws TransactionException(ROLLBACK_FAILED)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No isolation between concurrent transactions</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public class InMemoryDatabase implements Database {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final AtomicLong idSequence = new AtomicLong();
    private final Map<Long, InMemoryTransaction> transactions = new ConcurrentHashMap<>();
    private final List<String> committedWrites = new CopyOnWriteArrayList<>();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();

    private final AtomicBoolean failNextBegin = new AtomicBoolean();
    private final AtomicBoolean failNextCommit = new AtomicBoolean();
    private final AtomicBoolean failNextRollback = new AtomicBoolean();

    @Override
    public InMemoryTransaction begin() {
        if (failNextBegin.compareAndSet(true, false)) {
            throw TransactionException.beginFailed(new IllegalStateException("injected begin failure"));
        }
        long id = idSequence.incrementAndGet();
        InMemoryTransaction txn = new InMemoryTransaction(id, this);
        transactions.put(id, txn);
        log.debug("Began in-memory transaction {}", id);
        return txn;
    }

    /**
     * 다음 begin() 호출을 BEGIN_FAILED로 실패시킴.
     */
    public void failNextBegin() {
        failNextBegin.set(true);
    }

    /**
     * 다음 commit() 호출을 COMMIT_FAILED로 실패시킴 (트랜잭션은 ROLLED_BACK).
     */
    public void failNextCommit() {
        failNextCommit.set(true);
    }

    /**
     * 다음 rollback() 호출을 ROLLBACK_FAILED로 실패시킴 (쓰기 기록은 폐기됨).
     */
    public void failNextRollback() {
        failNextRollback.set(true);
    }

    /**
     * @return 지금까지 열린 트랜잭션 수
     */
    public int beganCount() {
        return transactions.size();
    }

    /**
     * @return commit된 트랜잭션 수
     */
    public int committedCount() {
        return commits.get();
    }

    /**
     * @return rollback된 트랜잭션 수 (commit 실패 포함)
     */
    public int rolledBackCount() {
        return rollbacks.get();
    }

    /**
     * @return 열린 순서대로 정렬된 모든 트랜잭션
     */
    public List<InMemoryTransaction> transactions() {
        List<InMemoryTransaction> result = new ArrayList<>(transactions.values());
        result.sort((a, b) -> Long.compare(a.getId(), b.getId()));
        return result;
    }

    /**
     * @return commit된 쓰기 기록 (commit 순서)
     */
    public List<String> committedWrites() {
        return List.copyOf(committedWrites);
    }

    /**
     * 모든 상태 초기화 (테스트 간 격리용).
     */
    public void clear() {
        transactions.clear();
        committedWrites.clear();
        commits.set(0);
        rollbacks.set(0);
        failNextBegin.set(false);
        failNextCommit.set(false);
        failNextRollback.set(false);
    }

    void recordEnd(InMemoryTransaction txn, InMemoryTransaction.State state) {
        if (state == InMemoryTransaction.State.COMMITTED) {
            commits.incrementAndGet();
        } else {
            rollbacks.incrementAndGet();
        }
        log.debug("In-memory transaction {} ended: {}", txn.getId(), state);
    }

    void applyCommitted(List<String> writes) {
        committedWrites.addAll(writes);
    }

    boolean consumeCommitFailure() {
        return failNextCommit.compareAndSet(true, false);
    }

    boolean consumeRollbackFailure() {
        return failNextRollback.compareAndSet(true, false);
    }
}

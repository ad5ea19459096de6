package com.ryuqq.writer.adapter.inmemory;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.spi.Transaction;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory {@link Transaction} handed out by {@link InMemoryDatabase}.
 *
 * <p>Work can record writes with {@link #write(String)}; they become visible in the owning
 * database only on commit.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class InMemoryTransaction implements Transaction {

    /**
     * Lifecycle of an in-memory transaction.
     */
    public enum State {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    private final long id;
    private final InMemoryDatabase database;
    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);
    private final List<String> pendingWrites = new CopyOnWriteArrayList<>();

    InMemoryTransaction(long id, InMemoryDatabase database) {
        this.id = id;
        this.database = database;
    }

    public long getId() {
        return id;
    }

    public State getState() {
        return state.get();
    }

    /**
     * 쓰기 기록 (commit 전까지 database에 반영되지 않음).
     *
     * @param record 기록할 값
     * @throws IllegalStateException 이미 종료된 트랜잭션인 경우
     */
    public void write(String record) {
        if (state.get() != State.ACTIVE) {
            throw new IllegalStateException("Transaction " + id + " already ended: " + state.get());
        }
        pendingWrites.add(record);
    }

    /**
     * {@inheritDoc}
     *
     * <p>A failed commit leaves the transaction {@link State#ROLLED_BACK}.</p>
     */
    @Override
    public void commit() {
        if (state.get() == State.ACTIVE && database.consumeCommitFailure()) {
            end(State.ROLLED_BACK);
            pendingWrites.clear();
            throw TransactionException.commitFailed(new IllegalStateException("injected commit failure for transaction " + id));
        }
        end(State.COMMITTED);
        database.applyCommitted(pendingWrites);
    }

    /**
     * {@inheritDoc}
     *
     * <p>An injected rollback failure still discards the pending writes.</p>
     */
    @Override
    public void rollback() {
        end(State.ROLLED_BACK);
        pendingWrites.clear();
        if (database.consumeRollbackFailure()) {
            throw TransactionException.rollbackFailed(new IllegalStateException("injected rollback failure for transaction " + id));
        }
    }

    private void end(State target) {
        if (!state.compareAndSet(State.ACTIVE, target)) {
            throw new IllegalStateException("Transaction " + id + " already ended: " + state.get());
        }
        database.recordEnd(this, target);
    }

    @Override
    public String toString() {
        return "InMemoryTransaction{id=" + id + ", state=" + state.get() + '}';
    }
}

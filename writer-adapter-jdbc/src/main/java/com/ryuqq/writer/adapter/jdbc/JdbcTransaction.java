package com.ryuqq.writer.adapter.jdbc;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.spi.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JDBC {@link Transaction} over a single {@link Connection} with auto-commit disabled.
 *
 * <p>Work obtains the connection through {@link #connection()}. commit() and rollback()
 * end the transaction and close the connection on every exit path; a second end call
 * is rejected.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class JdbcTransaction implements Transaction {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransaction.class);

    private final Connection connection;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param connection auto-commit이 꺼진 커넥션
     * @throws IllegalArgumentException connection이 null인 경우
     */
    public JdbcTransaction(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        this.connection = connection;
    }

    /**
     * 트랜잭션에 묶인 커넥션 조회.
     *
     * @return 커넥션
     */
    public Connection connection() {
        return connection;
    }

    /**
     * @return commit 또는 rollback이 이미 호출되었는지 여부
     */
    public boolean isEnded() {
        return ended.get();
    }

    /**
     * {@inheritDoc}
     *
     * <p>commit이 실패하면 커넥션을 닫기 전에 rollback합니다. 열린 트랜잭션을 가진 커넥션의
     * close 동작은 드라이버마다 다릅니다.</p>
     */
    @Override
    public void commit() {
        markEnded();
        try {
            connection.commit();
        } catch (SQLException e) {
            TransactionException failure = TransactionException.commitFailed(e);
            rollbackAfterCommitFailure(failure);
            close(failure);
            throw failure;
        }
        close(null);
    }

    @Override
    public void rollback() {
        markEnded();
        try {
            connection.rollback();
        } catch (SQLException e) {
            TransactionException failure = TransactionException.rollbackFailed(e);
            close(failure);
            throw failure;
        }
        close(null);
    }

    private void markEnded() {
        if (!ended.compareAndSet(false, true)) {
            throw new IllegalStateException("JDBC transaction already ended");
        }
    }

    private void rollbackAfterCommitFailure(TransactionException pending) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            pending.addSuppressed(e);
        }
    }

    private void close(TransactionException pending) {
        try {
            connection.close();
        } catch (SQLException e) {
            if (pending != null) {
                pending.addSuppressed(e);
            } else {
                // 트랜잭션은 이미 끝났으므로 커넥션 반납 실패는 기록만 남김
                log.warn("Failed to close JDBC connection after transaction end: {}", e.getMessage());
            }
        }
    }
}

package com.ryuqq.writer.adapter.jdbc;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.spi.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * JDBC implementation of {@link Database} SPI.
 *
 * <p>Each {@link #begin()} borrows a connection from the {@link DataSource}, switches
 * auto-commit off and wraps it in a {@link JdbcTransaction}. The connection is closed when
 * the transaction ends.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * Connection c = dataSource.getConnection();
 * c.setAutoCommit(false);
 *   ... work ...
 * c.commit();  / c.rollback();
 * c.close();
 * </pre>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class JdbcDatabase implements Database {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabase.class);

    private final DataSource dataSource;

    /**
     * 생성자.
     *
     * @param dataSource JDBC 데이터소스
     * @throws IllegalArgumentException dataSource가 null인 경우
     */
    public JdbcDatabase(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        this.dataSource = dataSource;
    }

    @Override
    public JdbcTransaction begin() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw TransactionException.beginFailed(e);
        }

        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeAfterFailedBegin(connection, e);
            throw TransactionException.beginFailed(e);
        }
        return new JdbcTransaction(connection);
    }

    private void closeAfterFailedBegin(Connection connection, SQLException failure) {
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            log.warn("Failed to close connection after failed begin: {}", closeFailure.getMessage());
            failure.addSuppressed(closeFailure);
        }
    }
}

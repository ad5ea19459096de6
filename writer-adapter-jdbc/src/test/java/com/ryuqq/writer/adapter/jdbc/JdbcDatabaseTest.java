package com.ryuqq.writer.adapter.jdbc;

import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.exception.WriterErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * JdbcDatabase 유닛 테스트.
 *
 * @author Writer Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JdbcDatabaseTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Test
    void begin_autoCommit을_끄고_커넥션을_감싼_트랜잭션_반환() throws SQLException {
        // given
        when(dataSource.getConnection()).thenReturn(connection);
        JdbcDatabase database = new JdbcDatabase(dataSource);

        // when
        JdbcTransaction txn = database.begin();

        // then
        assertThat(txn.connection()).isSameAs(connection);
        assertThat(txn.isEnded()).isFalse();
        verify(connection).setAutoCommit(false);
    }

    @Test
    void begin_커넥션_획득_실패_시_BEGIN_FAILED() throws SQLException {
        // given
        SQLException cause = new SQLException("unable to open database file");
        when(dataSource.getConnection()).thenThrow(cause);
        JdbcDatabase database = new JdbcDatabase(dataSource);

        // when & then
        assertThatThrownBy(database::begin)
            .isInstanceOf(TransactionException.class)
            .hasCause(cause)
            .extracting(e -> ((TransactionException) e).getErrorCode())
            .isEqualTo(WriterErrorCode.BEGIN_FAILED);
    }

    @Test
    void begin_autoCommit_설정_실패_시_커넥션_반납() throws SQLException {
        // given
        when(dataSource.getConnection()).thenReturn(connection);
        doThrow(new SQLException("read-only")).when(connection).setAutoCommit(false);
        JdbcDatabase database = new JdbcDatabase(dataSource);

        // when & then
        assertThatThrownBy(database::begin).isInstanceOf(TransactionException.class);

        InOrder inOrder = inOrder(connection);
        inOrder.verify(connection).setAutoCommit(false);
        inOrder.verify(connection).close();
    }

    @Test
    void constructor_null_dataSource_거부() {
        assertThatThrownBy(() -> new JdbcDatabase(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dataSource cannot be null");
    }
}

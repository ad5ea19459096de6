package com.ryuqq.writer.testkit.contract;

import com.ryuqq.writer.adapter.inmemory.InMemoryDatabase;
import com.ryuqq.writer.adapter.inmemory.InMemoryTransaction;
import com.ryuqq.writer.application.writer.Writer;
import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.exception.TransactionException;
import com.ryuqq.writer.core.exception.WriterErrorCode;
import com.ryuqq.writer.core.spi.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Writer Contract Tests.
 *
 * <p>Any {@link Writer} implementation can extend this class to verify that it delivers
 * task results faithfully and selects the transaction mode correctly. Implementations that
 * serialize writes add their own mutual-exclusion scenarios on top.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryDatabase: records begin/commit/rollback of every transaction</li>
 *   <li>{@link #createWriter()}: fresh, ready-to-use writer per test</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyWriterContractTest extends AbstractWriterContractTest {
 *     {@literal @}Override
 *     protected Writer createWriter() {
 *         return new MyWriter();
 *     }
 * }
 * </pre>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public abstract class AbstractWriterContractTest {

    protected InMemoryDatabase database;
    protected Writer writer;

    /**
     * Creates the writer under test. Called once per test.
     *
     * @return a writer ready to accept submissions
     */
    protected abstract Writer createWriter();

    @BeforeEach
    void setUpWriterContract() {
        database = new InMemoryDatabase();
        writer = createWriter();
    }

    @AfterEach
    void tearDownWriterContract() {
        if (database != null) {
            database.clear();
        }
    }

    // ========================================
    // Result correctness
    // ========================================

    @Test
    void testSubmit_WhenWorkSucceeds_ReturnsNormallyAfterRunningOnce() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        writer.submit(null, null, txn -> runs.incrementAndGet());

        assertEquals(1, runs.get(), "Work should run exactly once");
    }

    @Test
    void testSubmit_WhenWorkThrowsChecked_CallerReceivesSameInstance() {
        IOException failure = new IOException("disk full");

        IOException thrown = assertThrows(IOException.class,
                () -> writer.submit(null, null, txn -> {
                    throw failure;
                }));

        assertSame(failure, thrown, "Caller should receive the work's own exception");
    }

    @Test
    void testSubmit_WhenWorkThrowsRuntime_CallerReceivesSameInstance() {
        IllegalStateException failure = new IllegalStateException("constraint violated");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> writer.submit(null, null, txn -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
    }

    @Test
    void testSubmit_AfterFailedTask_NextTaskStillSucceeds() throws Exception {
        assertThrows(IllegalStateException.class,
                () -> writer.submit(null, null, txn -> {
                    throw new IllegalStateException("first");
                }));

        AtomicInteger runs = new AtomicInteger();
        writer.submit(null, null, txn -> runs.incrementAndGet());

        assertEquals(1, runs.get(), "A failed task must not stop later tasks");
    }

    @Test
    void testSubmit_WhenWorkIsNull_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> writer.submit(null, null, (com.ryuqq.writer.core.work.TransactionWork<RuntimeException>) null));
    }

    // ========================================
    // Transaction mode selection
    // ========================================

    @Test
    void testDatabaseOnly_WhenWorkSucceeds_CommitsScopedTransaction() throws Exception {
        writer.submit(database, null, txn -> ((InMemoryTransaction) txn).write("row-1"));

        assertTransactionCounts(1, 1, 0);
        assertEquals(InMemoryTransaction.State.COMMITTED, database.transactions().get(0).getState());
        assertEquals(List.of("row-1"), database.committedWrites());
    }

    @Test
    void testDatabaseOnly_WhenWorkFails_RollsBackAndRethrows() {
        IOException failure = new IOException("write failed");

        IOException thrown = assertThrows(IOException.class,
                () -> writer.submit(database, null, txn -> {
                    ((InMemoryTransaction) txn).write("row-1");
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertTransactionCounts(1, 0, 1);
        assertTrue(database.committedWrites().isEmpty(), "Rolled back writes must not be visible");
    }

    @Test
    void testDatabaseAndTransaction_RunsOnSuppliedTransactionWithoutEndingIt() throws Exception {
        InMemoryTransaction supplied = database.begin();
        AtomicReference<Transaction> seen = new AtomicReference<>();

        writer.submit(database, supplied, seen::set);

        assertSame(supplied, seen.get(), "Work should receive the supplied transaction");
        assertEquals(InMemoryTransaction.State.ACTIVE, supplied.getState(),
                "Supplied transaction should be left open for the caller");
        assertTransactionCounts(1, 0, 0);
    }

    @Test
    void testTransactionOnly_PassesTransactionThroughWithoutEndingIt() throws Exception {
        InMemoryTransaction supplied = database.begin();
        AtomicReference<Transaction> seen = new AtomicReference<>();

        writer.submit(null, supplied, seen::set);

        assertSame(supplied, seen.get());
        assertEquals(InMemoryTransaction.State.ACTIVE, supplied.getState());
    }

    @Test
    void testNeitherDatabaseNorTransaction_WorkReceivesNull() throws Exception {
        AtomicReference<Transaction> seen = new AtomicReference<>(database.begin());

        writer.submit(null, null, seen::set);

        assertNull(seen.get(), "Work should receive a null transaction");
    }

    @Test
    void testDatabaseOnly_WhenBeginFails_WorkNotRun() {
        database.failNextBegin();
        AtomicInteger runs = new AtomicInteger();

        TransactionException thrown = assertThrows(TransactionException.class,
                () -> writer.submit(database, null, txn -> runs.incrementAndGet()));

        assertEquals(WriterErrorCode.BEGIN_FAILED, thrown.getErrorCode());
        assertEquals(0, runs.get(), "Work must not run without a transaction");
    }

    @Test
    void testDatabaseOnly_WhenCommitFails_CallerReceivesCommitFailure() {
        database.failNextCommit();

        TransactionException thrown = assertThrows(TransactionException.class,
                () -> writer.submit(database, null, txn -> ((InMemoryTransaction) txn).write("row-1")));

        assertEquals(WriterErrorCode.COMMIT_FAILED, thrown.getErrorCode());
        assertTrue(database.committedWrites().isEmpty());
    }

    @Test
    void testDatabaseOnly_WhenRollbackFails_WorkFailureWinsWithRollbackSuppressed() {
        database.failNextRollback();
        IllegalStateException failure = new IllegalStateException("work failed");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> writer.submit(database, null, txn -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(1, thrown.getSuppressed().length, "Rollback failure should be suppressed");
        assertInstanceOf(TransactionException.class, thrown.getSuppressed()[0]);
    }

    // ========================================
    // Ordering and execution context
    // ========================================

    @Test
    void testSequentialSubmissions_CommitInSubmissionOrder() throws Exception {
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String row = "row-" + i;
            expected.add(row);
            writer.submit(database, null, txn -> ((InMemoryTransaction) txn).write(row));
        }

        assertEquals(expected, database.committedWrites());
        assertTransactionCounts(10, 10, 0);
    }

    @Test
    void testSafe_InsideTokenAwareWork_ReturnsEmpty() throws Exception {
        AtomicReference<String> diagnostic = new AtomicReference<>();

        writer.submit(null, null, (WorkerToken token, Transaction txn) -> diagnostic.set(writer.safe(token)));

        assertEquals("", diagnostic.get(), "Work should be recognised as running in the writer's context");
    }

    /**
     * Asserts the number of transactions begun, committed and rolled back.
     *
     * @param began expected begin count
     * @param committed expected commit count
     * @param rolledBack expected rollback count
     */
    protected void assertTransactionCounts(int began, int committed, int rolledBack) {
        assertEquals(began, database.beganCount(),
                String.format("Expected %d began transactions but was %d", began, database.beganCount()));
        assertEquals(committed, database.committedCount(),
                String.format("Expected %d commits but was %d", committed, database.committedCount()));
        assertEquals(rolledBack, database.rolledBackCount(),
                String.format("Expected %d rollbacks but was %d", rolledBack, database.rolledBackCount()));
    }
}

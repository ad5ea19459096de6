package com.ryuqq.writer.adapter.runner;

import com.ryuqq.writer.application.writer.Writer;
import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.spi.Database;
import com.ryuqq.writer.core.spi.Transaction;
import com.ryuqq.writer.core.work.TokenAwareWork;
import com.ryuqq.writer.core.work.TransactionWork;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 호출 스레드에서 바로 실행하는 writer.
 *
 * <p>PostgreSQL처럼 동시 쓰기를 허용하는 저장소용입니다. 실행 모드 선택
 * (database만 제공 시 scoped transaction)은 {@link ExclusiveWriter}와 같지만,
 * 상호 배제는 제공하지 않습니다.</p>
 *
 * <p>Stateless 설계: 호출 간 공유 상태는 토큰 시퀀스뿐이며 thread-safe합니다.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class PassThroughWriter implements Writer {

    private static final String TOKEN_PREFIX = "pass-through-";

    private final AtomicLong tokenSequence = new AtomicLong();

    @Override
    public <E extends Exception> void submit(Database database, Transaction txn, TransactionWork<E> work) throws E {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        submit(database, txn, TokenAwareWork.of(work));
    }

    @Override
    public <E extends Exception> void submit(Database database, Transaction txn, TokenAwareWork<E> work) throws E {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        WorkerToken token = WorkerToken.of(TOKEN_PREFIX + tokenSequence.incrementAndGet());
        new WriteTask<>(database, txn, work).execute(token);
    }

    /**
     * 배타적 worker가 없으므로 어느 컨텍스트든 안전합니다.
     *
     * @param token 무시됨
     * @return 항상 ""
     */
    @Override
    public String safe(WorkerToken token) {
        return "";
    }
}

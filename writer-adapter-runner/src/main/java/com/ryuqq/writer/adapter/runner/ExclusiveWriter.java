package com.ryuqq.writer.adapter.runner;

import com.ryuqq.writer.application.writer.Writer;
import com.ryuqq.writer.core.context.WorkerToken;
import com.ryuqq.writer.core.exception.WriterInterruptedException;
import com.ryuqq.writer.core.exception.WriterNotInitialisedException;
import com.ryuqq.writer.core.spi.Database;
import com.ryuqq.writer.core.spi.Transaction;
import com.ryuqq.writer.core.work.TokenAwareWork;
import com.ryuqq.writer.core.work.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 단일 worker 기반 배타적 쓰기 실행자.
 *
 * <p>SQLite처럼 동시에 하나의 writer만 허용하는 저장소에 대한 쓰기를 하나의 worker로
 * 직렬화합니다. 어느 순간에도 최대 하나의 작업만 실행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(database, txn, work)
 *   ↓
 * queue == null → WriterNotInitialisedException (블로킹 없음)
 *   ↓
 * worker 비활성 → worker 스레드 생성 (권고적, 실제 배타성은 worker의 CAS가 보장)
 *   ↓
 * SynchronousQueue 인계 (worker가 받을 때까지 블로킹)
 *   ↓
 * 결과 슬롯 대기 → 성공 시 반환, 실패 시 work의 예외를 그대로 던짐
 *
 * worker:
 *   CAS(running: false → true) 실패 → 즉시 종료
 *   WorkerToken 기록 (프로세스 전역에서 유일)
 *   첫 작업은 handoffRecheckMs 동안 대기 (생성을 유발한 submit의 인계)
 *   while (대기 중인 작업 있음): 실행 → 결과 전달
 *   running = false, 종료 (유휴 비용 0)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>락 없음: 배타성은 단일 worker + 메시지 전달 구조에서 나옴</li>
 *   <li>여러 호출자가 동시에 worker를 생성할 수 있으나 CAS에서 진 worker는 큐를 건드리지 않고 종료</li>
 *   <li>인계 대기는 handoffRecheckMs 단위로 나뉘며, 매 구간마다 worker 활성 여부를 재확인하여
 *       worker 종료 직후 제출된 작업이 유실되지 않도록 함</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong> {@code new ExclusiveWriter()}는 초기화되지 않은 writer를 만듭니다.
 * {@link #initialise()} 또는 {@link #create()}로 큐를 준비해야 합니다. 명시적 종료는 없으며,
 * worker는 데몬 스레드이고 유휴 시 스스로 종료합니다.</p>
 *
 * @author Writer Team
 * @since 1.0.0
 */
public final class ExclusiveWriter implements Writer {

    private static final Logger log = LoggerFactory.getLogger(ExclusiveWriter.class);

    private static final String NO_WORKER = "<none>";

    /**
     * 프로세스 전역 토큰 시퀀스. 서로 다른 writer의 토큰이 같은 값을 갖지 않도록 보장합니다.
     */
    private static final AtomicLong TOKEN_SEQUENCE = new AtomicLong();

    private final ExclusiveWriterConfig config;
    private final ThreadFactory threadFactory;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong activations = new AtomicLong();

    private volatile SynchronousQueue<WriteTask<?>> queue;
    private volatile WorkerToken activeToken;

    /**
     * 기본 설정으로 초기화되지 않은 writer 생성.
     */
    public ExclusiveWriter() {
        this(new ExclusiveWriterConfig());
    }

    /**
     * 초기화되지 않은 writer 생성.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ExclusiveWriter(ExclusiveWriterConfig config) {
        this(config, defaultThreadFactory(config));
    }

    /**
     * 초기화되지 않은 writer 생성 (커스텀 ThreadFactory 주입).
     *
     * @param config 설정
     * @param threadFactory worker 스레드 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExclusiveWriter(ExclusiveWriterConfig config, ThreadFactory threadFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (threadFactory == null) {
            throw new IllegalArgumentException("threadFactory cannot be null");
        }
        this.config = config;
        this.threadFactory = threadFactory;
    }

    /**
     * 기본 설정으로 초기화된 writer 생성.
     *
     * @return 초기화된 ExclusiveWriter
     */
    public static ExclusiveWriter create() {
        return new ExclusiveWriter().initialise();
    }

    /**
     * 초기화된 writer 생성.
     *
     * @param config 설정
     * @return 초기화된 ExclusiveWriter
     */
    public static ExclusiveWriter create(ExclusiveWriterConfig config) {
        return new ExclusiveWriter(config).initialise();
    }

    /**
     * 작업 큐 준비. 이미 초기화된 경우 아무 것도 하지 않습니다.
     *
     * @return this
     */
    public synchronized ExclusiveWriter initialise() {
        if (queue == null) {
            queue = new SynchronousQueue<>();
            log.info("ExclusiveWriter initialised (handoffRecheckMs={}, idleLingerMs={})",
                config.handoffRecheckMs(), config.idleLingerMs());
        }
        return this;
    }

    /**
     * @return {@link #initialise()}로 큐가 준비되었는지 여부
     */
    public boolean isInitialised() {
        return queue != null;
    }

    /**
     * @return worker가 현재 활성 상태인지 여부
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return worker가 활성화 CAS에 성공한 누적 횟수
     */
    public long activationCount() {
        return activations.get();
    }

    @Override
    public <E extends Exception> void submit(Database database, Transaction txn, TransactionWork<E> work) throws E {
        TokenAwareWork<E> adapted = work == null ? null : TokenAwareWork.of(work);
        submit(database, txn, adapted);
    }

    /**
     * {@inheritDoc}
     *
     * <p>worker 안에서 실행 중인 작업이 같은 writer에 다시 submit하면 교착 상태가 됩니다.
     * 이미 worker 안에 있다면 전달받은 txn으로 직접 작업하세요.</p>
     */
    @Override
    public <E extends Exception> void submit(Database database, Transaction txn, TokenAwareWork<E> work) throws E {
        SynchronousQueue<WriteTask<?>> todo = this.queue;
        if (todo == null) {
            throw new WriterNotInitialisedException("ExclusiveWriter is not initialised");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        if (!running.get()) {
            spawnWorker();
        }

        WriteTask<E> task = new WriteTask<>(database, txn, work);
        handOff(todo, task);
        task.awaitResult();
    }

    @Override
    public String safe(WorkerToken token) {
        WorkerToken current = activeToken;
        if (token != null && token.equals(current)) {
            return "";
        }
        return describe(token) + " != " + describe(current);
    }

    private void handOff(SynchronousQueue<WriteTask<?>> todo, WriteTask<?> task) {
        try {
            while (!todo.offer(task, config.handoffRecheckMs(), TimeUnit.MILLISECONDS)) {
                // worker가 인계 직전에 종료된 경우 새로 생성
                if (!running.get()) {
                    spawnWorker();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriterInterruptedException("Interrupted before the task was handed to the worker", e);
        }
    }

    private void spawnWorker() {
        Thread worker = threadFactory.newThread(this::runWorker);
        worker.start();
    }

    /**
     * Worker loop. 한 번에 하나의 worker만 CAS를 통과합니다.
     */
    private void runWorker() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        activations.incrementAndGet();
        WorkerToken token = WorkerToken.of(config.threadNamePrefix() + "-" + TOKEN_SEQUENCE.incrementAndGet());
        activeToken = token;
        log.debug("Worker {} claimed activation", token.getValue());

        int processed = 0;
        try {
            WriteTask<?> task;
            // 첫 수신은 생성을 유발한 submit의 인계를 기다림
            long waitMs = Math.max(config.handoffRecheckMs(), config.idleLingerMs());
            while ((task = nextTask(waitMs)) != null) {
                Throwable failure = task.run(token);
                if (failure != null) {
                    log.debug("Task on worker {} failed, delivered to caller: {}", token.getValue(), failure.toString());
                }
                processed++;
                waitMs = config.idleLingerMs();
            }
        } finally {
            activeToken = null;
            running.set(false);
            log.debug("Worker {} idle after {} task(s), exiting", token.getValue(), processed);
        }
    }

    private WriteTask<?> nextTask(long waitMs) {
        SynchronousQueue<WriteTask<?>> todo = this.queue;
        if (waitMs == 0) {
            return todo.poll();
        }
        try {
            return todo.poll(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static String describe(WorkerToken token) {
        return token == null ? NO_WORKER : token.getValue();
    }

    private static ThreadFactory defaultThreadFactory(ExclusiveWriterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        AtomicLong threadSequence = new AtomicLong();
        return runnable -> {
            Thread thread = new Thread(runnable, config.threadNamePrefix() + "-thread-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

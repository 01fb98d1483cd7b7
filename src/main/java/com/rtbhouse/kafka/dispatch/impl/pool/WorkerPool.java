package com.rtbhouse.kafka.dispatch.impl.pool;

import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.message.Message;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.api.task.Task;
import com.rtbhouse.kafka.dispatch.api.task.TaskId;
import com.rtbhouse.kafka.dispatch.api.task.TaskResult;
import com.rtbhouse.kafka.dispatch.impl.AbstractDispatchThread;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.errors.BadStatusException;
import com.rtbhouse.kafka.dispatch.impl.errors.FailedCommitException;
import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;
import com.rtbhouse.kafka.dispatch.impl.failure.FailureCounter;
import com.rtbhouse.kafka.dispatch.impl.worker.DefaultWorkerHandle;
import com.rtbhouse.kafka.dispatch.impl.worker.Worker;

/**
 * Dispatches batches of a single partition to a fixed set of {@link Worker}s and commits the highest resolved offset
 * once, when the pool is stopped.
 * <p>
 * The dispatch state ({@code inFlight}, {@code pendingHighestOffset}, retries) is owned by one control path: the
 * pool's own thread while it runs, then the caller of {@link #stopPool()} once that thread has finished.
 */
public class WorkerPool<K, V> extends AbstractDispatchThread {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    public static final long NO_OFFSET = -1L;

    private final String id;
    private final TopicPartition partition;
    private final ProcessingStrategy<K, V> strategy;
    private final OffsetStorage offsetStorage;
    private final PoolFaultHandler faultHandler;
    private final FailureCounter failureCounter;

    private final int maxRetries;
    private final long pollTimeoutMs;
    private final Duration stopTimeout;

    private final ExecutorService executor;
    private final List<Worker<K, V>> workers;
    private final BlockingQueue<Worker<K, V>> availableWorkers;
    private final BlockingQueue<TaskResult> results = new LinkedBlockingQueue<>();
    private final BlockingQueue<List<Message<K, V>>> inputQueue = new LinkedBlockingQueue<>();

    private final Map<TaskId, Dispatch<K, V>> inFlight = new HashMap<>();
    private final Deque<Dispatch<K, V>> retries = new ArrayDeque<>();
    private final NavigableSet<Long> unresolvedOffsets = new TreeSet<>();
    private long taskSequence = 0L;

    private volatile long pendingHighestOffset = NO_OFFSET;
    private volatile long committableOffset = NO_OFFSET;
    private volatile boolean faulted = false;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final CompletableFuture<Void> stopFuture = new CompletableFuture<>();

    public WorkerPool(
            String id,
            String streamId,
            DispatchConfig config,
            DispatchConsumerImpl<?, ?> consumer,
            TopicPartition partition,
            ProcessingStrategy<K, V> strategy,
            OffsetStorage offsetStorage,
            PoolFaultHandler faultHandler) {
        super(id, config, consumer);
        this.id = id;
        this.partition = partition;
        this.strategy = strategy;
        this.offsetStorage = offsetStorage;
        this.faultHandler = faultHandler;
        this.failureCounter = new FailureCounter(config.getFailureThreshold(), config.getFailureWindow());

        this.maxRetries = config.getTaskRetries();
        this.pollTimeoutMs = config.getPoolPollTimeout().toMillis();
        this.stopTimeout = config.getPoolStopTimeout();

        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat(id + "-worker-%d")
                .setDaemon(true)
                .build());

        int workersNum = config.getWorkersNum();
        List<Worker<K, V>> createdWorkers = new ArrayList<>(workersNum);
        for (int i = 0; i < workersNum; i++) {
            createdWorkers.add(new Worker<>(new DefaultWorkerHandle(i, id, streamId, partition), results,
                    config.getTaskTimeout(), executor));
        }
        this.workers = Collections.unmodifiableList(createdWorkers);
        this.availableWorkers = new ArrayBlockingQueue<>(workersNum);
        this.availableWorkers.addAll(workers);
    }

    @Override
    public void init() {
        logger.info("pool {} started for partition {} with {} workers", id, partition, workers.size());
    }

    @Override
    public void process() throws InterruptedException {
        handleResults();
        if (!retries.isEmpty()) {
            dispatch(retries.pollFirst());
            return;
        }
        List<Message<K, V>> batch = inputQueue.poll(pollTimeoutMs, MILLISECONDS);
        if (batch != null) {
            dispatchBatch(batch);
        }
    }

    @Override
    public void close() {
        logger.info("pool {} stopped dispatching, {} tasks in flight", id, inFlight.size());
    }

    /**
     * Queues a batch for dispatching.
     *
     * @return false if the pool no longer accepts batches (stopped or faulted)
     */
    public boolean offer(List<Message<K, V>> batch) {
        if (faulted || stopRequested.get()) {
            return false;
        }
        return inputQueue.offer(List.copyOf(batch));
    }

    public int queuedBatches() {
        return inputQueue.size();
    }

    private void dispatchBatch(List<Message<K, V>> batch) throws InterruptedException {
        logger.debug("pool {} dispatching batch of {} messages", id, batch.size());
        for (Message<K, V> message : batch) {
            if (!dispatch(new Dispatch<>(message))) {
                logger.info("pool {} stopped dispatching at offset {}, the rest of the batch is left for the next consumer",
                        id, message.offset());
                return;
            }
        }
    }

    private boolean dispatch(Dispatch<K, V> dispatch) throws InterruptedException {
        Worker<K, V> worker = acquireWorker();
        if (worker == null) {
            // not dispatched, so it is resolved by the stopping path like any pending retry
            if (dispatch.attempt > 0) {
                retries.addFirst(dispatch);
            }
            return false;
        }
        TaskId taskId = TaskId.of(++taskSequence);
        dispatch.attempt++;
        inFlight.put(taskId, dispatch);
        unresolvedOffsets.add(dispatch.message.offset());
        worker.start(new Task<>(taskId, dispatch.message), strategy);
        worker.whenIdle()
                .thenRun(() -> release(worker))
                .exceptionally(e -> {
                    logger.error("pool {} could not release {}", id, worker, e);
                    shutdown(new DispatchException("pool " + id + " could not release " + worker, e));
                    return null;
                });
        return true;
    }

    private Worker<K, V> acquireWorker() throws InterruptedException {
        while (!shutdown) {
            handleResults();
            if (shutdown) {
                break;
            }
            Worker<K, V> worker = availableWorkers.poll(pollTimeoutMs, MILLISECONDS);
            if (worker != null) {
                return worker;
            }
        }
        return null;
    }

    private void release(Worker<K, V> worker) {
        checkState(availableWorkers.offer(worker), "pool %s could not return %s, all %s workers are already available",
                id, worker, workers.size());
    }

    private void handleResults() {
        TaskResult result;
        while ((result = results.poll()) != null) {
            handleResult(result, true);
        }
    }

    private void handleResult(TaskResult result, boolean dispatching) {
        Dispatch<K, V> dispatch = inFlight.remove(result.taskId());
        if (dispatch == null) {
            throw new BadStatusException("pool " + id + " received result of unknown " + result.taskId());
        }
        long offset = dispatch.message.offset();
        if (!result.isSuccessful()) {
            logger.debug("pool {} task {} for offset {} resolved as {}", id, result.taskId(), offset, result.status(),
                    result.cause());
            boolean thresholdReached = failureCounter.failed();
            if (dispatching && thresholdReached && !faulted) {
                fault(result, offset);
            }
            if (dispatching && !faulted && dispatch.attempt <= maxRetries) {
                logger.info("pool {} retrying offset {} ({}/{})", id, offset, dispatch.attempt, maxRetries);
                retries.addLast(dispatch);
                return;
            }
        }
        resolve(offset);
    }

    private void resolve(long offset) {
        unresolvedOffsets.remove(offset);
        if (offset > pendingHighestOffset) {
            pendingHighestOffset = offset;
        }
        if (pendingHighestOffset == NO_OFFSET) {
            committableOffset = NO_OFFSET;
        } else if (unresolvedOffsets.isEmpty()) {
            committableOffset = pendingHighestOffset;
        } else {
            committableOffset = Math.min(pendingHighestOffset, unresolvedOffsets.first() - 1);
        }
    }

    private void fault(TaskResult result, long offset) {
        faulted = true;
        PoolFaultException exception = new PoolFaultException(String.format(
                "pool %s for partition %s reached %d failed tasks within %d ms, last: %s at offset %d",
                id, partition, failureCounter.threshold(), failureCounter.window().toMillis(), result.status(), offset),
                result.cause());
        logger.error("pool {} faulted", id, exception);
        shutdown();
        faultHandler.onPoolFault(this, exception);
    }

    /**
     * Stops the pool: no more batches are accepted, all in-flight tasks are awaited and the highest resolved offset is
     * committed exactly once. Subsequent calls return the same future and do not commit again.
     *
     * @return future completed when the pool is stopped, completed exceptionally with {@link FailedCommitException} if
     *         the commit failed
     */
    public CompletableFuture<Void> stopPool() {
        if (!stopRequested.compareAndSet(false, true)) {
            return stopFuture;
        }
        logger.info("pool {} stopping", id);
        try {
            shutdown();
            awaitLoop();
            drainInFlight();
            commit();
            stopFuture.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopFuture.completeExceptionally(new DispatchException("interrupted while stopping pool " + id, e));
        } catch (RuntimeException e) {
            stopFuture.completeExceptionally(e);
        } finally {
            executor.shutdown();
        }
        return stopFuture;
    }

    private void awaitLoop() throws InterruptedException {
        if (getState() == State.NEW) {
            return;
        }
        join(stopTimeout.toMillis());
        if (isAlive()) {
            throw new BadStatusException("pool " + id + " dispatch loop has not finished in " + stopTimeout.toMillis() + " ms");
        }
    }

    private void drainInFlight() throws InterruptedException {
        while (!inFlight.isEmpty()) {
            TaskResult result = results.poll(pollTimeoutMs, MILLISECONDS);
            if (result == null) {
                logger.debug("pool {} waits for {} tasks in flight", id, inFlight.size());
            } else {
                handleResult(result, false);
            }
        }
        Dispatch<K, V> notRetried;
        while ((notRetried = retries.pollFirst()) != null) {
            resolve(notRetried.message.offset());
        }
    }

    private void commit() {
        long offset = pendingHighestOffset;
        if (offset == NO_OFFSET) {
            logger.info("pool {} has not resolved any message, nothing to commit for {}", id, partition);
            return;
        }
        try {
            offsetStorage.commit(partition, offset);
        } catch (FailedCommitException e) {
            logger.error("pool {} failed to commit offset {} for {}", id, offset, partition, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("pool {} failed to commit offset {} for {}", id, offset, partition, e);
            throw new FailedCommitException("commit of offset " + offset + " for " + partition + " failed", e);
        }
        logger.info("pool {} committed offset {} for {}", id, offset, partition);
    }

    public String id() {
        return id;
    }

    public TopicPartition partition() {
        return partition;
    }

    public boolean isFaulted() {
        return faulted;
    }

    /**
     * @return highest offset such that every dispatched message up to it is resolved, {@link #NO_OFFSET} if none
     */
    public long committableOffset() {
        return committableOffset;
    }

    long pendingHighestOffset() {
        return pendingHighestOffset;
    }

    int workersCount() {
        return workers.size();
    }

    BlockingQueue<Worker<K, V>> availableWorkers() {
        return availableWorkers;
    }

    private static final class Dispatch<K, V> {

        private final Message<K, V> message;
        private int attempt = 0;

        private Dispatch(Message<K, V> message) {
            this.message = message;
        }
    }

    @Override
    public String toString() {
        return "WorkerPool{" + id + ", " + partition + "}";
    }
}

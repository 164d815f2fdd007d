package com.nodeflow.dfg.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.config.EngineConfig;
import com.nodeflow.dfg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-flight run coordinator.
 *
 * Change notifications from any thread are published into an LMAX Disruptor
 * ring buffer. One consumer thread drains it and drives the engine.
 *
 * Coalescing:
 * The Disruptor hands the consumer a batch of every notification available
 * at once and flags the last one with 'endOfBatch'. The consumer only merges
 * notifications into {@link PendingChanges} until the end of the batch, then
 * performs one run for the whole burst.
 *
 * Guarantees:
 * - At most one run at a time: runs only ever execute on the consumer thread.
 * - No lost update: a notification published during a run waits in the ring
 * buffer and forms the next batch, so a run always follows the most recent
 * notification.
 * - Bounded: a burst collapses into one pending run instead of queueing one
 * run per notification.
 *
 * State machine: IDLE -> RUNNING -> (RUNNING_PENDING) -> IDLE. A publish that
 * lands while a run is executing moves RUNNING to RUNNING_PENDING; the
 * follow-up run is the next batch.
 *
 * While the runner does not accept runs (engine stopped or paused)
 * notifications are still merged and recorded; a later FLUSH or FULL
 * notification executes them.
 */
public final class RunCoordinator implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(RunCoordinator.class);

    /** Coordinator run state. */
    public enum RunState {
        IDLE, RUNNING, RUNNING_PENDING
    }

    /** The engine side of the coordinator. */
    public interface Runner {

        /** Returns false while the engine is stopped or paused. */
        boolean acceptsRuns();

        /**
         * Performs one run.
         *
         * @param structural  true if the topology changed since the last run.
         * @param updatedNode the update hint, or null for a full recompute.
         */
        void run(boolean structural, Node updatedNode);
    }

    private final Runner runner;
    private final EngineConfig config;
    private final ErrorRateLimiter errLimiter;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final PendingChanges pending = new PendingChanges();

    private Disruptor<ChangeEvent> disruptor;
    private volatile RingBuffer<ChangeEvent> ringBuffer;
    private boolean closed;

    public RunCoordinator(Runner runner, EngineConfig config) {
        this.runner = runner;
        this.config = config;
        this.errLimiter = new ErrorRateLimiter(log, config.getErrorLogIntervalMillis());
    }

    public void notifyStructureChanged() {
        publish(ChangeEvent.Kind.STRUCTURE, null);
    }

    public void notifyValueChanged(Node node) {
        publish(ChangeEvent.Kind.VALUE, node);
    }

    /** Requests a full recompute with a rebuilt order. */
    public void requestFullRun() {
        publish(ChangeEvent.Kind.FULL, null);
    }

    /** Runs whatever was recorded while the engine was not accepting runs. */
    public void flush() {
        publish(ChangeEvent.Kind.FLUSH, null);
    }

    public RunState state() {
        return state.get();
    }

    /**
     * Waits until every published notification has been consumed and no run
     * is executing.
     *
     * @return false if the timeout elapsed first.
     */
    public boolean awaitQuiescence(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            RingBuffer<ChangeEvent> rb = ringBuffer;
            if (rb == null || (rb.getMinimumGatingSequence() >= rb.getCursor() && state.get() == RunState.IDLE))
                return true;
            if (System.nanoTime() >= deadline)
                return false;
            Thread.sleep(1);
        }
    }

    /**
     * Stops the consumer thread after the backlog has been processed.
     * Later notifications are dropped.
     */
    @Override
    public void close() {
        Disruptor<ChangeEvent> d;
        synchronized (this) {
            if (closed)
                return;
            closed = true;
            d = disruptor;
            ringBuffer = null;
        }
        if (d == null)
            return;
        try {
            d.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Coordinator did not drain within 5s, halting");
            d.halt();
        }
    }

    private void publish(ChangeEvent.Kind kind, Node node) {
        RingBuffer<ChangeEvent> rb = ensureStarted();
        if (rb == null) {
            log.trace("Coordinator closed, dropping {} notification", kind);
            return;
        }
        long seq = rb.next();
        try {
            rb.get(seq).set(kind, node);
        } finally {
            rb.publish(seq);
        }
        state.compareAndSet(RunState.RUNNING, RunState.RUNNING_PENDING);
    }

    private RingBuffer<ChangeEvent> ensureStarted() {
        RingBuffer<ChangeEvent> rb = ringBuffer;
        if (rb != null)
            return rb;
        synchronized (this) {
            if (closed)
                return null;
            if (disruptor == null) {
                disruptor = new Disruptor<>(
                        ChangeEvent::new,
                        config.getRingBufferSize(),
                        DaemonThreadFactory.INSTANCE,
                        ProducerType.MULTI,
                        waitStrategy());
                disruptor.handleEventsWith(new Handler());
                ringBuffer = disruptor.start();
                log.debug("Run coordinator started (ringBufferSize={}, waitStrategy={})",
                        config.getRingBufferSize(), config.getWaitStrategy());
            }
            return ringBuffer;
        }
    }

    private WaitStrategy waitStrategy() {
        return "yielding".equals(config.getWaitStrategy()) ? new YieldingWaitStrategy() : new BlockingWaitStrategy();
    }

    private void drain() {
        if (!pending.requested())
            return;
        if (!runner.acceptsRuns()) {
            log.trace("Engine not accepting runs, keeping notifications recorded");
            return;
        }
        boolean structural = pending.structural();
        Node hint = pending.hint();
        pending.reset();

        state.set(RunState.RUNNING);
        try {
            runner.run(structural, hint);
        } catch (RuntimeException e) {
            // Keep the consumer thread alive; the next notification gets a fresh run.
            errLimiter.log("Coordinated run failed: " + e.getMessage(), e);
        } finally {
            if (state.getAndSet(RunState.IDLE) == RunState.RUNNING_PENDING)
                log.trace("Notifications arrived during the run, follow-up run queued");
        }
    }

    private final class Handler implements EventHandler<ChangeEvent> {
        @Override
        public void onEvent(ChangeEvent event, long sequence, boolean endOfBatch) {
            pending.merge(event.kind(), event.node());
            event.clear();
            // One run per burst
            if (endOfBatch)
                drain();
        }
    }
}

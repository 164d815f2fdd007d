package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.api.CalculationResult;
import com.nodeflow.dfg.api.EngineListener;
import com.nodeflow.dfg.api.EngineStatus;
import com.nodeflow.dfg.api.GraphChangeListener;
import com.nodeflow.dfg.api.GraphOwner;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodeOutputs;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.api.TransferHook;
import com.nodeflow.dfg.config.EngineConfig;
import com.nodeflow.dfg.util.CompositeCalculationListener;
import com.nodeflow.dfg.wiring.RunCoordinator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Lifecycle, listeners and run coordination shared by every engine.
 *
 * Key Responsibilities:
 * - Lifecycle: STOPPED -> start() -> IDLE <-> RUNNING, with pause()/resume()
 * and stop(). Only a started, unpaused engine reacts to graph changes.
 * - Change Tracking: registers with the {@link GraphOwner} and forwards every
 * structural or value change to a {@link RunCoordinator}, which coalesces
 * bursts into single runs on its own thread.
 * - Run Protocol: {@link #runOnce(Object)} serializes runs (caller-initiated
 * and coordinated) behind one lock, numbers them and reports them to
 * {@link EngineListener}s.
 * - Calculation Events: node level callbacks are fanned out through a keyed
 * {@link CompositeCalculationListener}.
 *
 * Subclasses supply the actual calculation in {@link #execute(Object)} and
 * {@link #runGraph(GraphView, Map, Object)}.
 *
 * @param <D> Type of the caller supplied calculation data.
 */
public abstract class BaseEngine<D> implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BaseEngine.class);

    protected final GraphOwner owner;
    protected final EngineConfig config;

    private final CompositeCalculationListener calculationEvents = new CompositeCalculationListener();
    private final List<EngineListener> engineListeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicLong runCounter = new AtomicLong();
    private final RunCoordinator coordinator;
    private final GraphChangeListener changeListener = new ChangeRelay();

    private EngineStatus status = EngineStatus.STOPPED;
    private volatile TransferHook transferHook = TransferHook.IDENTITY;
    private volatile Supplier<? extends D> calculationDataSupplier = () -> null;
    private volatile Thread applyingThread;

    protected BaseEngine(GraphOwner owner, EngineConfig config) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.config = config.validate();
        this.coordinator = new RunCoordinator(new CoordinatedRunner(), config);
        owner.addChangeListener(changeListener);
    }

    // ---- Lifecycle ----

    /**
     * Starts reacting to graph changes and immediately schedules a full run.
     * No-op if the engine is already started.
     */
    public void start() {
        synchronized (this) {
            if (status != EngineStatus.STOPPED) {
                log.debug("Engine already started ({})", status);
                return;
            }
            setStatus(EngineStatus.IDLE);
        }
        log.info("Engine started");
        coordinator.requestFullRun();
    }

    /**
     * Suspends coordinated runs. Changes arriving while paused are recorded
     * and executed as one run on {@link #resume()}.
     */
    public void pause() {
        synchronized (this) {
            if (status == EngineStatus.IDLE || status == EngineStatus.RUNNING)
                setStatus(EngineStatus.PAUSED);
        }
    }

    public void resume() {
        synchronized (this) {
            if (status != EngineStatus.PAUSED)
                return;
            setStatus(EngineStatus.IDLE);
        }
        coordinator.flush();
    }

    /** Stops reacting to graph changes. A run in progress completes. */
    public void stop() {
        synchronized (this) {
            if (status == EngineStatus.STOPPED)
                return;
            setStatus(EngineStatus.STOPPED);
        }
        log.info("Engine stopped");
    }

    /** Stops the engine, detaches it from its owner and shuts the coordinator down. */
    @Override
    public void close() {
        stop();
        owner.removeChangeListener(changeListener);
        coordinator.close();
    }

    public synchronized EngineStatus status() {
        return status;
    }

    // ---- Runs ----

    /**
     * Executes one run on the calling thread.
     *
     * Runs never overlap: a call made while another run (caller-initiated or
     * coordinated) is executing blocks until that run has finished.
     *
     * @param calculationData Passed unchanged to every calculation step.
     * @return The run's result.
     * @throws CycleException            if the graph contains a cycle.
     * @throws NodeCalculationException  if a calculation step failed.
     * @throws EngineStateException      on an inconsistency between a node's
     *                                   declared and produced outputs.
     */
    public CalculationResult runOnce(D calculationData) {
        runLock.lock();
        boolean fromIdle = transition(EngineStatus.IDLE, EngineStatus.RUNNING);
        long runId = runCounter.incrementAndGet();
        try {
            for (EngineListener l : engineListeners)
                l.onRunStart(runId);
            CalculationResult result = execute(calculationData);
            log.debug("Run {} finished with {} node result(s)", runId, result.size());
            for (EngineListener l : engineListeners)
                l.onRunEnd(runId, result);
            return result;
        } catch (RuntimeException e) {
            for (EngineListener l : engineListeners)
                l.onRunError(runId, e);
            throw e;
        } finally {
            if (fromIdle)
                transition(EngineStatus.RUNNING, EngineStatus.IDLE);
            runLock.unlock();
        }
    }

    /**
     * Calculates one graph.
     *
     * @param graph           The graph to calculate.
     * @param inputs          Values of external input ports, keyed by port id.
     * @param calculationData Passed unchanged to every calculation step.
     * @return The result of every node evaluated in this graph and in nested graphs.
     */
    public abstract CalculationResult runGraph(GraphView graph, Map<String, Object> inputs, D calculationData);

    /** Performs one run of the owner's root graph. Called with the run lock held. */
    protected abstract CalculationResult execute(D calculationData);

    /** Called on the coordinator thread, with the run lock held, before a coordinated run. */
    protected void onChange(boolean structural, Node updatedNode) {
    }

    /** Called on the notifying thread as soon as the graph topology changed. */
    protected void onStructureChanged(GraphView graph) {
    }

    /**
     * Checks that a calculation produced a value for every declared output.
     *
     * @throws EngineStateException naming the first missing output.
     */
    protected void validateNodeCalculationOutput(Node node, NodeOutputs outputs) {
        if (outputs == null)
            throw new EngineStateException("Calculation of node " + node.title() + " (" + node.id()
                    + ") returned no outputs");
        for (String name : node.outputs().keySet()) {
            if (!outputs.has(name))
                throw new EngineStateException("Calculation return value of node " + node.title() + " ("
                        + node.id() + ") is missing key \"" + name + "\"");
        }
    }

    /**
     * Waits until every pending change has been handled by the coordinator.
     *
     * @return false if the timeout elapsed first.
     */
    public boolean awaitQuiescence(long timeout, TimeUnit unit) throws InterruptedException {
        return coordinator.awaitQuiescence(timeout, unit);
    }

    // ---- Listeners and hooks ----

    /** Keyed subscribers of node level calculation events. */
    public CompositeCalculationListener calculationEvents() {
        return calculationEvents;
    }

    public void addEngineListener(EngineListener listener) {
        engineListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeEngineListener(EngineListener listener) {
        engineListeners.remove(listener);
    }

    public TransferHook transferHook() {
        return transferHook;
    }

    /** Sets the hook applied to values travelling along connections; null restores identity. */
    public void setTransferHook(TransferHook hook) {
        this.transferHook = hook == null ? TransferHook.IDENTITY : hook;
    }

    /** Supplies the calculation data of coordinated runs. Defaults to null data. */
    public void setCalculationDataSupplier(Supplier<? extends D> supplier) {
        this.calculationDataSupplier = supplier == null ? () -> null : supplier;
    }

    // ---- Internals ----

    private synchronized boolean transition(EngineStatus expected, EngineStatus next) {
        if (status != expected)
            return false;
        setStatus(next);
        return true;
    }

    private void setStatus(EngineStatus next) {
        EngineStatus previous = status;
        status = next;
        for (EngineListener l : engineListeners)
            l.onStatusChanged(previous, next);
    }

    private synchronized boolean acceptsRuns() {
        return status == EngineStatus.IDLE || status == EngineStatus.RUNNING;
    }

    private void applyWithoutFeedback(CalculationResult result) {
        applyingThread = Thread.currentThread();
        try {
            ResultApplier.applyResult(result, owner);
        } finally {
            applyingThread = null;
        }
    }

    private final class CoordinatedRunner implements RunCoordinator.Runner {
        @Override
        public boolean acceptsRuns() {
            return BaseEngine.this.acceptsRuns();
        }

        @Override
        public void run(boolean structural, Node updatedNode) {
            runLock.lock();
            try {
                onChange(structural, updatedNode);
                CalculationResult result = runOnce(calculationDataSupplier.get());
                if (config.isApplyResults())
                    applyWithoutFeedback(result);
            } finally {
                runLock.unlock();
            }
        }
    }

    private final class ChangeRelay implements GraphChangeListener {
        @Override
        public void onStructureChanged(GraphView graph) {
            BaseEngine.this.onStructureChanged(graph);
            // start() always begins with a full run
            if (status() != EngineStatus.STOPPED)
                coordinator.notifyStructureChanged();
        }

        @Override
        public void onInputValueChanged(Node node, NodePort port) {
            // Our own write-back, or a stopped engine
            if (Thread.currentThread() == applyingThread || status() == EngineStatus.STOPPED)
                return;
            coordinator.notifyValueChanged(node);
        }
    }
}

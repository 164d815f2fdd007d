package com.nodeflow.dfg.wiring;

import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.config.EngineConfig;
import com.nodeflow.dfg.node.PassiveNode;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class RunCoordinatorTest {

    /** Records runs; the first run blocks until released. */
    private static final class GatedRunner implements RunCoordinator.Runner {
        final List<Node> hints = new CopyOnWriteArrayList<>();
        final List<Boolean> structural = new CopyOnWriteArrayList<>();
        final CountDownLatch firstStarted = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean active = true;
        volatile RuntimeException failure;

        @Override
        public boolean acceptsRuns() {
            return active;
        }

        @Override
        public void run(boolean structuralChange, Node updatedNode) {
            hints.add(updatedNode == null ? NO_HINT : updatedNode);
            structural.add(structuralChange);
            firstStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            RuntimeException f = failure;
            if (f != null)
                throw f;
        }
    }

    private static final Node NO_HINT = new PassiveNode("none");

    private GatedRunner runner;
    private RunCoordinator coordinator;

    @Before
    public void setUp() {
        runner = new GatedRunner();
        coordinator = new RunCoordinator(runner, EngineConfig.defaults());
    }

    @After
    public void tearDown() {
        runner.release.countDown();
        coordinator.close();
    }

    @Test
    public void testBurstDuringRunCoalescesIntoOneRun() throws Exception {
        PassiveNode node = new PassiveNode("n");

        coordinator.requestFullRun();
        assertTrue(runner.firstStarted.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 100; i++)
            coordinator.notifyValueChanged(node);
        assertEquals(RunCoordinator.RunState.RUNNING_PENDING, coordinator.state());

        runner.release.countDown();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));

        assertEquals(2, runner.hints.size());
        assertSame(NO_HINT, runner.hints.get(0));
        assertTrue(runner.structural.get(0));
        assertSame(node, runner.hints.get(1));
        assertFalse(runner.structural.get(1));
        assertEquals(RunCoordinator.RunState.IDLE, coordinator.state());
    }

    @Test
    public void testMixedBurstRunsFullRecompute() throws Exception {
        coordinator.requestFullRun();
        assertTrue(runner.firstStarted.await(5, TimeUnit.SECONDS));
        coordinator.notifyValueChanged(new PassiveNode("a"));
        coordinator.notifyValueChanged(new PassiveNode("b"));

        runner.release.countDown();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));

        assertEquals(2, runner.hints.size());
        assertSame(NO_HINT, runner.hints.get(1));
    }

    @Test
    public void testInactiveRunnerKeepsChangesUntilFlush() throws Exception {
        runner.active = false;
        runner.release.countDown();
        PassiveNode node = new PassiveNode("n");

        coordinator.notifyValueChanged(node);
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));
        assertTrue(runner.hints.isEmpty());

        runner.active = true;
        coordinator.flush();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));

        assertEquals(1, runner.hints.size());
        assertSame(node, runner.hints.get(0));
    }

    @Test
    public void testFlushWithoutChangesDoesNotRun() throws Exception {
        runner.release.countDown();

        coordinator.flush();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));

        assertTrue(runner.hints.isEmpty());
    }

    @Test
    public void testFailedRunDoesNotStopCoordinator() throws Exception {
        runner.release.countDown();
        runner.failure = new IllegalStateException("failing on purpose");

        coordinator.requestFullRun();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));
        runner.failure = null;
        coordinator.notifyStructureChanged();
        assertTrue(coordinator.awaitQuiescence(5, TimeUnit.SECONDS));

        assertEquals(2, runner.hints.size());
    }

    @Test
    public void testClosedCoordinatorDropsNotifications() throws Exception {
        runner.release.countDown();
        coordinator.close();

        coordinator.requestFullRun();

        assertTrue(coordinator.awaitQuiescence(1, TimeUnit.SECONDS));
        assertTrue(runner.hints.isEmpty());
    }
}

package org.flowblocks.workers.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.function.Supplier;

import org.flowblocks.workers.health.ProbeResult;
import org.flowblocks.workers.poll.ErrorKind;
import org.flowblocks.workers.poll.PollCycleResult;
import org.flowblocks.workers.state.ConsumerState;
import org.flowblocks.workers.state.ConsumerStateTracker;
import org.flowblocks.workers.state.InMemoryConsumerStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class LifecycleStateMachineTest {

	@Mock
	Supplier<ProbeResult> mockProbe;
	@Mock
	HealthStatusSurface mockSurface;

	ConsumerStateTracker tracker;
	LifecycleStateMachine lifecycle;

	ProbeResult success;
	ProbeResult unreachable;

	@BeforeEach
	public void before() {
		tracker = new ConsumerStateTracker(new InMemoryConsumerStateStore());
		lifecycle = new LifecycleStateMachine(mockProbe, tracker, mockSurface);
		success = ProbeResult.success();
		unreachable = ProbeResult.failure(ErrorKind.CONNECTIVITY, "namespace not found");
	}

	private static PollCycleResult pollError(ErrorKind kind, String diagnostic) {
		return PollCycleResult.error(0, Collections.emptyList(), kind, diagnostic, Collections.emptyList());
	}

	private static PollCycleResult pollOk() {
		return PollCycleResult.ok(0, Collections.emptyList(), Collections.emptyList());
	}

	@Test
	public void testBeforeActivation() {
		assertNull(lifecycle.getHealth());
		assertNull(lifecycle.getStatus());
		assertFalse(lifecycle.canRun());
		assertFalse(lifecycle.shouldReprobe());
	}

	@Test
	public void testActivateSuccess() {
		when(mockProbe.get()).thenReturn(success);
		// call under test
		BlockHealth health = lifecycle.activate();
		assertEquals(BlockHealth.ready(), health);
		assertTrue(lifecycle.canRun());
		verify(mockSurface).publish(BlockHealth.ready());
	}

	@Test
	public void testActivateFailure() {
		when(mockProbe.get()).thenReturn(unreachable);
		// call under test
		BlockHealth health = lifecycle.activate();
		assertEquals(BlockHealth.failed("namespace not found"), health);
		assertTrue(lifecycle.canRun());
		assertTrue(lifecycle.shouldReprobe());
	}

	@Test
	public void testReadyToFailedOnProbe() {
		when(mockProbe.get()).thenReturn(success, unreachable);
		lifecycle.activate();
		// call under test
		lifecycle.onPollResult(pollError(ErrorKind.CONNECTIVITY, "Unauthorized access"));
		assertEquals(HealthStatus.FAILED, lifecycle.getStatus());
		assertEquals("namespace not found", lifecycle.getHealth().getDescription());
		verify(mockProbe, times(2)).get();
	}

	@Test
	public void testTransientPollErrorWithHealthyProbe() {
		when(mockProbe.get()).thenReturn(success);
		lifecycle.activate();
		// call under test
		lifecycle.onPollResult(pollError(ErrorKind.ACKNOWLEDGMENT, "lock lost"));
		assertEquals(HealthStatus.READY, lifecycle.getStatus());
		// only the activation published a change
		verify(mockSurface, times(1)).publish(BlockHealth.ready());
	}

	@Test
	public void testFailedToReady() {
		when(mockProbe.get()).thenReturn(unreachable, success);
		lifecycle.activate();
		// call under test
		BlockHealth health = lifecycle.reprobe();
		assertEquals(BlockHealth.ready(), health);
		assertFalse(lifecycle.shouldReprobe());
	}

	@Test
	public void testSuccessfulPollChangesNothing() {
		when(mockProbe.get()).thenReturn(success);
		lifecycle.activate();
		lifecycle.onPollResult(pollOk());
		verify(mockProbe, times(1)).get();
		assertEquals(HealthStatus.READY, lifecycle.getStatus());
	}

	@Test
	public void testConfigurationFailureIsNotReprobed() {
		when(mockProbe.get()).thenReturn(success);
		lifecycle.activate();
		// call under test
		lifecycle.onPollResult(pollError(ErrorKind.CONFIGURATION, "Queue name cannot be empty"));
		assertEquals(BlockHealth.failed("Queue name cannot be empty"), lifecycle.getHealth());
		assertFalse(lifecycle.shouldReprobe());
		verify(mockProbe, times(1)).get();
	}

	@Test
	public void testConfigurationProbeFailureIsNotReprobed() {
		when(mockProbe.get()).thenReturn(ProbeResult.failure(ErrorKind.CONFIGURATION, "Queue name cannot be empty"));
		lifecycle.activate();
		assertEquals(HealthStatus.FAILED, lifecycle.getStatus());
		assertFalse(lifecycle.shouldReprobe());
	}

	@Test
	public void testActivateRevalidatesConfiguration() {
		when(mockProbe.get()).thenReturn(ProbeResult.failure(ErrorKind.CONFIGURATION, "bad"), success);
		lifecycle.activate();
		// call under test
		lifecycle.activate();
		assertEquals(HealthStatus.READY, lifecycle.getStatus());
	}

	@Test
	public void testDrainFromReady() {
		when(mockProbe.get()).thenReturn(success);
		lifecycle.activate();
		tracker.recordCheck(1709296200000L);
		tracker.recordMessageReceived(1709296200000L);
		// call under test
		BlockHealth health = lifecycle.drain();
		assertEquals(BlockHealth.drained(), health);
		assertEquals(new ConsumerState(null, null), tracker.getState());
		assertFalse(lifecycle.canRun());
		verify(mockSurface).publish(BlockHealth.drained());
	}

	@Test
	public void testDrainFromFailed() {
		when(mockProbe.get()).thenReturn(unreachable);
		lifecycle.activate();
		assertEquals(BlockHealth.drained(), lifecycle.drain());
		assertFalse(lifecycle.shouldReprobe());
	}

	@Test
	public void testDrainedIsTerminal() {
		when(mockProbe.get()).thenReturn(success);
		lifecycle.activate();
		lifecycle.drain();
		// none of these may leave the drained state
		lifecycle.activate();
		lifecycle.reprobe();
		lifecycle.applyProbe(unreachable);
		lifecycle.onPollResult(pollError(ErrorKind.CONNECTIVITY, "x"));
		lifecycle.drain();
		assertEquals(HealthStatus.DRAINED, lifecycle.getStatus());
		verify(mockProbe, times(1)).get();
		verify(mockSurface, times(1)).publish(BlockHealth.drained());
	}

	@Test
	public void testRunFailedReprobes() {
		when(mockProbe.get()).thenReturn(success, unreachable);
		lifecycle.activate();
		// call under test
		lifecycle.runFailed(new IllegalStateException("boom"));
		assertEquals(HealthStatus.FAILED, lifecycle.getStatus());
	}

	@Test
	public void testNoSurface() {
		lifecycle = new LifecycleStateMachine(mockProbe, tracker, null);
		when(mockProbe.get()).thenReturn(success);
		assertEquals(BlockHealth.ready(), lifecycle.activate());
		verify(mockSurface, never()).publish(BlockHealth.ready());
	}
}

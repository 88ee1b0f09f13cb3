package org.flowblocks.workers.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;

import org.flowblocks.workers.poll.ErrorKind;
import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.session.QueueProvider;
import org.flowblocks.workers.session.QueueSession;
import org.flowblocks.workers.session.QueueSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class ConnectionHealthCheckTest {

	@Mock
	QueueSessionFactory mockFactory;
	@Mock
	QueueSession mockSession;

	ConsumerCredential credential;
	PollCycleConfiguration config;
	ConnectionHealthCheck healthCheck;

	@BeforeEach
	public void before() throws Exception {
		credential = ConsumerCredential.forConnectionString("Endpoint=sb://ns/;SharedAccessKey=k");
		config = new PollCycleConfiguration("orders");
		when(mockFactory.getProvider()).thenReturn(QueueProvider.SERVICE_BUS);
		when(mockFactory.open(credential, "orders")).thenReturn(mockSession);
		healthCheck = new ConnectionHealthCheck(mockFactory);
	}

	@Test
	public void testProbeEmptyQueue() throws Exception {
		when(mockSession.peek(1)).thenReturn(Collections.emptyList());
		// call under test
		ProbeResult result = healthCheck.probe(config, credential);
		assertTrue(result.isSuccess());
		verify(mockSession).peek(1);
		verify(mockSession, never()).receive(anyInt(), any());
		verify(mockSession).close();
	}

	@Test
	public void testProbePeekFailure() throws Exception {
		when(mockSession.peek(1)).thenThrow(new ConnectivityException("Unauthorized access"));
		// call under test
		ProbeResult result = healthCheck.probe(config, credential);
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.CONNECTIVITY, result.getErrorKind());
		assertEquals("Unauthorized access", result.getDescription());
		verify(mockSession).close();
	}

	@Test
	public void testProbeOpenFailure() throws Exception {
		when(mockFactory.open(credential, "orders")).thenThrow(new ConnectivityException("namespace not found"));
		ProbeResult result = healthCheck.probe(config, credential);
		assertEquals("namespace not found", result.getDescription());
	}

	@Test
	public void testProbeInvalidConfiguration() throws Exception {
		config.setQueueName("");
		// call under test
		ProbeResult result = healthCheck.probe(config, credential);
		assertEquals(ErrorKind.CONFIGURATION, result.getErrorKind());
		verify(mockFactory, never()).open(any(), anyString());
	}

	@Test
	public void testProbeNullCredential() {
		assertEquals(ErrorKind.CONFIGURATION, healthCheck.probe(config, null).getErrorKind());
	}

	@Test
	public void testProbeOverCeilingStillProbes() throws Exception {
		config.setMaxMessages(5000);
		assertTrue(healthCheck.probe(config, credential).isSuccess());
	}

	@Test
	public void testProbeUnexpectedFailure() throws Exception {
		when(mockSession.peek(1)).thenThrow(new IllegalStateException());
		ProbeResult result = healthCheck.probe(config, credential);
		assertEquals(ConnectionHealthCheck.DEFAULT_FAILURE_DESCRIPTION, result.getDescription());
	}

	@Test
	public void testDescribeAggregate() {
		RuntimeException root = new RuntimeException("all attempts failed");
		root.addSuppressed(new RuntimeException("connection refused"));
		root.addSuppressed(new RuntimeException("timed out"));
		ConnectivityException error = new ConnectivityException("wrapped", root);
		assertEquals("AggregateError: connection refused; timed out", ConnectionHealthCheck.describe(error));
	}

	@Test
	public void testDescribeNoMessage() {
		assertEquals("Connection failed", ConnectionHealthCheck.describe(new RuntimeException("")));
	}
}

package org.flowblocks.workers.aws.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.flowblocks.workers.message.QueueMessage;
import org.flowblocks.workers.session.AcknowledgmentException;
import org.flowblocks.workers.session.ConnectivityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

@ExtendWith(MockitoExtension.class)
public class SqsQueueSessionTest {

	@Mock
	SqsClient mockSqsClient;
	@Captor
	ArgumentCaptor<ReceiveMessageRequest> receiveCaptor;
	@Captor
	ArgumentCaptor<DeleteMessageRequest> deleteCaptor;

	String queueUrl;
	SqsQueueSession session;

	@BeforeEach
	public void before() {
		queueUrl = "https://sqs.us-east-1.amazonaws.com/123/orders";
		session = new SqsQueueSession("orders", queueUrl, mockSqsClient);
	}

	@Test
	public void testReceive() throws Exception {
		Message message = Message.builder()
				.body("{\"a\":1}")
				.messageId("m1")
				.receiptHandle("receipt-1")
				.attributesWithStrings(Map.of("SentTimestamp", "1709296200000", "SequenceNumber", "18849496460467696128"))
				.messageAttributes(Map.of(
						"contentType", MessageAttributeValue.builder().dataType("String").stringValue("application/json").build(),
						"correlationId", MessageAttributeValue.builder().dataType("String").stringValue("corr").build(),
						"tenant", MessageAttributeValue.builder().dataType("String").stringValue("acme").build()))
				.build();
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
				.thenReturn(ReceiveMessageResponse.builder().messages(message).build());
		// call under test
		List<QueueMessage> received = session.receive(5, Duration.ofMillis(2500));
		assertEquals(1, received.size());
		QueueMessage converted = received.get(0);
		assertEquals("{\"a\":1}", converted.getBody());
		assertEquals("m1", converted.getMessageId());
		assertEquals(Instant.ofEpochMilli(1709296200000L), converted.getEnqueuedTime());
		assertEquals(new BigInteger("18849496460467696128"), converted.getSequenceNumber());
		assertEquals("application/json", converted.getContentType());
		assertEquals("corr", converted.getCorrelationId());
		assertEquals("acme", converted.getApplicationProperties().get("tenant"));
		assertEquals("receipt-1", converted.getDeliveryHandle());

		verify(mockSqsClient).receiveMessage(receiveCaptor.capture());
		ReceiveMessageRequest request = receiveCaptor.getValue();
		assertEquals(queueUrl, request.queueUrl());
		assertEquals(5, request.maxNumberOfMessages());
		assertEquals(3, request.waitTimeSeconds());
	}

	@Test
	public void testReceiveEmpty() throws Exception {
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
				.thenReturn(ReceiveMessageResponse.builder().build());
		assertTrue(session.receive(10, Duration.ofSeconds(5)).isEmpty());
	}

	@Test
	public void testReceiveWithoutAttributes() throws Exception {
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse
				.builder().messages(Message.builder().body("plain").messageId("m2").receiptHandle("r2").build()).build());
		QueueMessage converted = session.receive(10, Duration.ofSeconds(5)).get(0);
		assertNull(converted.getEnqueuedTime());
		assertNull(converted.getSequenceNumber());
		assertNull(converted.getContentType());
	}

	@Test
	public void testReceiveMalformedAttributes() throws Exception {
		Message message = Message.builder()
				.body("plain")
				.messageId("m3")
				.receiptHandle("r3")
				.attributesWithStrings(Map.of("SentTimestamp", "yesterday", "SequenceNumber", "not-a-number"))
				.build();
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
				.thenReturn(ReceiveMessageResponse.builder().messages(message).build());
		// call under test
		List<QueueMessage> received = session.receive(10, Duration.ofSeconds(5));
		assertEquals(1, received.size());
		assertEquals("m3", received.get(0).getMessageId());
		assertNull(received.get(0).getEnqueuedTime());
		assertNull(received.get(0).getSequenceNumber());
		assertEquals("r3", received.get(0).getDeliveryHandle());
	}

	@Test
	public void testReceiveCapsBatch() throws Exception {
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
				.thenReturn(ReceiveMessageResponse.builder().build());
		session.receive(2047, Duration.ofSeconds(60));
		verify(mockSqsClient).receiveMessage(receiveCaptor.capture());
		assertEquals(10, receiveCaptor.getValue().maxNumberOfMessages());
		assertEquals(SqsQueueSession.MAX_WAIT_TIME_SEC, receiveCaptor.getValue().waitTimeSeconds());
	}

	@Test
	public void testReceiveFailure() {
		when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
				.thenThrow(SqsException.builder().message("Access denied").build());
		assertThrows(ConnectivityException.class, () -> session.receive(10, Duration.ofSeconds(5)));
	}

	@Test
	public void testAcknowledge() throws Exception {
		QueueMessage message = QueueMessage.builder().messageId("m1").deliveryHandle("receipt-1").build();
		// call under test
		session.acknowledge(message);
		verify(mockSqsClient).deleteMessage(deleteCaptor.capture());
		assertEquals(queueUrl, deleteCaptor.getValue().queueUrl());
		assertEquals("receipt-1", deleteCaptor.getValue().receiptHandle());
	}

	@Test
	public void testAcknowledgeFailure() {
		when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class)))
				.thenThrow(SqsException.builder().message("Receipt handle expired").build());
		QueueMessage message = QueueMessage.builder().messageId("m1").deliveryHandle("receipt-1").build();
		assertThrows(AcknowledgmentException.class, () -> session.acknowledge(message));
	}

	@Test
	public void testPeek() throws Exception {
		when(mockSqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
				.thenReturn(GetQueueAttributesResponse.builder().build());
		// call under test
		assertTrue(session.peek(1).isEmpty());
		verify(mockSqsClient).getQueueAttributes(any(GetQueueAttributesRequest.class));
	}

	@Test
	public void testPeekFailure() {
		when(mockSqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
				.thenThrow(SqsException.builder().message("Access denied").build());
		assertThrows(ConnectivityException.class, () -> session.peek(1));
	}

	@Test
	public void testCloseLeavesClientOpen() {
		session.close();
		assertTrue(session.isClosed());
		verifyNoInteractions(mockSqsClient);
	}

	@Test
	public void testToWaitTimeSeconds() {
		assertEquals(0, SqsQueueSession.toWaitTimeSeconds(Duration.ZERO));
		assertEquals(1, SqsQueueSession.toWaitTimeSeconds(Duration.ofMillis(1)));
		assertEquals(5, SqsQueueSession.toWaitTimeSeconds(Duration.ofSeconds(5)));
		assertEquals(20, SqsQueueSession.toWaitTimeSeconds(Duration.ofMinutes(2)));
	}
}

package com.obsinity.errors.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.obsinity.errors.configuration.ReporterConfigurationException;
import com.obsinity.errors.model.DeliveryFailure;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.EventSource;
import com.obsinity.errors.model.SendResult;
import com.obsinity.errors.processor.EventRenderer;
import com.obsinity.errors.processor.JacksonPayloadEncoder;
import com.obsinity.errors.processor.PayloadSanitizer;
import com.obsinity.errors.transport.AsyncEventSender;
import com.obsinity.errors.transport.Transport;

class EventDispatcherTest {

	private Transport transport;
	private AsyncEventSender asyncSender;
	private SendFailureLogger failureLogger;
	private LastEventTracker lastEvent;
	private EventDispatcher dispatcher;

	private final ErrorEvent event = ErrorEvent.builder()
		.eventId("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa")
		.message("boom")
		.source(EventSource.USER)
		.build();

	@BeforeEach
	void setUp() {
		transport = mock(Transport.class);
		asyncSender = mock(AsyncEventSender.class);
		failureLogger = mock(SendFailureLogger.class);
		lastEvent = new LastEventTracker();
		EventRenderer renderer = new EventRenderer(new PayloadSanitizer(new JacksonPayloadEncoder(new ObjectMapper())));
		dispatcher = new EventDispatcher(renderer, transport, asyncSender, lastEvent, failureLogger);
	}

	@Test
	@SuppressWarnings("unchecked")
	void syncPostsRenderedPayloadAndRecordsLastEvent() {
		when(transport.post(anyList(), anyInt())).thenReturn(SendResult.accepted(event.eventId()));

		SendResult result = dispatcher.dispatch(event, CompletionMode.SYNC, 3);

		assertThat(result).isEqualTo(SendResult.accepted(event.eventId()));
		ArgumentCaptor<List<Map<String, Object>>> batch = ArgumentCaptor.forClass(List.class);
		verify(transport).post(batch.capture(), eq(3));
		assertThat(batch.getValue()).singleElement()
			.satisfies(p -> assertThat(p).containsEntry("event_id", event.eventId()).containsEntry("message", "boom"));
		assertThat(lastEvent.lastEvent()).isEqualTo(new LastEventTracker.LastEvent(event.eventId(), EventSource.USER));
		verify(failureLogger).logResult(result, event);
	}

	@Test
	void syncFailureIsReturnedAndLoggedButNotRecorded() {
		SendResult failed = SendResult.failed(DeliveryFailure.requestFailure("HTTP 503"));
		when(transport.post(anyList(), anyInt())).thenReturn(failed);

		SendResult result = dispatcher.dispatch(event, CompletionMode.SYNC, 0);

		assertThat(result).isSameAs(failed);
		assertThat(lastEvent.lastEventId()).isNull();
		verify(failureLogger).logResult(failed, event);
	}

	@Test
	void transportExceptionBecomesRequestFailure() {
		IllegalStateException fault = new IllegalStateException("connection reset");
		when(transport.post(anyList(), anyInt())).thenThrow(fault);

		SendResult result = dispatcher.dispatch(event, CompletionMode.SYNC, 1);

		assertThat(result.status()).isEqualTo(SendResult.Status.FAILED);
		assertThat(result.failure().kind()).isEqualTo(DeliveryFailure.Kind.REQUEST_FAILURE);
		assertThat(result.failure().cause()).isSameAs(fault);
		assertThat(lastEvent.lastEventId()).isNull();
		verify(failureLogger).logResult(result, event);
	}

	@Test
	void missingTransportResultBecomesRequestFailure() {
		when(transport.post(anyList(), anyInt())).thenReturn(null);

		SendResult result = dispatcher.dispatch(event, CompletionMode.SYNC, 1);

		assertThat(result.status()).isEqualTo(SendResult.Status.FAILED);
		assertThat(result.failure().kind()).isEqualTo(DeliveryFailure.Kind.REQUEST_FAILURE);
		assertThat(result.failure().cause()).isNull();
		assertThat(result.failure().detail()).contains("returned no result");
		verify(failureLogger).logResult(result, event);
	}

	@Test
	void noneHandsOffAndReturnsPlaceholderId() {
		SendResult result = dispatcher.dispatch(event, CompletionMode.NONE, 3);

		assertThat(result.status()).isEqualTo(SendResult.Status.ACCEPTED);
		assertThat(result.eventId()).isEmpty();
		verify(asyncSender).send(any());
		verifyNoInteractions(transport);
		assertThat(lastEvent.lastEventId()).isEqualTo(event.eventId());
	}

	@Test
	void retiredAsyncModeFailsLoudlyWithoutSending() {
		assertThatThrownBy(() -> dispatcher.dispatch(event, CompletionMode.ASYNC, 3))
			.isInstanceOf(ReporterConfigurationException.class)
			.hasMessageContaining("SYNC");

		verifyNoInteractions(transport, asyncSender);
		verify(failureLogger, never()).logResult(any(), any());
		assertThat(lastEvent.lastEventId()).isNull();
	}
}

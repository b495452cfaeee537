package com.obsinity.errors.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import com.obsinity.errors.configuration.ErrorReporterProperties;
import com.obsinity.errors.configuration.ReporterConfigurationException;
import com.obsinity.errors.dispatch.CompletionMode;
import com.obsinity.errors.dispatch.EventDispatcher;
import com.obsinity.errors.dispatch.LastEventTracker;
import com.obsinity.errors.dispatch.SendFailureLogger;
import com.obsinity.errors.model.DeliveryFailure;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;
import com.obsinity.errors.receivers.AfterSendHook;
import com.obsinity.errors.receivers.BeforeSendHook;
import com.obsinity.errors.receivers.HookInvoker;
import com.obsinity.errors.transport.AsyncEventSender;
import com.obsinity.errors.transport.Transport;

class ErrorReporterClientTest {

	private ErrorReporterProperties properties;
	private Transport transport;
	private AsyncEventSender asyncSender;
	private LastEventTracker lastEvent;
	private EventRenderer renderer;
	private final AtomicInteger draws = new AtomicInteger();
	private double nextDraw = 0.0;

	@BeforeEach
	void setUp() {
		properties = new ErrorReporterProperties();
		transport = mock(Transport.class);
		asyncSender = mock(AsyncEventSender.class);
		lastEvent = new LastEventTracker();
		renderer = new EventRenderer(new PayloadSanitizer(new JacksonPayloadEncoder(new ObjectMapper())));
		when(transport.post(anyList(), anyInt()))
			.thenAnswer(inv -> {
				List<Map<String, Object>> batch = inv.getArgument(0);
				return SendResult.accepted((String) batch.get(0).get("event_id"));
			});
	}

	private ErrorReporterClient client(Object beforeSend, Object afterSend) {
		EventSampler sampler = new EventSampler(() -> {
			draws.incrementAndGet();
			return nextDraw;
		});
		EventDispatcher dispatcher = new EventDispatcher(
			renderer, transport, asyncSender, lastEvent, new SendFailureLogger(Level.WARN));
		return new ErrorReporterClient(
			properties, sampler, new HookInvoker(beforeSend, afterSend), renderer, dispatcher, lastEvent);
	}

	@Test
	void acceptedEventIsDeliveredAndRemembered() {
		ErrorEvent event = ErrorEvent.fromMessage("boom");

		SendResult result = client(null, null).sendEvent(event);

		assertThat(result).isEqualTo(SendResult.accepted(event.eventId()));
		assertThat(client(null, null).lastEventId()).isEqualTo(event.eventId());
		verify(transport).post(anyList(), eq(ErrorReporterProperties.DEFAULT_REQUEST_RETRIES));
	}

	@Test
	void unsampledEventSkipsHooksAndTransport() {
		List<String> calls = new ArrayList<>();
		properties.setSampleRate(0.5);
		nextDraw = 0.75;

		SendResult result = client(
			(BeforeSendHook) e -> { calls.add("before"); return e; },
			(AfterSendHook) (e, r) -> calls.add("after"))
			.sendEvent(ErrorEvent.fromMessage("boom"));

		assertThat(result.status()).isEqualTo(SendResult.Status.UNSAMPLED);
		assertThat(calls).isEmpty();
		verifyNoInteractions(transport, asyncSender);
	}

	@Test
	void sampleRateOptionOverridesProperty() {
		properties.setSampleRate(0.0);
		nextDraw = 0.2;

		SendResult result = client(null, null)
			.sendEvent(ErrorEvent.fromMessage("boom"), SendOptions.defaults().withSampleRate(0.3));

		assertThat(result.isAccepted()).isTrue();
		assertThat(draws).hasValue(1);
	}

	@Test
	void excludedEventSkipsTransportAndAfterSend() {
		List<SendResult> seen = new ArrayList<>();

		SendResult result = client(
			(BeforeSendHook) e -> null,
			(AfterSendHook) (e, r) -> seen.add(r))
			.sendEvent(ErrorEvent.fromMessage("boom"));

		assertThat(result.status()).isEqualTo(SendResult.Status.EXCLUDED);
		assertThat(seen).isEmpty();
		verifyNoInteractions(transport);
		assertThat(lastEvent.lastEventId()).isNull();
	}

	@Test
	void modifiedEventIsDeliveredAndPassedToAfterSend() {
		ErrorEvent original = ErrorEvent.fromMessage("card 4111-1111");
		List<ErrorEvent> afterEvents = new ArrayList<>();
		List<SendResult> afterResults = new ArrayList<>();
		BiConsumer<ErrorEvent, SendResult> after = (e, r) -> {
			afterEvents.add(e);
			afterResults.add(r);
		};

		SendResult result = client(
			(BeforeSendHook) e -> e.toBuilder().message("card [redacted]").build(),
			after)
			.sendEvent(original);

		assertThat(afterEvents).singleElement()
			.satisfies(e -> assertThat(e.message()).isEqualTo("card [redacted]"));
		assertThat(afterResults).containsExactly(result);
		verify(transport).post(
			argThat(batch -> "card [redacted]".equals(batch.get(0).get("message"))),
			anyInt());
	}

	@Test
	void failedDeliveryIsReturnedAndSeenByAfterSend() {
		SendResult failed = SendResult.failed(DeliveryFailure.requestFailure("HTTP 503"));
		doReturn(failed).when(transport).post(anyList(), anyInt());
		List<SendResult> seen = new ArrayList<>();

		SendResult result = client(null, (AfterSendHook) (e, r) -> seen.add(r)).sendEvent(ErrorEvent.fromMessage("x"));

		assertThat(result).isSameAs(failed);
		assertThat(seen).containsExactly(failed);
		assertThat(lastEvent.lastEventId()).isNull();
	}

	@Test
	void transportExceptionIsReturnedAsFailureAndSeenByAfterSend() {
		doThrow(new IllegalStateException("connection reset")).when(transport).post(anyList(), anyInt());
		List<SendResult> seen = new ArrayList<>();

		SendResult result = client(null, (AfterSendHook) (e, r) -> seen.add(r)).sendEvent(ErrorEvent.fromMessage("x"));

		assertThat(result.status()).isEqualTo(SendResult.Status.FAILED);
		assertThat(result.failure().cause()).hasMessage("connection reset");
		assertThat(seen).containsExactly(result);
	}

	@Test
	void fireAndForgetReturnsWithoutConfirmation() {
		ErrorEvent event = ErrorEvent.fromMessage("boom");

		SendResult result = client(null, null)
			.sendEvent(event, SendOptions.defaults().withCompletionMode(CompletionMode.NONE));

		assertThat(result).isEqualTo(SendResult.acceptedWithoutConfirmation());
		verify(asyncSender).send(argThat(p -> event.eventId().equals(p.get("event_id"))));
		verifyNoInteractions(transport);
	}

	@Test
	void retriesOptionReachesTransport() {
		client(null, null).sendEvent(ErrorEvent.fromMessage("boom"), SendOptions.defaults().withRequestRetries(0));

		verify(transport).post(anyList(), eq(0));
	}

	@Test
	void retiredAsyncModeIsRejectedAfterHooks() {
		properties.setCompletionMode(CompletionMode.ASYNC);
		List<String> calls = new ArrayList<>();

		assertThatThrownBy(() -> client(
			(BeforeSendHook) e -> { calls.add("before"); return e; },
			(AfterSendHook) (e, r) -> calls.add("after"))
			.sendEvent(ErrorEvent.fromMessage("boom")))
			.isInstanceOf(ReporterConfigurationException.class)
			.hasMessageContaining("not supported anymore");

		assertThat(calls).containsExactly("before");
		verifyNoInteractions(transport, asyncSender);
	}

	@Test
	void afterSendExceptionPropagatesAfterDelivery() {
		ErrorReporterClient client = client(null, (AfterSendHook) (e, r) -> {
			throw new IllegalStateException("audit store down");
		});

		assertThatThrownBy(() -> client.sendEvent(ErrorEvent.fromMessage("boom")))
			.isInstanceOf(IllegalStateException.class)
			.hasMessage("audit store down");
		verify(transport).post(anyList(), anyInt());
	}

	@Test
	void invalidSampleRateIsAConfigurationError() {
		assertThatThrownBy(() -> client(null, null)
			.sendEvent(ErrorEvent.fromMessage("boom"), SendOptions.defaults().withSampleRate(1.5)))
			.isInstanceOf(ReporterConfigurationException.class);
		verifyNoInteractions(transport);
	}

	@Test
	void renderEventProducesPayloadWithoutSending() {
		ErrorEvent event = ErrorEvent.fromMessage("boom");

		Map<String, Object> payload = client(null, null).renderEvent(event);

		assertThat(payload).containsEntry("event_id", event.eventId()).containsEntry("message", "boom");
		verifyNoInteractions(transport, asyncSender);
	}
}

package com.obsinity.errors.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.obsinity.errors.dispatch.EventDispatcher;
import com.obsinity.errors.dispatch.LastEventTracker;
import com.obsinity.errors.dispatch.SendFailureLogger;
import com.obsinity.errors.processor.ErrorReporterClient;
import com.obsinity.errors.processor.EventRenderer;
import com.obsinity.errors.processor.EventSampler;
import com.obsinity.errors.processor.JacksonPayloadEncoder;
import com.obsinity.errors.processor.PayloadEncoder;
import com.obsinity.errors.processor.PayloadSanitizer;
import com.obsinity.errors.receivers.AfterSendHook;
import com.obsinity.errors.receivers.BeforeSendHook;
import com.obsinity.errors.receivers.HookInvoker;
import com.obsinity.errors.transport.AsyncEventSender;
import com.obsinity.errors.transport.ExecutorAsyncEventSender;
import com.obsinity.errors.transport.LoggingTransport;
import com.obsinity.errors.transport.Transport;

/**
 * Wires the error-event pipeline. Every collaborator backs off when the application defines its own bean; a real
 * network {@link Transport} is expected to replace the logging default.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableConfigurationProperties(ErrorReporterProperties.class)
public class AutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	PayloadEncoder obsinityErrorsPayloadEncoder(ObjectProvider<ObjectMapper> mapper) {
		return new JacksonPayloadEncoder(mapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	EventRenderer obsinityErrorsEventRenderer(PayloadEncoder encoder) {
		return new EventRenderer(new PayloadSanitizer(encoder));
	}

	@Bean
	@ConditionalOnMissingBean
	EventSampler obsinityErrorsEventSampler() {
		return new EventSampler();
	}

	/** Hook beans win over the {@code before-send}/{@code after-send} properties. Validated here, at startup. */
	@Bean
	@ConditionalOnMissingBean
	HookInvoker obsinityErrorsHookInvoker(
		ErrorReporterProperties properties,
		ObjectProvider<BeforeSendHook> beforeSend,
		ObjectProvider<AfterSendHook> afterSend) {
		BeforeSendHook beforeBean = beforeSend.getIfUnique();
		AfterSendHook afterBean = afterSend.getIfUnique();
		return new HookInvoker(
			beforeBean != null ? beforeBean : properties.getBeforeSend(),
			afterBean != null ? afterBean : properties.getAfterSend());
	}

	@Bean
	@ConditionalOnMissingBean
	Transport obsinityErrorsTransport(ObjectProvider<ObjectMapper> mapper) {
		return new LoggingTransport(mapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	AsyncEventSender obsinityErrorsAsyncSender(Transport transport, ErrorReporterProperties properties) {
		return new ExecutorAsyncEventSender(transport, properties.getRequestRetries());
	}

	@Bean
	@ConditionalOnMissingBean
	LastEventTracker obsinityErrorsLastEventTracker() {
		return new LastEventTracker();
	}

	@Bean
	@ConditionalOnMissingBean
	EventDispatcher obsinityErrorsEventDispatcher(
		EventRenderer renderer,
		Transport transport,
		AsyncEventSender asyncSender,
		LastEventTracker lastEvent,
		ErrorReporterProperties properties) {
		return new EventDispatcher(renderer, transport, asyncSender, lastEvent,
			new SendFailureLogger(properties.getLogLevel()));
	}

	@Bean
	@ConditionalOnMissingBean
	ErrorReporterClient errorReporterClient(
		ErrorReporterProperties properties,
		EventSampler sampler,
		HookInvoker hooks,
		EventRenderer renderer,
		EventDispatcher dispatcher,
		LastEventTracker lastEvent) {
		return new ErrorReporterClient(properties, sampler, hooks, renderer, dispatcher, lastEvent);
	}
}

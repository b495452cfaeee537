package com.obsinity.errors.transport;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.obsinity.errors.model.SendResult;

/**
 * Fire-and-forget sender: each payload is posted through the {@link Transport} on a background daemon thread. The
 * outcome is only logged; nobody waits for it.
 */
public class ExecutorAsyncEventSender implements AsyncEventSender, DisposableBean {

	private static final Logger log = LoggerFactory.getLogger(ExecutorAsyncEventSender.class);

	private final Transport transport;
	private final int retries;
	private final ExecutorService executor;

	public ExecutorAsyncEventSender(Transport transport, int retries) {
		this(transport, retries, Executors.newSingleThreadExecutor(threadFactory()));
	}

	public ExecutorAsyncEventSender(Transport transport, int retries, ExecutorService executor) {
		this.transport = Objects.requireNonNull(transport, "transport");
		this.retries = retries;
		this.executor = Objects.requireNonNull(executor, "executor");
	}

	@Override
	public void send(Map<String, Object> payload) {
		try {
			executor.execute(() -> deliver(payload));
		} catch (RejectedExecutionException e) {
			log.warn("Dropping error event {}: sender is shut down", payload.get("event_id"));
		}
	}

	private void deliver(Map<String, Object> payload) {
		try {
			SendResult result = transport.post(List.of(payload), retries);
			log.debug("async error-event delivery eventId={} result={}", payload.get("event_id"), result);
		} catch (RuntimeException e) {
			log.warn("async error-event delivery failed eventId={}", payload.get("event_id"), e);
		}
	}

	@Override
	public void destroy() throws InterruptedException {
		executor.shutdown();
		if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
			log.warn("Error-event sender did not drain within 5s; {} task(s) dropped", executor.shutdownNow().size());
		}
	}

	private static CustomizableThreadFactory threadFactory() {
		CustomizableThreadFactory f = new CustomizableThreadFactory("obsinity-errors-sender-");
		f.setDaemon(true);
		return f;
	}
}

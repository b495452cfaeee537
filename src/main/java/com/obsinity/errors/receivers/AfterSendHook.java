package com.obsinity.errors.receivers;

import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;

/**
 * Observes every event that reached the dispatch stage, together with its result. Not called for unsampled or
 * excluded events. Exceptions thrown here propagate to the caller of
 * {@link com.obsinity.errors.processor.ErrorReporterClient#sendEvent}.
 */
@FunctionalInterface
public interface AfterSendHook {
	void afterSend(ErrorEvent event, SendResult result);
}

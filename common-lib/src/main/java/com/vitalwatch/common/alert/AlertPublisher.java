package com.vitalwatch.common.alert;

import com.vitalwatch.common.model.CycleResult;

/**
 * Hands a finished {@link CycleResult} to whatever renders it (logs, chat webhook, pager).
 *
 * <p>Current implementation: {@code RestAlertPublisher} in drift-detector, which posts the
 * result to notification-service.
 *
 * <p>Every cycle is published, including offline and store-failure cycles; the sink decides
 * what is worth surfacing. Implementations MUST be non-blocking and must not throw: a
 * delivery failure never affects the cycle that produced the result.
 */
public interface AlertPublisher {

    /**
     * @param result the completed cycle result; never null
     */
    void publish(CycleResult result);
}

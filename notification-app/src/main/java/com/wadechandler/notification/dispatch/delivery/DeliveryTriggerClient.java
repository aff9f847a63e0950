package com.wadechandler.notification.dispatch.delivery;

/**
 * Hands a notification to the external delivery service.
 */
public interface DeliveryTriggerClient {

    /**
     * @return the transaction id assigned by the delivery service
     * @throws com.wadechandler.notification.dispatch.exception.DeliveryTriggerException on any failure,
     *         including timeouts and responses without a transaction id
     */
    String trigger(TriggerRequest request);
}

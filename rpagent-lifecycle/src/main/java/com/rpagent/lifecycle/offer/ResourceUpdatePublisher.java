package com.rpagent.lifecycle.offer;

/**
 * Announces capacity changes upstream so outstanding offers are rescinded and reissued.
 * Called once per applied operation, after the operation is durable and its instance runs.
 */
public interface ResourceUpdatePublisher {

    void publish(OfferImpact impact);
}

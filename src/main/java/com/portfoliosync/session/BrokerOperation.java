package com.portfoliosync.session;

import com.portfoliosync.broker.BrokerClient;

/** A unit of broker work run by {@link RetryOrchestrator} against an authenticated client. */
@FunctionalInterface
public interface BrokerOperation<T> {

    T execute(BrokerClient client);
}

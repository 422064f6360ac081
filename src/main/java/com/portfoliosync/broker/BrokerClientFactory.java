package com.portfoliosync.broker;

/** Creates unauthenticated {@link BrokerClient} instances for an API key. */
@FunctionalInterface
public interface BrokerClientFactory {

    BrokerClient create(String apiKey);
}

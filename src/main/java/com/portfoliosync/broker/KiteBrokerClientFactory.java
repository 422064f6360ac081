package com.portfoliosync.broker;

import com.portfoliosync.broker.mapper.KiteHoldingMapper;
import com.portfoliosync.broker.mapper.KiteMarginMapper;
import com.portfoliosync.broker.mapper.KitePositionMapper;
import com.portfoliosync.config.KiteConfig;
import com.zerodhatech.kiteconnect.KiteConnect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Builds a fresh {@link KiteConnect} per API key and wraps it in a {@link KiteBrokerClient}. */
@Component
public class KiteBrokerClientFactory implements BrokerClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KiteBrokerClientFactory.class);

    private final RestClient kiteRestClient;
    private final KiteErrorTranslator errorTranslator;
    private final KiteHoldingMapper holdingMapper;
    private final KitePositionMapper positionMapper;
    private final KiteMarginMapper marginMapper;

    public KiteBrokerClientFactory(
            @Qualifier("kiteRestClient") RestClient kiteRestClient,
            KiteErrorTranslator errorTranslator,
            KiteHoldingMapper holdingMapper,
            KitePositionMapper positionMapper,
            KiteMarginMapper marginMapper) {
        this.kiteRestClient = kiteRestClient;
        this.errorTranslator = errorTranslator;
        this.holdingMapper = holdingMapper;
        this.positionMapper = positionMapper;
        this.marginMapper = marginMapper;
    }

    @Override
    public BrokerClient create(String apiKey) {
        log.info("Creating Kite client for API key {}", KiteConfig.mask(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        kiteConnect.setSessionExpiryHook(() -> log.warn(
                "Kite session expired for API key {} (detected by SDK SessionExpiryHook)", KiteConfig.mask(apiKey)));
        return new KiteBrokerClient(
                apiKey, kiteConnect, kiteRestClient, errorTranslator, holdingMapper, positionMapper, marginMapper);
    }
}

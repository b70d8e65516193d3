package com.optionscalper.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and the shared {@link KiteConnect} client for live trading.
 *
 * <p>Binds to {@code kite.*}. The access token is obtained outside this process (credential
 * storage is not handled here) and supplied through configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    private String apiSecret;

    /** Session access token for the day. */
    private String accessToken;

    /**
     * Shared SDK client. Created in both trading modes: paper trading still streams live prices
     * and loads instruments through Kite when credentials are configured.
     */
    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (accessToken != null && !accessToken.isBlank()) {
            kiteConnect.setAccessToken(accessToken);
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
        return kiteConnect;
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}

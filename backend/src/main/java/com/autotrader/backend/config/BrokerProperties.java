package com.autotrader.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "broker")
@Validated
@Data
public class BrokerProperties {

    private boolean enabled = true;

    @NotBlank
    private String host = "127.0.0.1";

    @Min(1)
    private int port = 7497;

    private int clientId = 1;

    @Min(1)
    private int connectTimeoutSeconds = 10;

    @Min(1)
    private int requestTimeoutSeconds = 8;

    @Min(0)
    private int reconnectCooldownSeconds = 10;

    @Min(0)
    private long openOrdersTtlMillis = 2000;

    @Min(0)
    private int startupWaitSeconds = 5;

    /**
     * 1 = live, 2 = frozen, 3 = delayed, 4 = delayed-frozen.
     */
    @Min(1)
    private int marketDataType = 3;
}

package com.autotrader.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "decision")
@Validated
@Data
public class DecisionServiceProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(0)
    private int maxRetries = 2;

    private long retryBackoffMillis = 500;
}

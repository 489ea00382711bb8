package com.autotrader.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI autoTraderOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AutoTrader Dashboard API")
                        .description("Read-only views of the trading loop plus runtime config editing")
                        .version("1.0"));
    }
}

package com.autotrader.backend;

import com.autotrader.backend.config.BrokerProperties;
import com.autotrader.backend.config.DecisionServiceProperties;
import com.autotrader.backend.config.TraderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({TraderProperties.class, BrokerProperties.class, DecisionServiceProperties.class})
public class AutoTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoTraderApplication.class, args);
    }
}

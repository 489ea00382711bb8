package com.autotrader.backend.db;

import com.autotrader.backend.model.EventLog;
import com.autotrader.backend.repository.EventLogRepository;
import com.autotrader.backend.repository.LiveStatusRepository;
import com.autotrader.backend.repository.RuntimeConfigRepository;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(properties = {
        "trader.scheduler.enabled=false",
        "broker.enabled=false"
})
class FlywayMigrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("autotrader_test")
            .withUsername("autotrader")
            .withPassword("autotrader");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.flyway.enabled", () -> "true");
    }

    @Autowired
    private Flyway flyway;

    @Autowired
    private RuntimeConfigRepository runtimeConfigRepository;

    @Autowired
    private LiveStatusRepository liveStatusRepository;

    @Autowired
    private EventLogRepository eventLogRepository;

    @Test
    void migrationsApplyAndSeedSingletonRows() {
        assertThat(flyway.info().applied()).isNotEmpty();
        assertThat(runtimeConfigRepository.findById(1L)).isPresent();
        assertThat(liveStatusRepository.findById(1L)).isPresent();
    }

    @Test
    void eventsGetGeneratedIds() {
        EventLog saved = eventLogRepository.save(EventLog.builder()
                .createdAt(Instant.now())
                .level("INFO")
                .symbol("SYSTEM")
                .step("Test")
                .message("hello")
                .build());

        assertThat(saved.getId()).isNotNull();
        assertThat(eventLogRepository.findTopByOrderByIdDesc()).isPresent();
    }
}

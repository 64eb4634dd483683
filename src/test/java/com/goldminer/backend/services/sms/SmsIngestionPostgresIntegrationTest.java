package com.goldminer.backend.services.sms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.goldminer.backend.dto.sms.IngestionReport;
import com.goldminer.backend.dto.sms.RawMessage;
import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.StoreMode;
import com.goldminer.backend.repositories.SmsTransactionRepository;

/**
 * Runs against the Flyway schema on a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class SmsIngestionPostgresIntegrationTest {

        @Container
        static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
                        .withDatabaseName("goldminer_test")
                        .withUsername("goldminer")
                        .withPassword("goldminer");

        @DynamicPropertySource
        static void registerProperties(DynamicPropertyRegistry registry) {
                registry.add("spring.flyway.enabled", () -> "true");
                registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");

                registry.add("spring.datasource.url", postgres::getJdbcUrl);
                registry.add("spring.datasource.username", postgres::getUsername);
                registry.add("spring.datasource.password", postgres::getPassword);
                registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
        }

        @Autowired
        private SmsIngestionService ingestionService;

        @Autowired
        private SmsTransactionRepository repository;

        @Test
        void ingestsIntoMigratedSchemaIdempotently() {
                repository.deleteAll();
                List<RawMessage> batch = List.of(
                                RawMessage.of("Your HSBC card ending 1234 was charged 250.50 EGP at Amazon Store on 15/11/2024"),
                                RawMessage.of("تم خصم 1,250.00 جنيه من بطاقتك المنتهية بـ 5678 لدى كارفور بتاريخ 14/11/2024"));
                LocalDateTime ingestedAt = LocalDateTime.of(2024, 12, 1, 8, 0);

                IngestionReport first = ingestionService.ingest(batch, StoreMode.SKIP, ingestedAt);
                IngestionReport second = ingestionService.ingest(batch, StoreMode.UPSERT, ingestedAt);

                assertEquals(2, first.store().inserted());
                assertEquals(2, second.store().updated());
                assertEquals(2, repository.count());

                SmsTransaction hsbc = repository.findByContentHash(first.records().get(0).getContentHash()).orElseThrow();
                assertEquals("1234", hsbc.getCardSuffix());
                assertTrue(hsbc.getUpdatedAt() != null);
        }
}

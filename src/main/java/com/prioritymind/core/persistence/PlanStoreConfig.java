package com.prioritymind.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.config.PrioritymindProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Chooses the {@link PlanStore}: SQLite-backed when
 * {@code prioritymind.store.sqlite-path} is set, in-memory otherwise.
 * Also provides the system {@link Clock} used for recency and staleness.
 */
@Configuration
public class PlanStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PlanStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnExpression("'${prioritymind.store.sqlite-path:}' != ''")
    public PlanStore jdbcPlanStore(PrioritymindProperties properties, ObjectMapper objectMapper) throws IOException {
        Path dbPath = Path.of(properties.getStore().getSqlitePath()).toAbsolutePath();
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        log.info("Configuring SQLite plan store at {}", dbPath);

        var dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath);

        var store = new JdbcPlanStore(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)), objectMapper);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(PlanStore.class)
    public PlanStore inMemoryPlanStore() {
        log.info("No SQLite path configured; using in-memory plan store (state will not persist across restarts)");
        return new InMemoryPlanStore();
    }
}

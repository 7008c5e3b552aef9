package com.routewise.core.recording;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Chooses the {@link ExecutionRecordStore}: JDBC when
 * {@code routewise.recording.jdbc.url} is set, otherwise an in-memory store
 * that does not survive restarts.
 */
@Configuration
public class RecordStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RecordStoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "routewise.recording.jdbc", name = "url")
    public HikariDataSource recordDataSource(RecordingProperties properties) {
        RecordingProperties.Jdbc jdbc = properties.getJdbc();
        var config = new HikariConfig();
        config.setPoolName("routewise-records");
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "routewise.recording.jdbc", name = "url")
    public ExecutionRecordStore jdbcExecutionRecordStore(DataSource recordDataSource) throws Exception {
        log.info("Configuring JDBC execution record store");
        var store = new JdbcExecutionRecordStore(recordDataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionRecordStore.class)
    public ExecutionRecordStore inMemoryExecutionRecordStore(RecordingProperties properties) {
        log.info("No record database configured; using in-memory execution record store (records will not persist across restarts)");
        return new InMemoryExecutionRecordStore(properties.getInMemoryCapacity());
    }
}

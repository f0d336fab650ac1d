package com.lorekeeper.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link MemoryStorage} bean.
 * <p>
 * When {@code lorekeeper.storage.jdbc.url} is set, a {@link JdbcMemoryStorage} persists
 * Canon, Buffer, Disputes and Task Memory to the database. Otherwise an
 * {@link InMemoryMemoryStorage} is used -- suitable for development and testing but not
 * durable across restarts.
 */
@Configuration
public class MemoryStorageConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageConfig.class);

    /**
     * JDBC-backed storage, activated when a JDBC url is configured.
     * Creates the required tables on startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "lorekeeper.storage.jdbc", name = "url")
    public MemoryStorage jdbcMemoryStorage(StorageProperties properties) {
        var jdbc = properties.getJdbc();
        log.info("Configuring JDBC memory storage at {}", jdbc.getUrl());
        DataSource dataSource = DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
        var storage = new JdbcMemoryStorage(dataSource);
        storage.createTables();
        return storage;
    }

    /**
     * In-memory fallback, used when no JDBC url is configured.
     * State is lost on application restart.
     */
    @Bean
    @ConditionalOnMissingBean(MemoryStorage.class)
    public MemoryStorage inMemoryMemoryStorage() {
        log.info("No JDBC url configured; using in-memory storage (memory will not persist across restarts)");
        return new InMemoryMemoryStorage();
    }
}

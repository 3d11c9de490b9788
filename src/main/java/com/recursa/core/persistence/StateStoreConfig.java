package com.recursa.core.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link StateStore} bean.
 * <p>
 * {@code recursa.store.type=jdbc} persists to PostgreSQL through a HikariCP pool,
 * {@code memory} keeps checkpoints in a LangGraph4j {@link MemorySaver} (not
 * durable across restarts), and anything else falls back to one JSON file per
 * task under {@code recursa.store.directory}.
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "recursa.store.type", havingValue = "jdbc")
    public HikariDataSource stateStoreDataSource(StoreProperties properties) {
        var jdbc = properties.getJdbc();
        var config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setPoolName("recursa-state");
        return new HikariDataSource(config);
    }

    /**
     * JDBC-backed store, activated by {@code recursa.store.type=jdbc}.
     * Creates the required table on startup.
     */
    @Bean
    @ConditionalOnProperty(name = "recursa.store.type", havingValue = "jdbc")
    public StateStore jdbcStateStore(HikariDataSource stateStoreDataSource) throws Exception {
        log.info("Configuring JDBC state store (PostgreSQL)");
        var store = new JdbcStateStore(stateStoreDataSource);
        store.createTables();
        return store;
    }

    /**
     * In-memory store, activated by {@code recursa.store.type=memory}.
     * State is lost on application restart.
     */
    @Bean
    @ConditionalOnProperty(name = "recursa.store.type", havingValue = "memory")
    public StateStore memoryStateStore() {
        log.info("Using in-memory checkpoint state store (state will not persist across restarts)");
        return new CheckpointStateStore(new MemorySaver());
    }

    /**
     * File-backed default store.
     */
    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore fileStateStore(StoreProperties properties) {
        Path directory = Path.of(properties.getDirectory());
        log.info("Using file state store at {}", directory);
        return new FileStateStore(directory);
    }
}

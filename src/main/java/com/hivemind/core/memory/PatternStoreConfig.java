package com.hivemind.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.config.HivemindProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link PatternStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), a
 * {@link JdbcPatternStore} is created and its tables are ensured. Otherwise the
 * in-memory store is used, which does not survive restarts.
 */
@Configuration
public class PatternStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PatternStoreConfig.class);

    @Bean
    public PatternStore patternStore(ObjectProvider<DataSource> dataSource,
                                     ObjectProvider<ObjectMapper> objectMapper,
                                     HivemindProperties properties) throws Exception {
        ObjectMapper mapper = objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC pattern store");
            var store = new JdbcPatternStore(ds, mapper,
                    properties.getHistoryLimit(), properties.getSimilarPatternLimit());
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory pattern store (memory will not persist across restarts)");
        return new InMemoryPatternStore(mapper, properties.getHistoryLimit(), properties.getSimilarPatternLimit());
    }
}

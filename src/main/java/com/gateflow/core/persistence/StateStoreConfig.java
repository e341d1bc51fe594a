package com.gateflow.core.persistence;

import com.gateflow.core.GateflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link StateStore} bean.
 * <p>
 * With {@code gateflow.state.provider=jdbc} a {@link JdbcStateStore} is created against the
 * configured PostgreSQL database. Otherwise records are kept as JSON files under
 * {@code gateflow.state.directory}.
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "gateflow.state", name = "provider", havingValue = "jdbc")
    public StateStore jdbcStateStore(GateflowProperties properties) throws Exception {
        var jdbc = properties.getState().getJdbc();
        log.info("Configuring JDBC state store at {}", jdbc.getUrl());
        var dataSource = DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
        var store = new JdbcStateStore(dataSource, StateCodec.objectMapper());
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore fileStateStore(GateflowProperties properties) {
        Path directory = Path.of(properties.getStateDirectory()).toAbsolutePath();
        log.info("Using file state store in {}", directory);
        return new FileStateStore(directory, StateCodec.objectMapper());
    }

    @Bean
    public DurableWrites durableWrites(StateStore stateStore) {
        return new DurableWrites(stateStore);
    }
}

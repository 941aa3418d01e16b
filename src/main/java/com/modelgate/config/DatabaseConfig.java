package com.modelgate.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC connection.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when {@code modelgate.database.initialize-schema} is set.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory,
                                                    GatewayProperties properties) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        if (properties.getDatabase().isInitializeSchema()) {
            populator.addScript(new ClassPathResource("schema.sql"));
        }
        initializer.setDatabasePopulator(populator);

        return initializer;
    }
}

package com.scanq.config;

import com.scanq.ScanQSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ScanQSchemaInitializerConditionalTest {

    @Configuration
    @EnableConfigurationProperties(ScanQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("scanq.database.fail-on-migration-error=false")
            .withUserConfiguration(Config.class, ScanQSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(ScanQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("scanq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(ScanQSchemaInitializer.class).isEmpty()));
    }
}

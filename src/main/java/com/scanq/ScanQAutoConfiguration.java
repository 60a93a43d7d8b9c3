package com.scanq;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scanq.cache.ResultCache;
import com.scanq.config.ScanQProperties;
import com.scanq.internal.ScanQMetrics;
import com.scanq.queue.ScanJobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.Locale;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableScheduling
@EnableConfigurationProperties(ScanQProperties.class)
public class ScanQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock scanqClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "scanqObjectMapperCustomizer")
    public Jackson2ObjectMapperBuilderCustomizer scanqObjectMapperCustomizer() {
        return builder -> builder
                .modulesToInstall(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    @ConditionalOnClass(name = "org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy")
    @ConditionalOnMissingBean(name = "scanqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer scanqHibernatePropertiesCustomizer(ScanQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                String trimmed = prefix.trim();
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // only ScanQ tables are prefixed
                                if (original.getText().toLowerCase(Locale.ROOT).startsWith("scanq_")) {
                                    return new Identifier(trimmed + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public ScanQMetrics scanqMetrics(ScanJobQueue jobQueue, ResultCache resultCache, MeterRegistry meterRegistry) {
        return new ScanQMetrics(jobQueue, resultCache, meterRegistry);
    }
}

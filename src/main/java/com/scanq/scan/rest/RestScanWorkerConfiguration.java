package com.scanq.scan.rest;

import com.scanq.config.ScanQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Registers the HTTP-backed profiling and checks workers against {@code scanq.scan.base-url}.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "scanq.scan.rest", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RestScanWorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RestScanWorkerConfiguration.class);

    @Bean
    public RestClient scanRestClient(RestClient.Builder builder, ScanQProperties properties) {
        String baseUrl = properties.getScan().getBaseUrl();
        log.info("Scan workers will call data-quality endpoints at {}", baseUrl);
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public RestScanWorker.Profiling profilingScanWorker(RestClient scanRestClient) {
        return new RestScanWorker.Profiling(scanRestClient);
    }

    @Bean
    public RestScanWorker.Checks checksScanWorker(RestClient scanRestClient) {
        return new RestScanWorker.Checks(scanRestClient);
    }
}

package com.scanq.scan;

import com.scanq.config.ScanQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a scan type to the registered {@link ScanWorker}s. {@code full} runs profiling and then
 * checks; {@code anomalies} falls back to profiling with anomaly detection when no dedicated
 * worker is registered.
 */
@Component
public class ScanDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScanDispatcher.class);

    static final String PROFILE_LEVEL_OPTION = "profile_level";
    static final String ANOMALY_DETECTION_OPTION = "anomaly_detection";

    private final ScanWorkerRegistry registry;
    private final ScanQProperties properties;

    public ScanDispatcher(ScanWorkerRegistry registry, ScanQProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    public ScanResult dispatch(ScanType scanType, ScanTarget target) throws Exception {
        return dispatch(scanType, target, properties.getScan().getTriggeredBy());
    }

    public ScanResult dispatch(ScanType scanType, ScanTarget target, String triggeredBy) throws Exception {
        if (scanType == null) {
            throw new IllegalArgumentException("Scan type must not be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("Scan target must not be null");
        }

        return switch (scanType) {
            case PROFILING -> runStep(ScanType.PROFILING, registry.require(ScanType.PROFILING), target, triggeredBy,
                    profilingOptions());
            case CHECKS -> runStep(ScanType.CHECKS, registry.require(ScanType.CHECKS), target, triggeredBy, Map.of());
            case ANOMALIES -> runAnomalies(target, triggeredBy);
            case FULL -> runFull(target, triggeredBy);
        };
    }

    private ScanResult runAnomalies(ScanTarget target, String triggeredBy) throws Exception {
        Optional<ScanWorker> dedicated = registry.find(ScanType.ANOMALIES);
        if (dedicated.isPresent()) {
            return runStep(ScanType.ANOMALIES, dedicated.get(), target, triggeredBy, Map.of());
        }
        Map<String, Object> options = new LinkedHashMap<>(profilingOptions());
        options.put(ANOMALY_DETECTION_OPTION, true);
        return runStep(ScanType.ANOMALIES, registry.require(ScanType.PROFILING), target, triggeredBy, options);
    }

    private ScanResult runFull(ScanTarget target, String triggeredBy) throws Exception {
        ScanResult profiling = runStep(ScanType.PROFILING, registry.require(ScanType.PROFILING), target, triggeredBy,
                profilingOptions());
        ScanResult checks = runStep(ScanType.CHECKS, registry.require(ScanType.CHECKS), target, triggeredBy,
                Map.of());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("profilingRunId", profiling.runId());
        details.put("checksRunId", checks.runId());
        details.put("steps", List.of(ScanType.PROFILING.value(), ScanType.CHECKS.value()));
        return new ScanResult(true, checks.runId(), null, details);
    }

    private ScanResult runStep(ScanType stepType, ScanWorker worker, ScanTarget target, String triggeredBy,
            Map<String, Object> options) throws Exception {
        log.info("Executing {} scan for {}", stepType.value(), target.qualifiedName());
        ScanResult result = worker.run(new ScanRequest(target, triggeredBy, options));
        if (result == null || !result.success()) {
            String error = result == null ? null : result.error();
            log.warn("{} scan for {} reported failure: {}", stepType.value(), target.qualifiedName(), error);
            throw new ScanFailedException(stepType, target, error);
        }
        log.debug("{} scan for {} succeeded with run {}", stepType.value(), target.qualifiedName(), result.runId());
        return result;
    }

    private Map<String, Object> profilingOptions() {
        return Map.of(PROFILE_LEVEL_OPTION, properties.getScan().getProfileLevel());
    }
}

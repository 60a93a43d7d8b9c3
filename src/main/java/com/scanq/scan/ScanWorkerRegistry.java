package com.scanq.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ScanWorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScanWorkerRegistry.class);

    private final Map<ScanType, ScanWorker> workersByType;

    public ScanWorkerRegistry(List<ScanWorker> workers) {
        Map<ScanType, ScanWorker> registrations = new EnumMap<>(ScanType.class);
        for (ScanWorker worker : workers) {
            register(registrations, worker);
        }
        this.workersByType = registrations;
        log.info("Scan worker registry initialized with {} workers: {}", registrations.size(), registrations.keySet());
    }

    public Optional<ScanWorker> find(ScanType scanType) {
        return Optional.ofNullable(workersByType.get(scanType));
    }

    public ScanWorker require(ScanType scanType) {
        ScanWorker worker = workersByType.get(scanType);
        if (worker == null) {
            throw new IllegalStateException("No scan worker registered for scan type '" + scanType.value() + "'");
        }
        return worker;
    }

    private void register(Map<ScanType, ScanWorker> registrations, ScanWorker worker) {
        String source = ClassUtils.getUserClass(worker).getName();
        ScanType scanType = worker.getScanType();
        if (scanType == null) {
            throw new IllegalStateException("Scan worker " + source + " must declare a scan type");
        }
        if (scanType == ScanType.FULL) {
            throw new IllegalStateException("Scan worker " + source
                    + " cannot handle 'full' scans; register profiling and checks workers instead");
        }
        ScanWorker existing = registrations.putIfAbsent(scanType, worker);
        if (existing != null) {
            throw new IllegalStateException("Duplicate scan type '" + scanType.value() + "' detected while registering "
                    + source + ". Each scan type must be unique.");
        }
    }
}

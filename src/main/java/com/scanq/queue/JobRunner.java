package com.scanq.queue;

import com.scanq.scan.ScanResult;

@FunctionalInterface
public interface JobRunner {

    ScanResult run(ScanJob job) throws Exception;
}

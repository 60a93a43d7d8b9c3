package com.scanq.scan.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.scanq.scan.ScanRequest;
import com.scanq.scan.ScanResult;
import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;
import com.scanq.scan.ScanWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ScanWorker} that delegates to a data-quality HTTP endpoint. The endpoint answers with
 * {@code {success, data: {run_id}, error}}; error statuses are read the same way so the
 * endpoint's own error message reaches the caller.
 */
public abstract class RestScanWorker implements ScanWorker {

    private static final Logger log = LoggerFactory.getLogger(RestScanWorker.class);

    private final RestClient restClient;
    private final String path;

    protected RestScanWorker(RestClient restClient, String path) {
        this.restClient = restClient;
        this.path = path;
    }

    @Override
    public ScanResult run(ScanRequest request) {
        ScanTarget target = request.target();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("database", target.database());
        body.put("schema", target.schema());
        body.put("table", target.table());
        body.putAll(request.options());
        body.put("triggered_by", request.triggeredBy());

        log.debug("POST {} for {} scan of {}", path, getScanType().value(), target.qualifiedName());
        JsonNode response = restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    // body is parsed below
                })
                .body(JsonNode.class);
        return toResult(response);
    }

    private ScanResult toResult(JsonNode response) {
        if (response == null || response.isNull()) {
            return ScanResult.failed("Empty response from " + path);
        }
        if (!response.path("success").asBoolean(false)) {
            String error = response.path("error").asText(null);
            return ScanResult.failed(error != null ? error : "Scan endpoint " + path + " reported failure");
        }
        JsonNode data = response.path("data");
        String runId = firstText(data, "run_id", "runId");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("endpoint", path);
        if (data.has("message")) {
            details.put("message", data.get("message").asText());
        } else if (response.has("message")) {
            details.put("message", response.get("message").asText());
        }
        return new ScanResult(true, runId, null, details);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * Calls {@code POST /api/dq/run-profiling}.
     */
    public static class Profiling extends RestScanWorker {

        public static final String PATH = "/api/dq/run-profiling";

        public Profiling(RestClient restClient) {
            super(restClient, PATH);
        }

        @Override
        public ScanType getScanType() {
            return ScanType.PROFILING;
        }
    }

    /**
     * Calls {@code POST /api/dq/run-custom-scan}.
     */
    public static class Checks extends RestScanWorker {

        public static final String PATH = "/api/dq/run-custom-scan";

        public Checks(RestClient restClient) {
            super(restClient, PATH);
        }

        @Override
        public ScanType getScanType() {
            return ScanType.CHECKS;
        }
    }
}

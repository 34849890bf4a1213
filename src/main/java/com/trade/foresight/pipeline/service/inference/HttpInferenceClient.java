package com.trade.foresight.pipeline.service.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.InferenceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client of the model server.
 * <pre>
 * POST {base}/predict?model_name=lightgbm&version=0   body: [[f1..fn], ...]  -> {"predictions": [[..], ..]}
 * POST {base}/is_model_available                     body: {"model_name", "version"} -> {"available": bool}
 * </pre>
 * Versions are sent 0-indexed (v1 -> 0). Requests are split into chunks of
 * {@code inference-chunk} rows; each chunk goes through the "inference" Retry.
 */
@Slf4j
@Component
public class HttpInferenceClient implements InferenceClient {

    private final RestTemplate rest;
    private final String baseUrl;
    private final int chunkSize;
    private final Retry retry;

    @Autowired
    public HttpInferenceClient(@Qualifier("inferenceRestTemplate") RestTemplate rest,
                               ForesightProperties props,
                               RetryRegistry retryRegistry) {
        this(rest, props.getInference().getBaseUrl(), props.getConsumer().getInferenceChunk(),
                retryRegistry.retry("inference"));
    }

    public HttpInferenceClient(RestTemplate rest, String baseUrl, int chunkSize, Retry retry) {
        this.rest = rest;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.chunkSize = chunkSize;
        this.retry = retry;
        this.retry.getEventPublisher().onRetry(e -> log.warn("Prediction request failed (attempt {}): {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable() == null ? "?" : e.getLastThrowable().toString()));
    }

    /** v1 -> 0, v2 -> 1, "3" -> 2 */
    public static int serverVersion(String version) {
        String v = version.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("v")) v = v.substring(1);
        try {
            return Integer.parseInt(v) - 1;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported model version: " + version, e);
        }
    }

    @Override
    public List<List<Double>> predict(List<double[]> features, String modelName, String version) {
        List<List<Double>> out = new ArrayList<>(features.size());
        if (features.isEmpty()) return out;
        final URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/predict")
                .queryParam("model_name", modelName)
                .queryParam("version", serverVersion(version))
                .build()
                .toUri();

        for (int i = 0; i < features.size(); i += chunkSize) {
            final List<double[]> chunk = features.subList(i, Math.min(i + chunkSize, features.size()));
            final HttpEntity<List<double[]>> body = new HttpEntity<>(chunk, jsonHeaders());
            List<List<Double>> preds;
            try {
                preds = retry.executeSupplier(() -> parsePredictions(rest.postForObject(uri, body, JsonNode.class)));
            } catch (RuntimeException e) {
                log.error("Prediction request failed after retries: {}", e.toString());
                throw e instanceof InferenceException ? e
                        : new InferenceException("Prediction failed for " + modelName + "/" + version + ": " + e.getMessage(), e);
            }
            if (preds.size() != chunk.size()) {
                throw new InferenceException("Server returned " + preds.size() + " predictions for " + chunk.size() + " rows");
            }
            out.addAll(preds);
            log.info("Got predictions for batch {} ({} samples)", i / chunkSize + 1, chunk.size());
        }
        return out;
    }

    @Override
    public boolean isModelAvailable(String modelName, String version) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model_name", modelName);
        body.put("version", serverVersion(version));
        try {
            JsonNode r = rest.postForObject(URI.create(baseUrl + "/is_model_available"),
                    new HttpEntity<>(body, jsonHeaders()), JsonNode.class);
            return r != null && r.path("available").asBoolean(false);
        } catch (RestClientException e) {
            log.warn("Error checking model availability: {}", e.getMessage());
            return false;
        }
    }

    /** Accepts a vector or a bare number per row. */
    static List<List<Double>> parsePredictions(JsonNode response) {
        if (response == null || !response.path("predictions").isArray()) {
            throw new InferenceException("Response has no predictions array");
        }
        List<List<Double>> out = new ArrayList<>();
        for (JsonNode row : response.get("predictions")) {
            List<Double> v = new ArrayList<>();
            if (row.isArray()) {
                row.forEach(n -> v.add(n.asDouble()));
            } else {
                v.add(row.asDouble());
            }
            out.add(v);
        }
        return out;
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }
}

package com.trade.foresight.pipeline.service.inference;

import java.util.List;

/**
 * Remote model server.
 */
public interface InferenceClient {

    /**
     * One prediction vector per feature row, in request order.
     *
     * @throws com.trade.foresight.pipeline.common.exception.InferenceException when the server
     *                                                                          cannot answer after retries
     */
    List<List<Double>> predict(List<double[]> features, String modelName, String version);

    /** False when the server says no or cannot be asked. */
    boolean isModelAvailable(String modelName, String version);
}

package com.trade.foresight.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A prediction vector for one candle. The candle carries the fields used
 * when the document does not exist yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRecord {

    private PriceCandle candle;
    private List<Double> values;
}

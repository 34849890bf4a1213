package com.trade.foresight.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A scored news article, keyed by its link.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsArticlePrediction {

    private String link;
    private String title;
    private Instant date;
    private List<Double> prediction;
    private Double priceChange;   // optional
    private Integer label;        // optional
}

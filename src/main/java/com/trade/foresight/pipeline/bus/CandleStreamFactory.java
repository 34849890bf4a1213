package com.trade.foresight.pipeline.bus;

import com.trade.foresight.pipeline.model.ControlEntity;

public interface CandleStreamFactory {

    /** Opens the stream for the entity's symbol in the entity's consumer group. */
    CandleStream open(ControlEntity entity);
}

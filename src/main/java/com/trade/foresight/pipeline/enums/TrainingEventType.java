package com.trade.foresight.pipeline.enums;

public enum TrainingEventType {
    START,
    SUCCESS,
    FAILURE,
    RETRY,
    INFO
}

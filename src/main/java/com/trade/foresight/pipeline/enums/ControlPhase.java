package com.trade.foresight.pipeline.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a producer or consumer process as recorded in the control plane.
 * Commands (START, PAUSE, DELETE) are written by the controller; the worker
 * answers with the matching acknowledgement (RUNNING, PAUSED, DELETED).
 */
public enum ControlPhase {
    PENDING("pending"),
    WAIT("wait"),
    START("start"),
    RUNNING("running"),
    PAUSE("pause"),
    PAUSED("paused"),
    DELETE("delete"),
    DELETED("deleted"),
    ERROR("error"),

    /** Sentinel for "no record within the read timeout"; never stored. */
    UNKNOWN("unknown");

    private final String code;

    ControlPhase(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ControlPhase fromCode(String code) {
        if (code == null) return UNKNOWN;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (ControlPhase p : values()) {
            if (p.code.equals(c)) return p;
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return this == DELETED || this == ERROR;
    }

    /** States in which kill-all considers the entity already gone. */
    public boolean isGone() {
        return this == DELETED || this == UNKNOWN;
    }
}

package com.trade.foresight.pipeline.enums;

/**
 * Process types the job dispatcher knows how to launch.
 */
public enum JobKind {
    PRODUCER("producer"),
    CONSUMER("consumer"),
    DISPATCHER("dispatcher");

    private final String command;

    JobKind(String command) {
        this.command = command;
    }

    /** Command word understood by the application's launcher. */
    public String getCommand() {
        return command;
    }
}

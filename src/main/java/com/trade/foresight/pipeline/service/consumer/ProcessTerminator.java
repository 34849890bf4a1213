package com.trade.foresight.pipeline.service.consumer;

/**
 * Ends the current worker process.
 */
@FunctionalInterface
public interface ProcessTerminator {

    ProcessTerminator SYSTEM_EXIT = System::exit;

    void terminate(int exitCode);
}

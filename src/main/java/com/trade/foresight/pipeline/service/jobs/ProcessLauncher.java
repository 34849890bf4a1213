package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.model.JobDescriptor;

import java.io.IOException;

/**
 * Starts the OS process for a job and returns without waiting for it.
 */
public interface ProcessLauncher {

    Process launch(JobDescriptor job) throws IOException;
}

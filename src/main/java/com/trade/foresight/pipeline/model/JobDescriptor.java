package com.trade.foresight.pipeline.model;

import com.trade.foresight.pipeline.enums.JobKind;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A parsed job file: which process to start and for which entity.
 * The id is derived from the routing and the file's content hash, so
 * two deliveries of the same file map to one id.
 */
@Value
@Builder
public class JobDescriptor {

    JobKind kind;
    ControlEntity entity;
    /** Market symbol the process works on; for the producer it comes from the command's --symbol. */
    String marketSymbol;
    String jobId;
    Path source;
}

package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.enums.JobKind;
import com.trade.foresight.pipeline.model.ControlEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes job files into the watched directory. Files are written under a
 * temporary name and moved into place so the dispatcher never sees half a file.
 */
@Slf4j
@Component
public class JobSubmitter {

    private final Path jobsDir;

    @Autowired
    public JobSubmitter(ForesightProperties props) {
        this(Paths.get(props.getPaths().getJobsDir()));
    }

    public JobSubmitter(Path jobsDir) {
        this.jobsDir = jobsDir;
    }

    public Path submitProducer(String symbol) {
        return write(ControlEntity.producer(),
                JobKind.PRODUCER.getCommand() + " --symbol " + symbol);
    }

    public Path submitConsumer(ControlEntity entity) {
        return write(entity, JobKind.CONSUMER.getCommand()
                + " --crypto " + entity.getSymbol()
                + " --model " + entity.getModel()
                + " --version " + entity.getVersion());
    }

    private Path write(ControlEntity entity, String command) {
        Path target = jobsDir.resolve(entity.key() + JobDescriptorParser.SUFFIX);
        Path tmp = jobsDir.resolve("." + entity.key() + ".tmp");
        String content = "#!/bin/sh\n" + command + "\n";
        try {
            Files.createDirectories(jobsDir);
            Files.write(tmp, content.getBytes(StandardCharsets.UTF_8));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new JobDescriptorException("Cannot write job file " + target, e);
        }
        log.info("Submitted job {}", target.getFileName());
        return target;
    }
}

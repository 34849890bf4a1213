package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import com.trade.foresight.pipeline.model.JobDescriptor;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Watches the jobs directory and spawns one process per job file.
 *
 * <p>Each file is parsed, claimed by job id, then handed to the worker pool,
 * which resets a consumer's stale control record, launches the process and
 * deletes the file. Files already present at startup are drained first, and
 * the directory is drained again after a refused claim has had time to
 * expire. The dispatcher announces itself as ALL_dispatcher_main and stops on
 * DELETE.</p>
 */
@Slf4j
@Service
public class JobDispatcher {

    private final JobDescriptorParser parser;
    private final JobClaimService claims;
    private final ProcessLauncher launcher;
    private final ControlPlane control;
    private final Executor workers;
    private final Path jobsDir;
    private final long pollMillis;
    private final long claimTtlMillis;

    private volatile boolean running;
    // when a file left behind by a refused claim is looked at again, 0 for none
    private volatile long redrainAt;

    public JobDispatcher(JobDescriptorParser parser,
                         JobClaimService claims,
                         ProcessLauncher launcher,
                         ControlPlane control,
                         @Qualifier("dispatchExecutor") Executor workers,
                         ForesightProperties props) {
        this.parser = parser;
        this.claims = claims;
        this.launcher = launcher;
        this.control = control;
        this.workers = workers;
        this.jobsDir = Paths.get(props.getPaths().getJobsDir());
        this.pollMillis = props.getControl().getPollInterval().toMillis();
        this.claimTtlMillis = props.getControl().getJobClaimTtl().toMillis();
    }

    /**
     * Blocks until a DELETE is written for the dispatcher or {@link #stop()} is called.
     */
    public int run() throws IOException {
        ControlEntity self = ControlEntity.dispatcher();
        Files.createDirectories(jobsDir);
        running = true;
        control.write(self, ControlPhase.RUNNING);
        log.info("Dispatcher watching {}", jobsDir.toAbsolutePath());

        try (WatchService watcher = jobsDir.getFileSystem().newWatchService()) {
            // register before draining; a file landing in between is seen twice and claimed once
            jobsDir.register(watcher, StandardWatchEventKinds.ENTRY_CREATE);
            drain();

            while (running) {
                WatchKey key = watcher.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (key != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                            log.warn("Watch events overflowed, rescanning {}", jobsDir);
                            drain();
                            continue;
                        }
                        Path file = jobsDir.resolve((Path) event.context());
                        if (JobDescriptorParser.isJobFile(file)) {
                            handle(file);
                        }
                    }
                    if (!key.reset()) {
                        log.error("Jobs directory {} is no longer accessible", jobsDir);
                        control.write(self, ControlPhase.ERROR, "jobs directory lost");
                        return 1;
                    }
                }
                if (redrainAt > 0 && System.currentTimeMillis() >= redrainAt) {
                    redrainAt = 0;
                    drain();
                }
                if (!checkControl(self)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Dispatcher interrupted");
        } catch (ClosedWatchServiceException e) {
            log.info("Dispatcher watch service closed");
        }
        control.write(self, ControlPhase.DELETED);
        log.info("Dispatcher stopped");
        return 0;
    }

    /** Handles every job file currently in the directory, oldest name first. */
    public int drain() throws IOException {
        List<Path> files;
        try (Stream<Path> s = Files.list(jobsDir)) {
            files = s.filter(JobDescriptorParser::isJobFile).sorted().collect(Collectors.toList());
        }
        int dispatched = 0;
        for (Path f : files) {
            if (handle(f)) dispatched++;
        }
        if (!files.isEmpty()) {
            log.info("Drained {} job file(s), dispatched {}", files.size(), dispatched);
        }
        return dispatched;
    }

    /**
     * Parses and claims the file, then queues the spawn. A file whose claim is
     * refused stays in place and is picked up again once the claim has expired.
     *
     * @return false when the file was invalid or already claimed
     */
    public boolean handle(Path file) {
        if (!Files.exists(file)) {
            return false;
        }
        JobDescriptor job;
        try {
            job = parser.parse(file);
        } catch (JobDescriptorException e) {
            log.error("Rejected job file {}: {}", file.getFileName(), e.getMessage());
            deleteQuietly(file);
            return false;
        }
        if (!claims.claim(job.getJobId())) {
            log.warn("Job {} is already claimed, leaving {} for another look in {} ms",
                    job.getJobId(), file.getFileName(), claimTtlMillis);
            if (redrainAt == 0) {
                redrainAt = System.currentTimeMillis() + claimTtlMillis;
            }
            return false;
        }
        try {
            workers.execute(() -> dispatch(job));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch queue full, dropping {}", file.getFileName(), e);
            deleteQuietly(file);
            return false;
        }
        return true;
    }

    void dispatch(JobDescriptor job) {
        try {
            if (job.getEntity().isConsumer()) {
                resetConsumerState(job.getEntity());
            }
            Process p = launcher.launch(job);
            log.info("Spawned {} for {} (pid {})", job.getKind().getCommand(), job.getEntity(), pidOf(p));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to spawn {} from {}", job.getEntity(), job.getSource(), e);
        } finally {
            deleteQuietly(job.getSource());
        }
    }

    /** Clears a previous run's record; a START queued for the new process is kept. */
    private void resetConsumerState(ControlEntity entity) {
        ControlPhase phase = control.current(entity).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
        if (phase != ControlPhase.START) {
            control.delete(entity);
        }
    }

    /** @return false once a DELETE was seen */
    private boolean checkControl(ControlEntity self) {
        ControlPhase phase = control.current(self).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
        if (phase == ControlPhase.DELETE) {
            log.info("DELETE received for dispatcher");
            return false;
        }
        if (phase == ControlPhase.UNKNOWN) {
            // record cleared by a fresh start
            control.write(self, ControlPhase.RUNNING);
        }
        return true;
    }

    @PreDestroy
    public void stop() {
        running = false;
    }

    private static String pidOf(Process p) {
        if (p == null) return "?";
        try {
            return String.valueOf(p.pid());
        } catch (UnsupportedOperationException e) {
            return "?";
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete job file {}", file, e);
        }
    }
}

package com.trade.foresight.pipeline.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.common.exception.BaseForesightException;
import com.trade.foresight.pipeline.common.exception.ValidationException;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.enums.ModelType;
import com.trade.foresight.pipeline.enums.TrainingEventType;
import com.trade.foresight.pipeline.enums.TrainingState;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.documents.TrainingJobStatus;
import com.trade.foresight.pipeline.service.consumer.ConsumerRunner;
import com.trade.foresight.pipeline.service.jobs.JobDispatcher;
import com.trade.foresight.pipeline.service.orchestrator.KillAllRunner;
import com.trade.foresight.pipeline.service.orchestrator.PipelineStarter;
import com.trade.foresight.pipeline.service.producer.ProducerLoop;
import com.trade.foresight.pipeline.service.training.TrainingEventLog;
import com.trade.foresight.pipeline.service.training.TrainingStatusSensor;
import com.trade.foresight.pipeline.service.training.TrainingStatusStore;
import com.trade.foresight.pipeline.service.versions.VersionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Entry point of every process: runs the command given on the command line
 * and keeps its exit code for {@code SpringApplication.exit}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_USAGE = 2;
    public static final String MDC_ENTITY = "entity";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: <command> [options]",
            "  producer --symbol SYM",
            "  consumer --crypto SYM --model NAME --version VER",
            "  dispatcher",
            "  start",
            "  kill_all",
            "  training-status flush|init|show|cleanup-events",
            "  training-status set --model M --coin C --state PENDING|RUNNING|SUCCESS|FAILED [--error E]",
            "  training-status await --timeout-seconds N [--poll-seconds S]",
            "  training-status log-event --dag D --task T --model M --run R --type START|SUCCESS|FAILURE|RETRY|INFO [--status S] [--message MSG]",
            "  versions baseline|register --type T --path P [--description D]",
            "  versions rollback --type T --target 1|2",
            "  versions list|history");

    private final ProducerLoop producer;
    private final ConsumerRunner consumer;
    private final JobDispatcher dispatcher;
    private final PipelineStarter starter;
    private final KillAllRunner killAll;
    private final TrainingStatusStore statusStore;
    private final TrainingStatusSensor statusSensor;
    private final TrainingEventLog eventLog;
    private final VersionManager versions;
    private final ForesightProperties props;
    private final ObjectMapper mapper;

    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(LaunchArgs.parse(args.getSourceArgs()));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(LaunchArgs a) {
        if (a.getCommand() == null) {
            log.error("No command given.{}{}", System.lineSeparator(), USAGE);
            return EXIT_USAGE;
        }
        try {
            switch (a.getCommand()) {
                case "producer":
                    return runProducer(a);
                case "consumer":
                    return runConsumer(a);
                case "dispatcher":
                    MDC.put(MDC_ENTITY, ControlEntity.dispatcher().key());
                    return dispatcher.run();
                case "start":
                    return starter.run();
                case "kill_all":
                    return killAll.run();
                case "training-status":
                    return trainingStatus(a);
                case "versions":
                    return versions(a);
                default:
                    log.error("Unknown command '{}'.{}{}", a.getCommand(), System.lineSeparator(), USAGE);
                    return EXIT_USAGE;
            }
        } catch (ValidationException | IllegalArgumentException e) {
            log.error("{}{}{}", e.getMessage(), System.lineSeparator(), USAGE);
            return EXIT_USAGE;
        } catch (BaseForesightException e) {
            log.error("{} failed [{}]: {}", a.getCommand(), e.getErrorCode(), e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("{} failed: {}", a.getCommand(), e.getMessage(), e);
            return 1;
        } finally {
            MDC.remove(MDC_ENTITY);
        }
    }

    private int runProducer(LaunchArgs a) {
        String symbol = a.option("symbol").orElse(props.getSymbols().get(0)).toUpperCase(Locale.ROOT);
        MDC.put(MDC_ENTITY, ControlEntity.producer().key());
        return producer.run(symbol);
    }

    private int runConsumer(LaunchArgs a) {
        ControlEntity entity = ControlEntity.of(a.require("crypto"), a.require("model"), a.require("version"));
        MDC.put(MDC_ENTITY, entity.key());
        return consumer.run(entity);
    }

    private int trainingStatus(LaunchArgs a) {
        String sub = a.subcommand().orElseThrow(() -> new ValidationException("training-status needs a subcommand"));
        TrainingStatusStore store = statusStore;
        switch (sub) {
            case "flush":
                store.flush();
                return 0;
            case "init":
                store.initEntries();
                return 0;
            case "set":
                store.setState(a.require("model"), a.require("coin"),
                        TrainingState.valueOf(a.require("state").toUpperCase(Locale.ROOT)),
                        a.option("error").orElse(null));
                return 0;
            case "show":
                for (TrainingJobStatus s : store.getStatus()) {
                    log.info("{} state={} error={}", s.getId(), s.getState(), s.getErrorMessage());
                }
                return 0;
            case "await": {
                Duration timeout = Duration.ofSeconds(a.requireInt("timeout-seconds"));
                Duration poll = a.option("poll-seconds")
                        .map(v -> Duration.ofSeconds(Long.parseLong(v)))
                        .orElse(props.getTraining().getSensorPollInterval());
                Result<List<TrainingJobStatus>> r = statusSensor.awaitCompletion(timeout, poll);
                if (r.isFailure()) {
                    log.error("Training not complete: {}", r.getError());
                    return 1;
                }
                if (TrainingStatusSensor.anyFailed(r.get())) {
                    log.warn("Training finished with failures");
                }
                return 0;
            }
            case "cleanup-events":
                eventLog.cleanupOldEvents();
                return 0;
            case "log-event":
                eventLog.logEvent(a.require("dag"), a.require("task"), a.require("model"),
                        a.require("run"), TrainingEventType.valueOf(a.require("type").toUpperCase(Locale.ROOT)),
                        a.option("status").orElse(null), a.option("message").orElse(null), null);
                return 0;
            default:
                throw new ValidationException("Unknown training-status subcommand: " + sub);
        }
    }

    private int versions(LaunchArgs a) throws JsonProcessingException {
        String sub = a.subcommand().orElseThrow(() -> new ValidationException("versions needs a subcommand"));
        VersionManager vm = versions;
        switch (sub) {
            case "baseline":
                vm.initializeBaseline(ModelType.fromKey(a.require("type")), Paths.get(a.require("path")),
                        a.option("description").orElse(null));
                return 0;
            case "register": {
                String slot = vm.registerNewModel(ModelType.fromKey(a.require("type")), Paths.get(a.require("path")),
                        a.option("description").orElse(null));
                log.info("Registered as v{}", slot);
                return 0;
            }
            case "rollback":
                vm.rollbackToVersion(ModelType.fromKey(a.require("type")), a.require("target"));
                return 0;
            case "list":
                log.info("{}", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(vm.listAll()));
                return 0;
            case "history":
                log.info("{}", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(vm.history()));
                return 0;
            default:
                throw new ValidationException("Unknown versions subcommand: " + sub);
        }
    }
}

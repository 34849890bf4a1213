package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.ForesightApplication;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.JobDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.system.ApplicationHome;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches this application again with a worker command word. The argument
 * vector is built from the descriptor; nothing from the job file is passed
 * to a shell.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaProcessLauncher implements ProcessLauncher {

    private final ForesightProperties props;

    @Override
    public Process launch(JobDescriptor job) throws IOException {
        List<String> cmd = command(job);
        Path logDir = Paths.get(props.getPaths().getLogDir());
        Files.createDirectories(logDir);
        File out = logDir.resolve(job.getEntity().key() + ".out").toFile();

        log.info("Launching {}: {}", job.getEntity(), cmd);
        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(out));
        return pb.start();
    }

    public List<String> command(JobDescriptor job) {
        ForesightProperties.Launcher cfg = props.getLauncher();
        List<String> cmd = new ArrayList<>();
        cmd.add(cfg.getJavaCommand());
        cmd.addAll(cfg.getJvmArgs());
        cmd.addAll(applicationArgs(cfg));
        cmd.add(job.getKind().getCommand());
        switch (job.getKind()) {
            case PRODUCER:
                cmd.add("--symbol");
                cmd.add(job.getMarketSymbol());
                break;
            case CONSUMER:
                cmd.add("--crypto");
                cmd.add(job.getEntity().getSymbol());
                cmd.add("--model");
                cmd.add(job.getEntity().getModel());
                cmd.add("--version");
                cmd.add(job.getEntity().getVersion());
                break;
            default:
                break;
        }
        return cmd;
    }

    private static List<String> applicationArgs(ForesightProperties.Launcher cfg) {
        List<String> args = new ArrayList<>();
        if (!cfg.getJar().isEmpty()) {
            args.add("-jar");
            args.add(cfg.getJar());
            return args;
        }
        File source = new ApplicationHome(ForesightApplication.class).getSource();
        if (source != null && source.isFile() && source.getName().endsWith(".jar")) {
            args.add("-jar");
            args.add(source.getAbsolutePath());
        } else {
            // exploded classes, e.g. running from the IDE
            args.add("-cp");
            args.add(System.getProperty("java.class.path"));
            args.add(ForesightApplication.class.getName());
        }
        return args;
    }
}

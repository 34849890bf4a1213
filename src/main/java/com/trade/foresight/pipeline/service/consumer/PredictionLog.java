package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.ControlEntity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Local CSV of stored predictions: {@code <data-dir>/predictions/<SYMBOL>/<model>/<version>.csv}.
 */
@Component
public class PredictionLog {

    private final Path root;

    @Autowired
    public PredictionLog(ForesightProperties props) {
        this(Paths.get(props.getPaths().getDataDir(), "predictions"));
    }

    public PredictionLog(Path root) {
        this.root = root;
    }

    public Path fileFor(ControlEntity e) {
        return root.resolve(e.getSymbol()).resolve(e.getModel()).resolve(e.getVersion() + ".csv");
    }

    public void append(ControlEntity e, Instant openTime, List<Double> prediction) throws IOException {
        Path f = fileFor(e);
        Files.createDirectories(f.getParent());
        boolean fresh = !Files.exists(f);
        String vector = prediction.stream().map(String::valueOf).collect(Collectors.joining(" ", "\"[", "]\""));
        try (BufferedWriter w = Files.newBufferedWriter(f, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (fresh) {
                w.write("open_time,pred");
                w.newLine();
            }
            w.write(openTime + "," + vector);
            w.newLine();
        }
    }
}

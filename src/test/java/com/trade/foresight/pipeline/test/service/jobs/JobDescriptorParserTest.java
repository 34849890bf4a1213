package com.trade.foresight.pipeline.test.service.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.enums.JobKind;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.JobDescriptor;
import com.trade.foresight.pipeline.service.jobs.JavaProcessLauncher;
import com.trade.foresight.pipeline.service.jobs.JobDescriptorParser;
import com.trade.foresight.pipeline.service.jobs.JobSubmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JobDescriptorParserTest {

    @TempDir
    Path dir;

    private ForesightProperties props;
    private JobDescriptorParser parser;

    @BeforeEach
    void setUp() {
        props = new ForesightProperties();
        props.setSymbols(Arrays.asList("ETHUSDT", "BTCUSDT"));
        parser = new JobDescriptorParser(props);
    }

    private Path file(String name, String content) throws Exception {
        return Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void consumerRoutingComesFromFileName() throws Exception {
        Path f = file("BTCUSDT_lightgbm_v1.sh",
                "#!/bin/sh\n# generated\n\nconsumer --crypto BTCUSDT --model lightgbm --version v1\n");

        JobDescriptor job = parser.parse(f);

        assertThat(job.getKind()).isEqualTo(JobKind.CONSUMER);
        assertThat(job.getEntity()).isEqualTo(ControlEntity.of("BTCUSDT", "lightgbm", "v1"));
        assertThat(job.getMarketSymbol()).isEqualTo("BTCUSDT");
        assertThat(job.getJobId()).startsWith("consumer:BTCUSDT_lightgbm_v1:").hasSize(
                "consumer:BTCUSDT_lightgbm_v1:".length() + 16);
        assertThat(job.getSource()).isEqualTo(f);
    }

    @Test
    void mismatchedOptionsDoNotOverrideName() throws Exception {
        Path f = file("ETHUSDT_tst_v2.sh", "consumer --crypto=BTCUSDT --model lightgbm --version v9\n");

        assertThat(parser.parse(f).getEntity()).isEqualTo(ControlEntity.of("ETHUSDT", "tst", "v2"));
    }

    @Test
    void producerSymbolFromCommandOrFirstConfigured() throws Exception {
        JobDescriptor explicit = parser.parse(file("ALL_producer_main.sh", "producer --symbol btcusdt\n"));
        assertThat(explicit.getKind()).isEqualTo(JobKind.PRODUCER);
        assertThat(explicit.getEntity().isProducer()).isTrue();
        assertThat(explicit.getMarketSymbol()).isEqualTo("BTCUSDT");

        Files.delete(dir.resolve("ALL_producer_main.sh"));
        JobDescriptor defaulted = parser.parse(file("ALL_producer_main.sh", "producer\n"));
        assertThat(defaulted.getMarketSymbol()).isEqualTo("ETHUSDT");
    }

    @Test
    void idChangesWithContentOrModificationTime() throws Exception {
        Path f = file("BTCUSDT_lightgbm_v1.sh", "consumer --crypto BTCUSDT\n");
        Files.setLastModifiedTime(f, FileTime.fromMillis(1_000_000L));
        String first = parser.parse(f).getJobId();

        assertThat(parser.parse(f).getJobId()).isEqualTo(first);

        Files.setLastModifiedTime(f, FileTime.fromMillis(2_000_000L));
        assertThat(parser.parse(f).getJobId()).isNotEqualTo(first);
    }

    @Test
    void rejectsBadNames() throws Exception {
        assertThatThrownBy(() -> parser.parse(file("BTCUSDT_lightgbm.sh", "consumer\n")))
                .isInstanceOf(JobDescriptorException.class)
                .hasMessageContaining("Invalid job file name");
        assertThatThrownBy(() -> parser.parse(file("ALL_dispatcher_main.sh", "dispatcher\n")))
                .isInstanceOf(JobDescriptorException.class);
        assertThatThrownBy(() -> parser.parse(file("notes.txt", "x")))
                .isInstanceOf(JobDescriptorException.class);
        assertThat(JobDescriptorParser.isJobFile(dir.resolve(".BTCUSDT_lightgbm_v1.tmp"))).isFalse();
    }

    @Test
    void submittedFilesParseBack() throws Exception {
        JobSubmitter submitter = new JobSubmitter(dir.resolve("jobs"));

        Path consumer = submitter.submitConsumer(ControlEntity.of("BTCUSDT", "tst", "v3"));
        Path producer = submitter.submitProducer("BTCUSDT");

        assertThat(consumer.getFileName().toString()).isEqualTo("BTCUSDT_tst_v3.sh");
        assertThat(new String(Files.readAllBytes(consumer), StandardCharsets.UTF_8))
                .isEqualTo("#!/bin/sh\nconsumer --crypto BTCUSDT --model tst --version v3\n");
        assertThat(parser.parse(consumer).getEntity()).isEqualTo(ControlEntity.of("BTCUSDT", "tst", "v3"));
        assertThat(parser.parse(producer).getMarketSymbol()).isEqualTo("BTCUSDT");
        try (Stream<Path> s = Files.list(dir.resolve("jobs"))) {
            assertThat(s.filter(p -> p.getFileName().toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void launcherBuildsArgumentVectorFromDescriptor() throws Exception {
        props.getLauncher().setJar("/opt/foresight/app.jar");
        props.getLauncher().setJvmArgs(Collections.singletonList("-Xmx256m"));
        JavaProcessLauncher launcher = new JavaProcessLauncher(props);

        JobDescriptor consumer = parser.parse(file("BTCUSDT_lightgbm_v1.sh", "consumer; rm -rf /\n"));
        assertThat(launcher.command(consumer)).containsExactly("java", "-Xmx256m", "-jar", "/opt/foresight/app.jar",
                "consumer", "--crypto", "BTCUSDT", "--model", "lightgbm", "--version", "v1");

        JobDescriptor producer = parser.parse(file("ALL_producer_main.sh", "producer --symbol ETHUSDT\n"));
        assertThat(launcher.command(producer)).endsWith("producer", "--symbol", "ETHUSDT");
    }
}

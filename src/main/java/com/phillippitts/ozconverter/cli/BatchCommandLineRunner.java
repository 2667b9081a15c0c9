package com.phillippitts.ozconverter.cli;

import com.phillippitts.ozconverter.config.properties.ConverterProperties;
import com.phillippitts.ozconverter.domain.BatchSummary;
import com.phillippitts.ozconverter.domain.JobRequest;
import com.phillippitts.ozconverter.service.coordinator.BatchCoordinator;
import com.phillippitts.ozconverter.service.planning.JobPlan;
import com.phillippitts.ozconverter.service.planning.JobPlanner;
import com.phillippitts.ozconverter.service.planning.RoutineDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one batch from properties and exits.
 *
 * <pre>
 * --converter.run.job=Compress --converter.run.media="CD Image"
 * --converter.run.inputs=/games/a.cue,/games/folder [--converter.run.format=chd]
 * [--converter.run.output-dir=/out] [--converter.run.overwrite=true] [--converter.run.recursive=true]
 * [--converter.run.timeout-minutes=600]
 * </pre>
 *
 * Folders in the inputs are scanned for files the selection accepts.
 */
@Component
@ConditionalOnProperty(prefix = "converter.run", name = "job")
public class BatchCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(BatchCommandLineRunner.class);

    private final Environment env;
    private final JobPlanner planner;
    private final BatchCoordinator coordinator;
    private final ConverterProperties properties;
    private int exitCode;

    public BatchCommandLineRunner(Environment env, JobPlanner planner, BatchCoordinator coordinator,
                                  ConverterProperties properties) {
        this.env = env;
        this.planner = planner;
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String job = env.getRequiredProperty("converter.run.job");
        String media = env.getProperty("converter.run.media", "");
        String format = env.getProperty("converter.run.format", "");
        String outputDir = env.getProperty("converter.run.output-dir", "");
        boolean overwrite = env.getProperty("converter.run.overwrite", Boolean.class, false);
        boolean recursive = env.getProperty("converter.run.recursive", Boolean.class, false);
        long timeoutMinutes = env.getProperty("converter.run.timeout-minutes", Long.class, 24L * 60);

        RoutineDefinition definition = planner.catalog().find(job, media).orElse(null);
        if (definition == null) {
            LOG.error("Unknown selection {} / {}; available jobs: {}", job, media, planner.catalog().jobNames());
            exitCode = 2;
            return;
        }

        List<Path> inputs = expandInputs(env.getProperty("converter.run.inputs", ""), definition, recursive);
        JobPlan plan = planner.plan(job, media, inputs, format,
                outputDir.isBlank() ? null : Path.of(outputDir), overwrite);
        if (plan.hasError()) {
            LOG.error(plan.error());
            exitCode = 2;
            return;
        }
        plan.skipped().forEach(p -> LOG.warn("Skipping {} (not a {} input)", p, definition.mediaName()));
        if (plan.isEmpty()) {
            LOG.warn("Nothing to do for {} / {}", job, media);
            return;
        }

        List<JobRequest> requests = plan.requests();
        LOG.info("Submitting {} job(s) for {} / {}", requests.size(), definition.jobName(), definition.mediaName());
        coordinator.submitAll(requests);
        if (!coordinator.awaitCompletion(Duration.ofMinutes(timeoutMinutes))) {
            LOG.error("Batch did not finish within {} minutes; cancelling queued jobs", timeoutMinutes);
            coordinator.cancelPending();
            exitCode = 3;
            return;
        }
        BatchSummary summary = coordinator.summary();
        exitCode = summary.failed() > 0 ? 1 : 0;
    }

    private List<Path> expandInputs(String csv, RoutineDefinition definition, boolean recursive) throws IOException {
        Path tempRoot = properties.getMainTempDir().isBlank() ? null : Path.of(properties.getMainTempDir());
        List<Path> inputs = new ArrayList<>();
        for (String raw : Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList()) {
            Path path = Path.of(raw);
            // Folder-shaped routines take the directory itself
            if (Files.isDirectory(path) && !definition.inputExtensions().isEmpty()) {
                inputs.addAll(planner.scanFolder(path, recursive, definition, tempRoot));
            } else {
                inputs.add(path);
            }
        }
        return inputs;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

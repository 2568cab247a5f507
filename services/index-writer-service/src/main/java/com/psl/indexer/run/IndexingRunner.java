package com.psl.indexer.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.config.IndexerProperties;
import com.psl.indexer.opensearch.OpenSearchRequestException;
import com.psl.indexer.opensearch.OpenSearchUnavailableException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point: reads the identifier list, bootstraps the index, runs the orchestrator and reports.
 * Exit codes: 0 finished (dead letters allowed), 2 unreadable input, 3 engine unreachable or bootstrap failed,
 * 4 cancelled.
 */
@Component
public class IndexingRunner implements ApplicationRunner, ExitCodeGenerator, ApplicationListener<ContextClosedEvent> {
    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_UNREADABLE = 2;
    static final int EXIT_ENGINE_FAILURE = 3;
    static final int EXIT_CANCELLED = 4;

    private static final Logger log = LoggerFactory.getLogger(IndexingRunner.class);

    private final IndexingOrchestrator orchestrator;
    private final IndexBootstrapper bootstrapper;
    private final IndexerProperties properties;
    private final ObjectMapper objectMapper;
    private volatile RunCancellation cancellation;
    private int exitCode = EXIT_OK;

    public IndexingRunner(
        IndexingOrchestrator orchestrator,
        IndexBootstrapper bootstrapper,
        IndexerProperties properties,
        ObjectMapper objectMapper
    ) {
        this.orchestrator = orchestrator;
        this.bootstrapper = bootstrapper;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(resolveInput(args));
    }

    int execute(String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            log.error("indexing_input_missing hint=\"set indexer.input-path or pass the list path as an argument\"");
            return EXIT_INPUT_UNREADABLE;
        }
        List<String> identifiers;
        try {
            identifiers = IdentifierListReader.read(Path.of(inputPath));
        } catch (IOException | RuntimeException e) {
            log.error("indexing_input_unreadable path={} error={}", inputPath, e.getMessage());
            return EXIT_INPUT_UNREADABLE;
        }

        IndexTarget target;
        try {
            target = bootstrapper.prepare();
        } catch (OpenSearchUnavailableException | OpenSearchRequestException e) {
            log.error("index_bootstrap_failed error={}", e.getMessage(), e);
            return EXIT_ENGINE_FAILURE;
        }

        RunCancellation runCancellation = new RunCancellation(properties.getRunTimeoutMs());
        this.cancellation = runCancellation;
        RunSummary summary;
        try {
            summary = orchestrator.run(identifiers, target.writeIndex(), runCancellation);
        } finally {
            this.cancellation = null;
        }
        writeReport(summary);

        try {
            bootstrapper.complete(target, summary);
        } catch (OpenSearchUnavailableException | OpenSearchRequestException e) {
            log.error("alias_swap_failed alias={} index={} error={}", target.alias(), target.writeIndex(), e.getMessage(), e);
            return EXIT_ENGINE_FAILURE;
        }
        return summary.isCancelled() ? EXIT_CANCELLED : EXIT_OK;
    }

    /**
     * Shutdown (SIGTERM, context close) cancels the run in flight; it still finishes with a summary and exit code 4.
     */
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        cancel("shutdown");
    }

    void cancel(String reason) {
        RunCancellation current = cancellation;
        if (current != null && !current.isCancelled()) {
            log.warn("indexing_run_cancel reason={}", reason);
            current.cancel(reason);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private String resolveInput(ApplicationArguments args) {
        if (properties.getInputPath() != null && !properties.getInputPath().isBlank()) {
            return properties.getInputPath();
        }
        List<String> positional = args.getNonOptionArgs();
        return positional.isEmpty() ? null : positional.get(0);
    }

    private void writeReport(RunSummary summary) {
        String path = properties.getDeadLetterPath();
        if (path == null || path.isBlank()) {
            return;
        }
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(Path.of(path).toFile(), summary);
            log.info("run_report_written path={} dead_lettered={}", path, summary.getDeadLettered());
        } catch (IOException e) {
            log.error("run_report_write_failed path={} error={}", path, e.getMessage(), e);
        }
    }
}

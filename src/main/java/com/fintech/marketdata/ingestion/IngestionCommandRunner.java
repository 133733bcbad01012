package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one operator command at startup, e.g.
 * {@code --ingestion.cli.command=start --ingestion.cli.categories=nifty50 --ingestion.cli.workers=5}.
 */
@Component
@ConditionalOnProperty(name = "ingestion.cli.command")
public class IngestionCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionCommandRunner.class);

    private final IngestionService service;
    private final IngestionProperties properties;

    public IngestionCommandRunner(IngestionService service, IngestionProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        IngestionProperties.Cli cli = properties.getCli();
        String command = cli.getCommand().trim().toLowerCase();
        switch (command) {
            case "start" -> {
                RunReport report = service.startAndWait(
                    new RunRequest(cli.getCategories(), cli.getTimeframes(), cli.getWorkers(), null, null, null));
                log.info("Run report: {}", report);
            }
            case "resume" -> {
                int requeued = service.resume(cli.getWorkers(), null);
                log.info("Resumed {} failed tasks", requeued);
                service.awaitCurrentRun().ifPresent(report -> log.info("Run report: {}", report));
            }
            case "repair" -> log.info("Repaired {} stale tasks", service.repair());
            case "status" -> log.info("Status: {}", service.status());
            default -> throw new IllegalArgumentException(
                "Unknown command '" + cli.getCommand() + "'. Allowed: start, resume, repair, status");
        }
    }
}

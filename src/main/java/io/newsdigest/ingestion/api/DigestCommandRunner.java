package io.newsdigest.ingestion.api;

import io.newsdigest.ingestion.api.dto.RunOutcome;
import io.newsdigest.ingestion.api.dto.RunStatus;
import io.newsdigest.ingestion.api.service.DigestPipelineService;
import io.newsdigest.ingestion.api.service.SourceRegistry;
import io.newsdigest.ingestion.api.service.SummaryCacheService;
import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.OutputConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the pipeline once at startup.
 * <p>
 * Options: {@code --feeds=a,b} restricts the run to the named sources,
 * {@code --no-cache} ignores and does not persist the summary cache,
 * {@code --output=path} overrides the digest location.
 */
@Component
@ConditionalOnProperty(prefix = "digest.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DigestCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DigestCommandRunner.class);

    static final String FEEDS_OPTION = "feeds";
    static final String NO_CACHE_OPTION = "no-cache";
    static final String OUTPUT_OPTION = "output";

    private final DigestPipelineService pipeline;
    private final SourceRegistry sourceRegistry;
    private final SummaryCacheService cache;
    private final OutputConfig outputConfig;

    private volatile int exitCode = RunStatus.FAILED.exitCode();

    public DigestCommandRunner(DigestPipelineService pipeline,
                               SourceRegistry sourceRegistry,
                               SummaryCacheService cache,
                               OutputConfig outputConfig) {
        this.pipeline = pipeline;
        this.sourceRegistry = sourceRegistry;
        this.cache = cache;
        this.outputConfig = outputConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<FeedSource> sources = sourceRegistry.select(requestedFeeds(args));
        if (sources.isEmpty()) {
            logger.error("No feed sources to process");
            exitCode = RunStatus.NO_ARTICLES.exitCode();
            return;
        }

        if (args.containsOption(NO_CACHE_OPTION)) {
            cache.disable();
        }

        Path output = outputPath(args);
        RunOutcome outcome = pipeline.run(sources, output);
        exitCode = outcome.status().exitCode();

        logger.info("Digest run finished with status {} (exit code {})", outcome.status(), exitCode);
    }

    private List<String> requestedFeeds(ApplicationArguments args) {
        List<String> values = args.getOptionValues(FEEDS_OPTION);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }

    private Path outputPath(ApplicationArguments args) {
        List<String> values = args.getOptionValues(OUTPUT_OPTION);
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0));
        }
        return outputConfig.getOutputPath();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

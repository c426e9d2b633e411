package com.xcc.challenge.funnel.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once when the application starts. A failed run aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "funnel.pipeline.run-on-startup", havingValue = "true", matchIfMissing = true)
public class PipelineStartupRunner implements ApplicationRunner {

    private final FunnelPipeline pipeline;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running funnel pipeline on startup");
        PipelineRunReport report = pipeline.run();
        log.info("Startup run finished: {}", report);
    }
}

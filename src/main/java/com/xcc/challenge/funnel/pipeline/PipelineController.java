package com.xcc.challenge.funnel.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Triggers a new run over the configured event log. The run replaces the
 * session table and the published summaries.
 */
@RestController
@RequiredArgsConstructor
public class PipelineController {

    private final FunnelPipeline pipeline;

    @PostMapping("/pipeline/runs")
    public PipelineRunReport run() {
        return pipeline.run();
    }
}

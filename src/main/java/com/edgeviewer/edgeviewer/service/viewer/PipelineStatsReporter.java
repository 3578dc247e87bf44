package com.edgeviewer.edgeviewer.service.viewer;

import com.edgeviewer.edgeviewer.model.dto.FrameStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Component
public class PipelineStatsReporter {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStatsReporter.class);

    private final EdgeViewerService viewerService;

    public PipelineStatsReporter(EdgeViewerService viewerService) {
        this.viewerService = viewerService;
    }

    @Scheduled(fixedRateString = "${edgeviewer.stats.log-interval-ms:10000}")
    public void logStats() {
        if (!viewerService.isCapturing()) {
            return;
        }

        Map<String, Object> status = viewerService.getStatus();
        Optional<FrameStats> stats = viewerService.currentStats();
        logger.info("[Viewer] {} | analyzed={}, dropped={}, rendered={}",
                stats.map(FrameStats::getText).orElse("waiting for frames"),
                status.get("framesAnalyzed"), status.get("framesDropped"), status.get("framesRendered"));
    }
}

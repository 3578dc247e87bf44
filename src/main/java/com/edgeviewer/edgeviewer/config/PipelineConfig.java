package com.edgeviewer.edgeviewer.config;

import com.edgeviewer.edgeviewer.service.camera.CaptureSource;
import com.edgeviewer.edgeviewer.service.camera.FFmpegGrabberConfig;
import com.edgeviewer.edgeviewer.service.camera.GrabberCaptureSource;
import com.edgeviewer.edgeviewer.service.camera.SyntheticCaptureSource;
import com.edgeviewer.edgeviewer.service.nativeproc.EdgeParameters;
import com.edgeviewer.edgeviewer.service.nativeproc.EdgeProcessor;
import com.edgeviewer.edgeviewer.service.nativeproc.OpenCvEdgeProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the capture source and the edge processor from application properties
 */
@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public EdgeParameters edgeParameters(
            @Value("${edgeviewer.edge.low-threshold:60.0}") double lowThreshold,
            @Value("${edgeviewer.edge.high-threshold:180.0}") double highThreshold,
            @Value("${edgeviewer.edge.blur-radius:5}") int blurRadius,
            @Value("${edgeviewer.edge.equalize-histogram:true}") boolean equalizeHistogram) {
        if (lowThreshold > highThreshold) {
            throw new IllegalArgumentException("edgeviewer.edge.low-threshold (" + lowThreshold
                    + ") must not exceed edgeviewer.edge.high-threshold (" + highThreshold + ")");
        }
        return EdgeParameters.builder()
                .lowThreshold(lowThreshold)
                .highThreshold(highThreshold)
                .blurRadius(blurRadius)
                .equalizeHistogram(equalizeHistogram)
                .build();
    }

    @Bean
    public EdgeProcessor edgeProcessor() {
        return new OpenCvEdgeProcessor();
    }

    @Bean
    public CaptureSource captureSource(
            FFmpegGrabberConfig grabberConfig,
            @Value("${edgeviewer.capture.source:synthetic}") String source,
            @Value("${edgeviewer.capture.url:/dev/video0}") String url) {
        switch (source.trim().toLowerCase()) {
            case "grabber":
                logger.info("Using FFmpeg capture from {}", url);
                return new GrabberCaptureSource(grabberConfig, url);
            case "synthetic":
                logger.info("Using synthetic capture {}x{}", grabberConfig.getImageWidth(), grabberConfig.getImageHeight());
                return new SyntheticCaptureSource(grabberConfig.getImageWidth(), grabberConfig.getImageHeight(),
                        grabberConfig.getFrameRate());
            default:
                throw new IllegalArgumentException("Unknown edgeviewer.capture.source: " + source
                        + " (expected grabber or synthetic)");
        }
    }
}

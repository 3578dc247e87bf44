package com.edgeviewer.edgeviewer.config;

import com.edgeviewer.edgeviewer.service.camera.CaptureSource;
import com.edgeviewer.edgeviewer.service.camera.FFmpegGrabberConfig;
import com.edgeviewer.edgeviewer.service.camera.GrabberCaptureSource;
import com.edgeviewer.edgeviewer.service.camera.SyntheticCaptureSource;
import com.edgeviewer.edgeviewer.service.nativeproc.EdgeParameters;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    @Test
    void testEdgeParameters_RejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> config.edgeParameters(200, 100, 5, true));
    }

    @Test
    void testEdgeParameters_BuildsFromProperties() {
        EdgeParameters parameters = config.edgeParameters(60, 180, 5, false);

        assertEquals(60.0, parameters.getLowThreshold());
        assertEquals(180.0, parameters.getHighThreshold());
        assertFalse(parameters.isEqualizeHistogram());
    }

    @Test
    void testCaptureSource_SelectsImplementation() {
        FFmpegGrabberConfig grabberConfig = new FFmpegGrabberConfig();
        ReflectionTestUtils.setField(grabberConfig, "imageWidth", 320);
        ReflectionTestUtils.setField(grabberConfig, "imageHeight", 240);
        ReflectionTestUtils.setField(grabberConfig, "frameRate", 15.0);

        CaptureSource grabber = config.captureSource(grabberConfig, "grabber", "rtsp://camera/stream");
        CaptureSource synthetic = config.captureSource(grabberConfig, " Synthetic ", "/dev/video0");

        assertInstanceOf(GrabberCaptureSource.class, grabber);
        assertInstanceOf(SyntheticCaptureSource.class, synthetic);
        assertEquals("synthetic:320x240@15.0", synthetic.describe());
        assertThrows(IllegalArgumentException.class, () -> config.captureSource(grabberConfig, "usb", "/dev/video0"));
    }
}

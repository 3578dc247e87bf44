package com.edgeviewer.edgeviewer.service.camera;

import com.edgeviewer.edgeviewer.service.nativeproc.StubEdgeProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticCaptureSourceTest {

    private SyntheticCaptureSource source;
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.stop();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void testGenerate_ProducesI420Planes() {
        PlanarSensorFrame frame = SyntheticCaptureSource.generate(9, 5, 0, null);

        assertEquals(SensorFormat.YUV_420_888, frame.getFormat());
        SensorFrame.Plane[] planes = frame.getPlanes();
        assertEquals(3, planes.length);
        assertEquals(9 * 5, planes[0].getBuffer().remaining());
        assertEquals(5 * 3, planes[1].getBuffer().remaining());
        assertEquals(5 * 3, planes[2].getBuffer().remaining());
    }

    @Test
    void testGenerate_FramesChangeOverTime() {
        byte[] first = YuvToRgbaConverter.convert(SyntheticCaptureSource.generate(32, 24, 0, null));
        byte[] later = YuvToRgbaConverter.convert(SyntheticCaptureSource.generate(32, 24, 7, null));

        assertFalse(Arrays.equals(first, later));
    }

    @Test
    void testGenerate_AcceptedByAnalyzer() {
        List<FrameRecord> records = new ArrayList<>();
        FrameAnalyzer analyzer = new FrameAnalyzer(StubEdgeProcessor.identity(), records::add);

        analyzer.onFrame(SyntheticCaptureSource.generate(16, 12, 3, null));

        assertEquals(1, records.size());
        assertEquals(16 * 12 * 4, records.get(0).getProcessedBuffer().length);
    }

    @Test
    void testConstructor_RejectsInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new SyntheticCaptureSource(0, 480, 30));
        assertThrows(IllegalArgumentException.class, () -> new SyntheticCaptureSource(640, 480, 0));
    }

    @Test
    void testStart_DeliversFramesUntilStopped() throws Exception {
        source = new SyntheticCaptureSource(32, 24, 100);
        executor = Executors.newSingleThreadExecutor();
        CountDownLatch latch = new CountDownLatch(3);

        source.start(frame -> {
            frame.close();
            latch.countDown();
        }, executor);

        assertTrue(source.isRunning());
        assertTrue(latch.await(5, TimeUnit.SECONDS), "frames delivered");

        source.stop();
        assertFalse(source.isRunning());
        assertEquals("synthetic:32x24@100.0", source.describe());
    }
}

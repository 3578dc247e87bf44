package com.edgeviewer.edgeviewer.service.camera;

import com.edgeviewer.edgeviewer.service.nativeproc.EdgeProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Turns each delivered camera frame into a {@link FrameRecord}: convert to RGBA, run the
 * edge processor, stamp the availability time and emit.
 *
 * Per-frame problems never leave this class. Frames in an unexpected format and frames the
 * processor fails on are dropped and counted, and the sensor frame is released on every path
 * so capture keeps running.
 */
public class FrameAnalyzer implements SensorFrameListener {

    private static final Logger logger = LoggerFactory.getLogger(FrameAnalyzer.class);
    private static final int FAILURE_LOG_EVERY = 100;

    private final EdgeProcessor processor;
    private final Consumer<FrameRecord> onFrameAvailable;
    private final LongSupplier clock;

    private final AtomicLong framesAnalyzed = new AtomicLong();
    private final AtomicLong droppedMalformed = new AtomicLong();
    private final AtomicLong droppedFailed = new AtomicLong();

    public FrameAnalyzer(EdgeProcessor processor, Consumer<FrameRecord> onFrameAvailable) {
        this(processor, onFrameAvailable, System::nanoTime);
    }

    /**
     * @param clock monotonic nanosecond clock read when a frame becomes available
     */
    public FrameAnalyzer(EdgeProcessor processor, Consumer<FrameRecord> onFrameAvailable, LongSupplier clock) {
        this.processor = processor;
        this.onFrameAvailable = onFrameAvailable;
        this.clock = clock;
    }

    @Override
    public void onFrame(SensorFrame frame) {
        try {
            if (!isSupported(frame)) {
                droppedMalformed.incrementAndGet();
                logger.debug("Dropping frame in format {}", frame.getFormat());
                return;
            }

            int width = frame.getWidth();
            int height = frame.getHeight();
            byte[] rgba = YuvToRgbaConverter.convert(frame);
            byte[] processed = processor.process(rgba, width, height);
            if (processed == null || processed.length != rgba.length) {
                throw new IllegalStateException("Edge processor returned "
                        + (processed == null ? "null" : processed.length + " bytes")
                        + " for a " + width + "x" + height + " frame");
            }

            FrameRecord record = new FrameRecord(rgba, processed, width, height, clock.getAsLong());
            onFrameAvailable.accept(record);
            framesAnalyzed.incrementAndGet();

        } catch (Exception e) {
            long failures = droppedFailed.incrementAndGet();
            if (failures == 1 || failures % FAILURE_LOG_EVERY == 0) {
                logger.warn("Dropped frame after processing failure ({} so far): {}", failures, e.getMessage());
            }
        } finally {
            frame.close();
        }
    }

    private static boolean isSupported(SensorFrame frame) {
        return frame.getFormat() == SensorFormat.YUV_420_888
                && frame.getPlanes().length >= 3
                && frame.getWidth() > 0
                && frame.getHeight() > 0;
    }

    public long getFramesAnalyzed() { return framesAnalyzed.get(); }
    public long getDroppedMalformed() { return droppedMalformed.get(); }
    public long getDroppedFailed() { return droppedFailed.get(); }
}

package com.edgeviewer.edgeviewer.service.camera;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot hand-off between a capture thread and the analysis executor.
 *
 * When a new frame arrives before the pending one was picked up, the pending frame is
 * released and replaced, so the listener always sees the newest frame and a slow listener
 * never backs up the capture thread. A drain task is scheduled only when the slot goes from
 * empty to full, so at most one drain is outstanding at any time.
 */
public class KeepLatestDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(KeepLatestDispatcher.class);

    private final SensorFrameListener listener;
    private final Executor executor;
    private final AtomicReference<SensorFrame> pending = new AtomicReference<>();
    private final AtomicLong droppedFrames = new AtomicLong();

    public KeepLatestDispatcher(SensorFrameListener listener, Executor executor) {
        this.listener = listener;
        this.executor = executor;
    }

    /**
     * Never blocks.
     */
    public void offer(SensorFrame frame) {
        SensorFrame previous = pending.getAndSet(frame);
        if (previous != null) {
            previous.close();
            droppedFrames.incrementAndGet();
            return;
        }

        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            logger.debug("Analysis executor is shut down, releasing frame");
            clear();
        }
    }

    private void drain() {
        SensorFrame frame = pending.getAndSet(null);
        if (frame != null) {
            listener.onFrame(frame);
        }
    }

    /**
     * Releases the pending frame, if any.
     */
    public void clear() {
        SensorFrame frame = pending.getAndSet(null);
        if (frame != null) {
            frame.close();
        }
    }

    public long getDroppedFrames() {
        return droppedFrames.get();
    }
}

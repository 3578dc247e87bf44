package com.edgeviewer.edgeviewer.service.display;

import com.edgeviewer.edgeviewer.service.camera.FrameRecord;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest-wins holder of the most recent analyzed frame, shared between the capture thread
 * (writer), the render thread and HTTP threads (readers).
 *
 * The whole {@link FrameRecord} is swapped in one atomic write, so a reader never pairs the
 * dimensions of one frame with the buffers of another. Nothing is queued: a superseded frame
 * is gone as soon as the next one is published. Neither side ever blocks.
 */
@Component
public class FrameStateStore {

    private final AtomicReference<FrameRecord> latest = new AtomicReference<>();
    private volatile boolean showRaw;

    public void publish(FrameRecord record) {
        latest.set(Objects.requireNonNull(record, "record"));
    }

    public DisplayState snapshot() {
        return new DisplayState(latest.get(), showRaw);
    }

    public void setShowRaw(boolean showRaw) {
        this.showRaw = showRaw;
    }

    public boolean isShowRaw() {
        return showRaw;
    }

    /**
     * Forgets the last frame. The display mode is kept.
     */
    public void reset() {
        latest.set(null);
    }
}

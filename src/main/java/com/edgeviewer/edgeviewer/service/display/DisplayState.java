package com.edgeviewer.edgeviewer.service.display;

import com.edgeviewer.edgeviewer.service.camera.FrameRecord;
import com.edgeviewer.edgeviewer.model.dto.FrameStats;

/**
 * Read-only view of the store at one instant. Buffers are shared with the store, not copied;
 * callers must not write to them.
 */
public final class DisplayState {

    private final FrameRecord frame;
    private final boolean showRaw;

    DisplayState(FrameRecord frame, boolean showRaw) {
        this.frame = frame;
        this.showRaw = showRaw;
    }

    public boolean hasFrame() {
        return frame != null;
    }

    public byte[] getRawBuffer() {
        return frame != null ? frame.getRawBuffer() : null;
    }

    public byte[] getProcessedBuffer() {
        return frame != null ? frame.getProcessedBuffer() : null;
    }

    /**
     * The buffer the current display mode selects.
     */
    public byte[] getDisplayBuffer() {
        return showRaw ? getRawBuffer() : getProcessedBuffer();
    }

    public int getWidth() {
        return frame != null ? frame.getWidth() : 0;
    }

    public int getHeight() {
        return frame != null ? frame.getHeight() : 0;
    }

    public long getLastTimestampNs() {
        return frame != null ? frame.getTimestampNs() : 0L;
    }

    public boolean isShowRaw() {
        return showRaw;
    }

    public String getModeLabel() {
        return showRaw ? FrameStats.MODE_RAW : FrameStats.MODE_EDGES;
    }
}

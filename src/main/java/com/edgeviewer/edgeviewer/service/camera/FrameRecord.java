package com.edgeviewer.edgeviewer.service.camera;

/**
 * One analyzed frame: the converted camera image, its edge-processed counterpart and the
 * time it became available. Buffers are never modified after construction.
 */
public final class FrameRecord {

    private final byte[] rawBuffer;
    private final byte[] processedBuffer;
    private final int width;
    private final int height;
    private final long timestampNs;

    public FrameRecord(byte[] rawBuffer, byte[] processedBuffer, int width, int height, long timestampNs) {
        this.rawBuffer = rawBuffer;
        this.processedBuffer = processedBuffer;
        this.width = width;
        this.height = height;
        this.timestampNs = timestampNs;
    }

    public byte[] getRawBuffer() { return rawBuffer; }
    public byte[] getProcessedBuffer() { return processedBuffer; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public long getTimestampNs() { return timestampNs; }
}

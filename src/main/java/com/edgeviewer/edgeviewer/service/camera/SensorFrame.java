package com.edgeviewer.edgeviewer.service.camera;

import java.nio.ByteBuffer;

/**
 * A frame as delivered by a capture source.
 *
 * The frame is only valid for the duration of one delivery and must be released with
 * {@link #close()} once the listener is done with it. A source that never gets its
 * frames back stops delivering new ones.
 */
public interface SensorFrame extends AutoCloseable {

    SensorFormat getFormat();

    int getWidth();

    int getHeight();

    /**
     * Planes in Y, U, V order for {@link SensorFormat#YUV_420_888}.
     */
    Plane[] getPlanes();

    /**
     * Hands the frame back to its source. Safe to call more than once.
     */
    @Override
    void close();

    /**
     * One image plane: a byte buffer addressed with a row stride and a pixel stride.
     */
    final class Plane {
        private final ByteBuffer buffer;
        private final int rowStride;
        private final int pixelStride;

        public Plane(ByteBuffer buffer, int rowStride, int pixelStride) {
            this.buffer = buffer;
            this.rowStride = rowStride;
            this.pixelStride = pixelStride;
        }

        /**
         * @return an independent view of the plane; reading it never moves the frame's own position
         */
        public ByteBuffer getBuffer() {
            return buffer.duplicate();
        }

        public int getRowStride() { return rowStride; }
        public int getPixelStride() { return pixelStride; }
    }
}

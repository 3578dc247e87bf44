package com.edgeviewer.edgeviewer.service.camera;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SensorFrame} backed by plain byte buffers, with a release callback that runs once.
 */
public class PlanarSensorFrame implements SensorFrame {

    private static final Runnable NO_OP = () -> { };

    private final SensorFormat format;
    private final int width;
    private final int height;
    private final Plane[] planes;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public PlanarSensorFrame(SensorFormat format, int width, int height, Plane[] planes, Runnable onRelease) {
        this.format = format;
        this.width = width;
        this.height = height;
        this.planes = planes.clone();
        this.onRelease = onRelease != null ? onRelease : NO_OP;
    }

    /**
     * Builds a tightly packed I420 frame: pixel stride 1 on every plane, chroma rows of {@code (width + 1) / 2}.
     */
    public static PlanarSensorFrame i420(int width, int height, byte[] y, byte[] u, byte[] v, Runnable onRelease) {
        int chromaStride = (width + 1) / 2;
        Plane[] planes = {
                new Plane(ByteBuffer.wrap(y), width, 1),
                new Plane(ByteBuffer.wrap(u), chromaStride, 1),
                new Plane(ByteBuffer.wrap(v), chromaStride, 1)
        };
        return new PlanarSensorFrame(SensorFormat.YUV_420_888, width, height, planes, onRelease);
    }

    @Override
    public SensorFormat getFormat() { return format; }

    @Override
    public int getWidth() { return width; }

    @Override
    public int getHeight() { return height; }

    @Override
    public Plane[] getPlanes() { return planes.clone(); }

    public boolean isReleased() { return released.get(); }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}

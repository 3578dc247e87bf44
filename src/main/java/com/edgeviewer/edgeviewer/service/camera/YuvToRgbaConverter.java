package com.edgeviewer.edgeviewer.service.camera;

import java.nio.ByteBuffer;

/**
 * Converts a YUV 4:2:0 frame into a packed RGBA buffer (R, G, B, A per pixel, alpha 255).
 *
 * Two luma rows and two luma columns share one chroma sample. Every plane is addressed
 * through its own row and pixel stride, so both planar (I420) and interleaved (NV12/NV21)
 * chroma layouts are handled.
 */
public final class YuvToRgbaConverter {

    private YuvToRgbaConverter() {
        // utility
    }

    /**
     * @param frame a {@link SensorFormat#YUV_420_888} frame with at least three planes
     * @return a fresh buffer of {@code width * height * 4} bytes
     */
    public static byte[] convert(SensorFrame frame) {
        int width = frame.getWidth();
        int height = frame.getHeight();
        SensorFrame.Plane[] planes = frame.getPlanes();
        SensorFrame.Plane yPlane = planes[0];
        SensorFrame.Plane uPlane = planes[1];
        SensorFrame.Plane vPlane = planes[2];

        byte[] yArray = toArray(yPlane.getBuffer());
        byte[] uArray = toArray(uPlane.getBuffer());
        byte[] vArray = toArray(vPlane.getBuffer());

        int yRowStride = yPlane.getRowStride();
        int yPixelStride = yPlane.getPixelStride();
        int uRowStride = uPlane.getRowStride();
        int uPixelStride = uPlane.getPixelStride();
        int vRowStride = vPlane.getRowStride();
        int vPixelStride = vPlane.getPixelStride();

        byte[] output = new byte[width * height * 4];

        int outputOffset = 0;
        for (int row = 0; row < height; row++) {
            int yRowOffset = yRowStride * row;
            int uRowOffset = uRowStride * (row / 2);
            int vRowOffset = vRowStride * (row / 2);
            for (int col = 0; col < width; col++) {
                int yValue = yArray[yRowOffset + col * yPixelStride] & 0xFF;
                int uValue = (uArray[uRowOffset + (col / 2) * uPixelStride] & 0xFF) - 128;
                int vValue = (vArray[vRowOffset + (col / 2) * vPixelStride] & 0xFF) - 128;

                int r = clamp(yValue + (int) (1.370705f * vValue));
                int g = clamp(yValue - (int) (0.337633f * uValue + 0.698001f * vValue));
                int b = clamp(yValue + (int) (1.732446f * uValue));

                output[outputOffset++] = (byte) r;
                output[outputOffset++] = (byte) g;
                output[outputOffset++] = (byte) b;
                output[outputOffset++] = (byte) 0xFF;
            }
        }

        return output;
    }

    private static byte[] toArray(ByteBuffer buffer) {
        byte[] array = new byte[buffer.remaining()];
        buffer.get(array);
        return array;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }
}

package com.edgeviewer.edgeviewer.service.camera;

/**
 * Pixel layouts a capture source may deliver. Only {@link #YUV_420_888} is analyzed.
 */
public enum SensorFormat {
    /** One full-resolution luma plane and two 2x2-subsampled chroma planes with their own strides. */
    YUV_420_888,
    RGBA_8888,
    JPEG,
    UNKNOWN
}

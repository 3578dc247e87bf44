package com.edgeviewer.edgeviewer.service.camera;

/**
 * Receives frames from a {@link CaptureSource}. Calls never overlap; the listener owns the
 * frame for the duration of the call and must release it before returning.
 */
@FunctionalInterface
public interface SensorFrameListener {

    void onFrame(SensorFrame frame);
}

package com.edgeviewer.edgeviewer.service.camera;

/**
 * The capture input could not be opened or bound.
 */
public class CaptureException extends Exception {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}

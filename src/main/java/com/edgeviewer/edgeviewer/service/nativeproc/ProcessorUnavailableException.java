package com.edgeviewer.edgeviewer.service.nativeproc;

/**
 * The native edge-detection routine could not be loaded. Not retried.
 */
public class ProcessorUnavailableException extends RuntimeException {

    public ProcessorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

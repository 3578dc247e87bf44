package com.edgeviewer.edgeviewer.service.nativeproc;

/**
 * Edge-detection routine invoked once per frame from the capture thread.
 */
public interface EdgeProcessor {

    /**
     * One-shot setup before the first {@link #process} call.
     *
     * @throws ProcessorUnavailableException if the native routine cannot be loaded
     */
    void configure(EdgeParameters parameters);

    /**
     * @param rgba   packed RGBA input of {@code width * height * 4} bytes; not modified
     * @param width  frame width
     * @param height frame height
     * @return a new RGBA buffer of the same size
     */
    byte[] process(byte[] rgba, int width, int height);
}

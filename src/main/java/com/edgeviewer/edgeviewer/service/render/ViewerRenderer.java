package com.edgeviewer.edgeviewer.service.render;

import com.edgeviewer.edgeviewer.service.display.DisplayState;
import com.edgeviewer.edgeviewer.service.display.FrameStateStore;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Puts the latest stored frame on the {@link RenderSurface}, raw or edge-processed
 * according to the display mode.
 */
@Component
public class ViewerRenderer {

    private static final long READ_TIMEOUT_MS = 2000;

    private final FrameStateStore stateStore;
    private final RenderSurface surface;

    public ViewerRenderer(FrameStateStore stateStore, RenderSurface surface) {
        this.stateStore = stateStore;
        this.surface = surface;
    }

    /**
     * Called after every published frame and after a display-mode change.
     * Does nothing until a frame has been published.
     */
    public void renderLatestFrame() {
        DisplayState state = stateStore.snapshot();
        if (!state.hasFrame()) {
            return;
        }
        surface.updateFrame(state.getDisplayBuffer(), state.getWidth(), state.getHeight());
    }

    /**
     * The last drawn image, encoded on the render thread.
     */
    public Optional<byte[]> readRenderedFrame(String formatName)
            throws InterruptedException, ExecutionException, TimeoutException {
        return surface.readPixels(formatName).get(READ_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    public void clear() {
        surface.clear();
    }

    public long getFramesRendered() {
        return surface.getFramesRendered();
    }
}

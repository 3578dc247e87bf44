package com.edgeviewer.edgeviewer.service.render;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drawing surface with its own render thread.
 *
 * {@link #updateFrame} can be called from any thread and only marks the surface dirty; the
 * draw runs later on the render thread. Requests that arrive while a draw is pending replace
 * each other, so a burst of updates costs one draw of the newest frame.
 */
@Component
public class RenderSurface {

    private static final Logger logger = LoggerFactory.getLogger(RenderSurface.class);

    private final ExecutorService renderExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "render-exec");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<PendingFrame> pending = new AtomicReference<>();
    private final FrameTexture texture = new FrameTexture();
    private final AtomicLong framesRendered = new AtomicLong();

    public void updateFrame(byte[] buffer, int width, int height) {
        if (pending.getAndSet(new PendingFrame(buffer, width, height)) != null) {
            return;
        }
        try {
            renderExecutor.execute(this::drawPending);
        } catch (RejectedExecutionException e) {
            pending.set(null);
            logger.debug("Render thread is shut down, frame ignored");
        }
    }

    private void drawPending() {
        PendingFrame frame = pending.getAndSet(null);
        if (frame == null) {
            return;
        }
        try {
            present(frame.buffer, frame.width, frame.height);
        } catch (RuntimeException e) {
            logger.warn("Failed to present {}x{} frame: {}", frame.width, frame.height, e.getMessage());
        }
    }

    /**
     * Uploads the buffer and redraws. Render thread only.
     */
    void present(byte[] buffer, int width, int height) {
        texture.upload(buffer, width, height);
        framesRendered.incrementAndGet();
    }

    /**
     * Reads the current texture back on the render thread.
     *
     * @param formatName ImageIO format name, {@code "jpeg"} or {@code "png"}
     */
    public CompletableFuture<Optional<byte[]>> readPixels(String formatName) {
        return CompletableFuture.supplyAsync(() -> texture.encode(formatName), renderExecutor);
    }

    /**
     * Drops the texture contents, e.g. when a new capture session starts.
     */
    public void clear() {
        try {
            renderExecutor.execute(texture::clear);
        } catch (RejectedExecutionException e) {
            logger.debug("Render thread is shut down, nothing to clear");
        }
    }

    public long getFramesRendered() {
        return framesRendered.get();
    }

    @PreDestroy
    public void shutdown() {
        renderExecutor.shutdownNow();
    }

    private static final class PendingFrame {
        private final byte[] buffer;
        private final int width;
        private final int height;

        private PendingFrame(byte[] buffer, int width, int height) {
            this.buffer = buffer;
            this.width = width;
            this.height = height;
        }
    }
}

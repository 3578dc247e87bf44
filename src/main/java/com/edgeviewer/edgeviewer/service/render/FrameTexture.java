package com.edgeviewer.edgeviewer.service.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Off-screen 2D texture the viewer draws into. Confined to the render thread.
 *
 * Frames are opaque, so the alpha channel of uploaded RGBA data is dropped and pixels are
 * stored as 3-byte BGR, the layout ImageIO encodes directly.
 */
class FrameTexture {

    private static final Logger logger = LoggerFactory.getLogger(FrameTexture.class);

    private BufferedImage image;

    /**
     * Copies an RGBA buffer into the texture, re-allocating it when the size changed.
     */
    void upload(byte[] rgba, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid texture size " + width + "x" + height);
        }
        int pixelCount = width * height;
        if (rgba == null || rgba.length < pixelCount * 4) {
            throw new IllegalArgumentException("Buffer too small for " + width + "x" + height + " RGBA");
        }

        if (image == null || image.getWidth() != width || image.getHeight() != height) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
            logger.debug("Texture allocated: {}x{}", width, height);
        }

        byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        for (int src = 0, dst = 0; dst < pixelCount * 3; src += 4, dst += 3) {
            pixels[dst] = rgba[src + 2];
            pixels[dst + 1] = rgba[src + 1];
            pixels[dst + 2] = rgba[src];
        }
    }

    /**
     * @param formatName an ImageIO format name such as {@code "jpeg"} or {@code "png"}
     * @return the encoded texture, or empty when nothing was uploaded yet
     */
    Optional<byte[]> encode(String formatName) {
        if (image == null) {
            return Optional.empty();
        }
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, formatName, out)) {
                throw new IllegalArgumentException("No image writer for format " + formatName);
            }
            return Optional.of(out.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException("Encoding texture as " + formatName + " failed", e);
        }
    }

    void clear() {
        image = null;
    }

    int getWidth() {
        return image != null ? image.getWidth() : 0;
    }

    int getHeight() {
        return image != null ? image.getHeight() : 0;
    }
}

package com.edgeviewer.edgeviewer.service.nativeproc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class OpenCvEdgeProcessorTest {

    private static final int WIDTH = 32;
    private static final int HEIGHT = 24;

    private OpenCvEdgeProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new OpenCvEdgeProcessor();
    }

    private static EdgeParameters defaults() {
        return EdgeParameters.builder()
                .lowThreshold(60)
                .highThreshold(180)
                .blurRadius(5)
                .equalizeHistogram(true)
                .build();
    }

    private static byte[] uniform(int value) {
        byte[] rgba = new byte[WIDTH * HEIGHT * 4];
        for (int i = 0; i < rgba.length; i += 4) {
            rgba[i] = (byte) value;
            rgba[i + 1] = (byte) value;
            rgba[i + 2] = (byte) value;
            rgba[i + 3] = (byte) 0xFF;
        }
        return rgba;
    }

    @Test
    void testProcess_UniformImageHasNoEdges() {
        processor.configure(defaults());

        byte[] result = processor.process(uniform(128), WIDTH, HEIGHT);

        assertEquals(WIDTH * HEIGHT * 4, result.length);
        for (int i = 0; i < result.length; i += 4) {
            assertEquals(0, result[i]);
            assertEquals(0, result[i + 1]);
            assertEquals(0, result[i + 2]);
            assertEquals((byte) 0xFF, result[i + 3]);
        }
    }

    @Test
    void testProcess_DetectsVerticalBoundary() {
        processor.configure(defaults());
        byte[] rgba = uniform(0);
        for (int row = 0; row < HEIGHT; row++) {
            for (int col = WIDTH / 2; col < WIDTH; col++) {
                int offset = (row * WIDTH + col) * 4;
                Arrays.fill(rgba, offset, offset + 3, (byte) 0xFF);
            }
        }

        byte[] result = processor.process(rgba, WIDTH, HEIGHT);

        int edgePixels = 0;
        for (int i = 0; i < result.length; i += 4) {
            if (result[i] != 0) {
                edgePixels++;
            }
        }
        assertTrue(edgePixels >= HEIGHT / 2, "expected an edge along the boundary, got " + edgePixels);
    }

    @Test
    void testProcess_DoesNotModifyInput() {
        processor.configure(defaults());
        byte[] input = uniform(90);
        byte[] copy = input.clone();

        processor.process(input, WIDTH, HEIGHT);

        assertArrayEquals(copy, input);
    }

    @Test
    void testProcess_RequiresConfigure() {
        assertThrows(IllegalStateException.class, () -> processor.process(uniform(0), WIDTH, HEIGHT));
    }

    @Test
    void testProcess_RejectsWrongLength() {
        processor.configure(defaults());

        assertThrows(IllegalArgumentException.class, () -> processor.process(new byte[10], WIDTH, HEIGHT));
    }
}

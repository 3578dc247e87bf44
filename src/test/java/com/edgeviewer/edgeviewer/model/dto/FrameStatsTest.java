package com.edgeviewer.edgeviewer.model.dto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FrameStatsTest {

    @Test
    void testGetText_OneDecimalRegardlessOfDefaultLocale() {
        FrameStats stats = FrameStats.builder().fps(29.97).width(1280).height(720).mode(FrameStats.MODE_RAW).build();

        assertEquals("30.0 fps, 1280x720, Raw", stats.getText());
    }

    @Test
    void testGetText_ZeroRate() {
        FrameStats stats = new FrameStats(0, 2, 2, FrameStats.MODE_EDGES);

        assertEquals("0.0 fps, 2x2, Edges", stats.getText());
    }
}

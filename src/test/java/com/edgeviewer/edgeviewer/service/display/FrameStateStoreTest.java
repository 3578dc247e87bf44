package com.edgeviewer.edgeviewer.service.display;

import com.edgeviewer.edgeviewer.model.dto.FrameStats;
import com.edgeviewer.edgeviewer.service.camera.FrameRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class FrameStateStoreTest {

    private FrameStateStore store;

    @BeforeEach
    void setUp() {
        store = new FrameStateStore();
    }

    private static FrameRecord record(int width, int height, long timestamp) {
        return new FrameRecord(new byte[width * height * 4], new byte[width * height * 4], width, height, timestamp);
    }

    @Test
    void testSnapshot_EmptyBeforeFirstFrame() {
        DisplayState state = store.snapshot();

        assertFalse(state.hasFrame());
        assertEquals(0, state.getWidth());
        assertEquals(0, state.getHeight());
        assertNull(state.getDisplayBuffer());
        assertFalse(state.isShowRaw());
    }

    @Test
    void testPublish_SnapshotReturnsPublishedRecord() {
        FrameRecord record = record(4, 3, 42L);

        store.publish(record);
        DisplayState state = store.snapshot();

        assertTrue(state.hasFrame());
        assertSame(record.getRawBuffer(), state.getRawBuffer());
        assertSame(record.getProcessedBuffer(), state.getProcessedBuffer());
        assertEquals(4, state.getWidth());
        assertEquals(3, state.getHeight());
        assertEquals(42L, state.getLastTimestampNs());
    }

    @Test
    void testPublish_LatestWins() {
        for (int i = 1; i <= 50; i++) {
            store.publish(record(i, 1, i));
        }

        assertEquals(50, store.snapshot().getWidth());
        assertEquals(50L, store.snapshot().getLastTimestampNs());
    }

    @Test
    void testPublish_RejectsNull() {
        assertThrows(NullPointerException.class, () -> store.publish(null));
    }

    @Test
    void testShowRaw_SelectsDisplayBuffer() {
        FrameRecord record = record(2, 2, 1L);
        store.publish(record);

        assertSame(record.getProcessedBuffer(), store.snapshot().getDisplayBuffer());
        assertEquals(FrameStats.MODE_EDGES, store.snapshot().getModeLabel());

        store.setShowRaw(true);

        assertSame(record.getRawBuffer(), store.snapshot().getDisplayBuffer());
        assertEquals(FrameStats.MODE_RAW, store.snapshot().getModeLabel());
    }

    @Test
    void testReset_ClearsFramesButKeepsMode() {
        store.publish(record(2, 2, 1L));
        store.setShowRaw(true);

        store.reset();

        assertFalse(store.snapshot().hasFrame());
        assertTrue(store.isShowRaw());
    }

    @Test
    void testSnapshot_NeverMixesTwoFrames() throws InterruptedException {
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<String> mismatch = new AtomicReference<>();

        Thread writer = new Thread(() -> {
            int i = 0;
            while (running.get()) {
                int width = 1 + (i++ % 64);
                store.publish(record(width, 1 + width % 7, i));
            }
        });
        Thread reader = new Thread(() -> {
            for (int i = 0; i < 200_000 && mismatch.get() == null; i++) {
                DisplayState state = store.snapshot();
                if (!state.hasFrame()) {
                    continue;
                }
                int expected = state.getWidth() * state.getHeight() * 4;
                if (state.getRawBuffer().length != expected || state.getProcessedBuffer().length != expected) {
                    mismatch.set(state.getWidth() + "x" + state.getHeight() + " with "
                            + state.getRawBuffer().length + " bytes");
                }
            }
        });

        writer.start();
        reader.start();
        reader.join(30_000);
        running.set(false);
        writer.join(5_000);

        assertNull(mismatch.get());
    }
}

package com.edgeviewer.edgeviewer.service.camera;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.junit.jupiter.api.Test;

import java.nio.Buffer;
import java.nio.ByteBuffer;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GrabberCaptureSourceTest {

    private final GrabberCaptureSource source = new GrabberCaptureSource(null, "/dev/video0");

    private static Frame i420Frame(int width, int height, int stride, byte[] data) {
        Frame frame = new Frame();
        frame.imageWidth = width;
        frame.imageHeight = height;
        frame.imageStride = stride;
        frame.imageDepth = Frame.DEPTH_UBYTE;
        frame.imageChannels = 1;
        frame.image = new Buffer[] {ByteBuffer.wrap(data)};
        return frame;
    }

    @Test
    void testToSensorFrame_SplitsContiguousBufferIntoPlanes() {
        byte[] y = {10, 20, 30, 40, 50, 60, 70, 80};
        byte[] u = {(byte) 90, (byte) 170};
        byte[] v = {(byte) 140, (byte) 60};
        byte[] data = new byte[12];
        System.arraycopy(y, 0, data, 0, 8);
        System.arraycopy(u, 0, data, 8, 2);
        System.arraycopy(v, 0, data, 10, 2);

        SensorFrame frame = source.toSensorFrame(i420Frame(4, 2, 4, data));

        assertEquals(SensorFormat.YUV_420_888, frame.getFormat());
        assertEquals(3, frame.getPlanes().length);
        assertEquals(4, frame.getPlanes()[0].getRowStride());
        assertEquals(2, frame.getPlanes()[1].getRowStride());
        byte[] expected = YuvToRgbaConverter.convert(PlanarSensorFrame.i420(4, 2, y, u, v, null));
        assertArrayEquals(expected, YuvToRgbaConverter.convert(frame));
    }

    @Test
    void testToSensorFrame_CopiesBuffer() {
        byte[] data = new byte[12];
        SensorFrame frame = source.toSensorFrame(i420Frame(4, 2, 4, data));

        data[0] = 99;

        assertEquals(0, frame.getPlanes()[0].getBuffer().get(0));
    }

    @Test
    void testToSensorFrame_ShortBufferIsUnknownFormat() {
        SensorFrame frame = source.toSensorFrame(i420Frame(4, 2, 4, new byte[8]));

        assertEquals(SensorFormat.UNKNOWN, frame.getFormat());
        assertEquals(0, frame.getPlanes().length);
    }

    @Test
    void testDescribe_NamesUrl() {
        assertEquals("grabber:/dev/video0", source.describe());
        assertFalse(source.isRunning());
    }

    private static GrabberCaptureSource sourceFor(FFmpegFrameGrabber grabber, long joinTimeoutMs) {
        return new GrabberCaptureSource(mock(FFmpegGrabberConfig.class), "rtsp://camera/stream",
                url -> grabber, joinTimeoutMs);
    }

    private static void awaitStopped(GrabberCaptureSource capture) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (capture.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void testStop_ReleasesGrabberOnce() throws Exception {
        FFmpegFrameGrabber grabber = mock(FFmpegFrameGrabber.class);
        GrabberCaptureSource capture = sourceFor(grabber, 5_000);

        capture.start(SensorFrame::close, Runnable::run);
        assertTrue(capture.isRunning());
        capture.stop();

        assertFalse(capture.isRunning());
        verify(grabber, times(1)).stop();
        verify(grabber, times(1)).release();
    }

    @Test
    void testStop_LeavesGrabberToThreadStuckInGrab() throws Exception {
        FFmpegFrameGrabber grabber = mock(FFmpegFrameGrabber.class);
        CountDownLatch inGrab = new CountDownLatch(1);
        AtomicBoolean grabReturns = new AtomicBoolean();
        when(grabber.grabImage()).thenAnswer(invocation -> {
            inGrab.countDown();
            // native grabs ignore interrupts
            boolean interrupted = false;
            while (!grabReturns.get()) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return null;
        });
        GrabberCaptureSource capture = sourceFor(grabber, 50);

        capture.start(SensorFrame::close, Runnable::run);
        assertTrue(inGrab.await(5, TimeUnit.SECONDS));
        capture.stop();

        verify(grabber, never()).stop();
        verify(grabber, never()).release();

        grabReturns.set(true);

        verify(grabber, timeout(5_000)).release();
        verify(grabber, times(1)).stop();
    }

    @Test
    void testIsRunning_FalseAfterGrabLoopFails() throws Exception {
        FFmpegFrameGrabber grabber = mock(FFmpegFrameGrabber.class);
        when(grabber.grabImage()).thenThrow(new FFmpegFrameGrabber.Exception("stream closed"));
        GrabberCaptureSource capture = sourceFor(grabber, 5_000);

        capture.start(SensorFrame::close, Runnable::run);
        awaitStopped(capture);

        assertFalse(capture.isRunning());
        // the failed loop keeps the grabber until stop
        verify(grabber, never()).release();

        capture.stop();
        verify(grabber, times(1)).release();
    }
}

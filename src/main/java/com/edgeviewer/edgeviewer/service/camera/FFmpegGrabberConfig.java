package com.edgeviewer.edgeviewer.service.camera;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Configures the FFmpeg frame grabber for low-latency camera capture in YUV 4:2:0
 */
@Component
public class FFmpegGrabberConfig {

    @Value("${edgeviewer.capture.format:v4l2}")
    private String inputFormat;

    @Value("${edgeviewer.capture.width:640}")
    private int imageWidth;

    @Value("${edgeviewer.capture.height:480}")
    private int imageHeight;

    @Value("${edgeviewer.capture.frame-rate:30}")
    private double frameRate;

    /**
     * Configure and start the grabber.
     * Local devices get the requested size and rate; network streams keep the size the camera sends.
     *
     * @param grabber The FFmpegFrameGrabber to configure
     * @param url     Device path or stream URL
     * @throws Exception if the input cannot be opened
     */
    public void configureGrabber(FFmpegFrameGrabber grabber, String url) throws Exception {
        boolean rtsp = url.startsWith("rtsp://");
        boolean network = rtsp || url.startsWith("http://") || url.startsWith("https://");

        if (rtsp) {
            grabber.setFormat("rtsp");
            grabber.setOption("rtsp_transport", "tcp");
            grabber.setOption("rtsp_flags", "prefer_tcp");
            // microseconds
            grabber.setOption("stimeout", "5000000");
            grabber.setOption("rw_timeout", "5000000");
        } else if (!network && inputFormat != null && !inputFormat.isBlank()) {
            grabber.setFormat(inputFormat);
        }

        if (!network) {
            grabber.setImageWidth(imageWidth);
            grabber.setImageHeight(imageHeight);
            grabber.setFrameRate(frameRate);
        }

        // Decoded frames are scaled into one contiguous I420 buffer
        grabber.setImageMode(FrameGrabber.ImageMode.COLOR);
        grabber.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);

        // Latency over completeness
        grabber.setOption("fflags", "+discardcorrupt+nobuffer");
        grabber.setOption("flags", "low_delay");
        grabber.setOption("analyzeduration", "1000000");
        grabber.setOption("probesize", "1000000");
        grabber.setOption("threads", "1");

        grabber.start();
    }

    public String getInputFormat() { return inputFormat; }
    public int getImageWidth() { return imageWidth; }
    public int getImageHeight() { return imageHeight; }
    public double getFrameRate() { return frameRate; }
}

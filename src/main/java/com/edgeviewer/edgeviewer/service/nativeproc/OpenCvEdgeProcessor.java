package com.edgeviewer.edgeviewer.service.nativeproc;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC4;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_GRAY2RGBA;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_RGBA2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.Canny;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.equalizeHist;

/**
 * Edge detection using JavaCV (OpenCV wrapper)
 *
 * Pipeline per frame: RGBA to gray, optional histogram equalization, optional Gaussian blur,
 * Canny, then gray back to RGBA so the result can be displayed like the camera image.
 *
 * Usage:
 * EdgeProcessor processor = new OpenCvEdgeProcessor();
 * processor.configure(parameters);
 * byte[] edges = processor.process(rgba, width, height);
 */
public class OpenCvEdgeProcessor implements EdgeProcessor {

    private static final Logger logger = LoggerFactory.getLogger(OpenCvEdgeProcessor.class);

    private volatile EdgeParameters parameters;

    @Override
    public void configure(EdgeParameters parameters) {
        try {
            Loader.load(opencv_imgproc.class);
        } catch (LinkageError e) {
            throw new ProcessorUnavailableException("OpenCV native libraries could not be loaded", e);
        }
        this.parameters = parameters;
        logger.info("Edge processor configured: {}", parameters);
    }

    @Override
    public byte[] process(byte[] rgba, int width, int height) {
        EdgeParameters current = parameters;
        if (current == null) {
            throw new IllegalStateException("Edge processor not configured. Call configure() first.");
        }

        int expected = width * height * 4;
        if (width <= 0 || height <= 0 || rgba.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " RGBA bytes for "
                    + width + "x" + height + ", got " + rgba.length);
        }

        try (BytePointer input = new BytePointer(rgba);
             Mat source = new Mat(height, width, CV_8UC4, input);
             Mat gray = new Mat();
             Mat edges = new Mat();
             Mat output = new Mat()) {

            cvtColor(source, gray, COLOR_RGBA2GRAY);

            if (current.isEqualizeHistogram()) {
                equalizeHist(gray, gray);
            }

            int kernel = current.blurKernelSize();
            if (kernel > 0) {
                try (Size kernelSize = new Size(kernel, kernel)) {
                    GaussianBlur(gray, gray, kernelSize, 0);
                }
            }

            Canny(gray, edges, current.getLowThreshold(), current.getHighThreshold());
            cvtColor(edges, output, COLOR_GRAY2RGBA);

            byte[] result = new byte[expected];
            output.data().get(result);
            return result;
        }
    }
}

package com.mosaic.imageOperator;

import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.mean;

/**
 * Global brightness shift: moves B, G and R by the same amount so the grayscale mean of the
 * image lands on a target value. Alpha is left alone.
 */
public class BrightnessNormalizer {

    /**
     * @return a new BGRA image, the input is not modified
     */
    public Mat normalize(Mat image, double targetMean) {
        Mat bgra = ColourImageToGray.toBgra(image);
        double delta = grayMean(bgra) - targetMean;

        int rows = bgra.rows();
        int cols = bgra.cols();
        try (UByteIndexer idx = bgra.createIndexer()) {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    for (int c = 0; c < 3; c++) {
                        idx.put(y, x, c, clamp(idx.get(y, x, c) - delta));
                    }
                }
            }
        }
        return bgra;
    }

    public static double grayMean(Mat image) {
        Mat gray = ColourImageToGray.toGray(image);
        try {
            return mean(gray).get(0);
        } finally {
            gray.release();
        }
    }

    static int clamp(double v) {
        long r = Math.round(v);
        if (r < 0) return 0;
        if (r > 255) return 255;
        return (int) r;
    }
}

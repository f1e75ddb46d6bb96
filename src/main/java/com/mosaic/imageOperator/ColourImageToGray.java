package com.mosaic.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.NORM_MINMAX;
import static org.bytedeco.opencv.global.opencv_core.normalize;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Stateless per-pixel colour conversions used around the stitcher.
 */
public final class ColourImageToGray {

    private ColourImageToGray() {
    }

    /** Returns a new 4 channel BGRA copy of a 1, 3 or 4 channel 8-bit image. */
    public static Mat toBgra(Mat image) {
        requireImage(image);
        Mat bgra = new Mat();
        switch (image.channels()) {
            case 1:
                cvtColor(image, bgra, COLOR_GRAY2BGRA);
                break;
            case 3:
                cvtColor(image, bgra, COLOR_BGR2BGRA);
                break;
            case 4:
                image.copyTo(bgra);
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + image.channels());
        }
        return bgra;
    }

    /** Luma (0.299 R + 0.587 G + 0.114 B) of a 1, 3 or 4 channel image. */
    public static Mat toGray(Mat image) {
        requireImage(image);
        Mat gray = new Mat();
        switch (image.channels()) {
            case 1:
                image.copyTo(gray);
                break;
            case 3:
                cvtColor(image, gray, COLOR_BGR2GRAY);
                break;
            case 4:
                cvtColor(image, gray, COLOR_BGRA2GRAY);
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + image.channels());
        }
        return gray;
    }

    /** Min-max stretches a single channel image to [0, 255]. */
    public static Mat normalizeToRange(Mat gray) {
        requireImage(gray);
        Mat out = new Mat();
        normalize(gray, out, 0, 255, NORM_MINMAX, CV_8U, new Mat());
        return out;
    }

    private static void requireImage(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Image is null or empty");
        }
    }
}

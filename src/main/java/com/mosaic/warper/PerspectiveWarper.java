package com.mosaic.warper;

import com.mosaic.homography.HomographyMatrix;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

public class PerspectiveWarper implements ImageWarper {

    @Override
    public Mat warp(Mat image, HomographyMatrix transform, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid warp size: " + width + "x" + height);
        }
        Mat H = transform.toMat();
        Mat warped = new Mat();
        try {
            warpPerspective(image, warped, H, new Size(width, height),
                    INTER_LINEAR, BORDER_CONSTANT, new Scalar(0, 0, 0, 0));
        } finally {
            H.release();
        }
        return warped;
    }
}

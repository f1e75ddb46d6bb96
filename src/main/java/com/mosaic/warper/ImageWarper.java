package com.mosaic.warper;

import com.mosaic.homography.HomographyMatrix;
import org.bytedeco.opencv.opencv_core.Mat;

public interface ImageWarper {

    /**
     * Resamples {@code image} through {@code transform} into a {@code width x height} buffer.
     * Output pixels whose source falls outside the image are zero.
     */
    Mat warp(Mat image, HomographyMatrix transform, int width, int height);
}

package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_core.Mat;

public interface FeatureExtractor {

    /**
     * Detects keypoints on a single channel 8-bit image and computes one descriptor per keypoint.
     */
    ImageFeatures extract(Mat gray);
}

package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_features2d.SIFT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class SiftFeatureExtractor implements FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SiftFeatureExtractor.class);

    private final SIFT detector;

    public SiftFeatureExtractor() {
        this.detector = SIFT.create();
    }

    @Override
    public ImageFeatures extract(Mat gray) {
        if (gray.empty()) {
            throw new IllegalArgumentException("Cannot extract features from an empty image");
        }
        if (gray.channels() != 1) {
            throw new IllegalArgumentException("Expected a single channel image, got " + gray.channels() + " channels");
        }

        KeyPointVector kps = new KeyPointVector();
        Mat descriptors = new Mat();
        detector.detectAndCompute(gray, new Mat(), kps, descriptors, false);

        List<Keypoint> keypoints = new ArrayList<>((int) kps.size());
        for (long i = 0; i < kps.size(); i++) {
            KeyPoint kp = kps.get(i);
            Point2f pt = kp.pt();
            keypoints.add(new Keypoint(pt.x(), pt.y()));
        }
        kps.close();

        logger.debug("SIFT found {} keypoints on {}x{} image", keypoints.size(), gray.cols(), gray.rows());
        return new ImageFeatures(keypoints, descriptors);
    }
}

package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

public class BruteForceKnnMatcher extends OpenCvKnnMatcher {
    private final BFMatcher matcher;

    public BruteForceKnnMatcher() {
        // crossCheck must stay off, it limits knnMatch to a single neighbour
        this.matcher = new BFMatcher(NORM_L2, false);
    }

    @Override
    protected DescriptorMatcher matcher() {
        return matcher;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.EXHAUSTIVE;
    }
}

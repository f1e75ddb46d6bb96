package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;
import org.bytedeco.opencv.opencv_features2d.FlannBasedMatcher;

public class FlannKnnMatcher extends OpenCvKnnMatcher {
    private final FlannBasedMatcher matcher;

    public FlannKnnMatcher() {
        this.matcher = new FlannBasedMatcher();
    }

    @Override
    protected DescriptorMatcher matcher() {
        return matcher;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.APPROXIMATE;
    }
}

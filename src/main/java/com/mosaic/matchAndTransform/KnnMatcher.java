package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

public interface KnnMatcher {

    /**
     * Finds, for every row of {@code query}, its nearest and second nearest row of {@code train}.
     * Returns an empty list when either side has fewer than two descriptors.
     */
    List<NeighborPair> knn(Mat query, Mat train);

    MatchStrategy strategy();
}

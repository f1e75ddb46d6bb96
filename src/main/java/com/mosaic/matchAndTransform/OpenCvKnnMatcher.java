package com.mosaic.matchAndTransform;

import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * k=2 matching on top of an OpenCV {@link DescriptorMatcher}.
 */
abstract class OpenCvKnnMatcher implements KnnMatcher {

    protected abstract DescriptorMatcher matcher();

    @Override
    public List<NeighborPair> knn(Mat query, Mat train) {
        if (query.empty() || train.empty() || query.rows() < 2 || train.rows() < 2) {
            return Collections.emptyList();
        }

        DMatchVectorVector knnMatches = new DMatchVectorVector();
        try {
            matcher().knnMatch(query, train, knnMatches, 2);

            List<NeighborPair> pairs = new ArrayList<>((int) knnMatches.size());
            for (long i = 0; i < knnMatches.size(); i++) {
                DMatchVector matches = knnMatches.get(i);
                if (matches.size() < 2) continue;

                DMatch m = matches.get(0);
                DMatch n = matches.get(1);
                pairs.add(new NeighborPair(m.queryIdx(), m.trainIdx(), m.distance(), n.trainIdx(), n.distance()));
            }
            return pairs;
        } finally {
            knnMatches.close();
        }
    }
}

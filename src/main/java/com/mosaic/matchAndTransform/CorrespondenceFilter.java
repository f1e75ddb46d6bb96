package com.mosaic.matchAndTransform;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowe ratio test over k=2 neighbour candidates.
 */
public class CorrespondenceFilter {
    public static final double DEFAULT_RATIO = 0.75;

    private final double ratioThreshold;

    public CorrespondenceFilter() {
        this(DEFAULT_RATIO);
    }

    public CorrespondenceFilter(double ratioThreshold) {
        if (!(ratioThreshold > 0.0 && ratioThreshold <= 1.0)) {
            throw new IllegalArgumentException("Ratio threshold must be in (0, 1], got " + ratioThreshold);
        }
        this.ratioThreshold = ratioThreshold;
    }

    public double getRatioThreshold() {
        return ratioThreshold;
    }

    /**
     * Keeps a candidate only if its nearest distance is below {@code ratio * secondDistance}.
     * The query keypoint becomes the frame side of the correspondence, the nearest train keypoint
     * the reference side. Accepted pairs keep their input order.
     */
    public List<Correspondence> filter(List<NeighborPair> candidates, List<Keypoint> queryKeypoints,
                                       List<Keypoint> trainKeypoints) {
        List<Correspondence> accepted = new ArrayList<>();
        for (NeighborPair pair : candidates) {
            // strict inequality: equal distances are ambiguous, also rejects 0 < 0
            if (!(pair.getNearestDistance() < ratioThreshold * pair.getSecondDistance())) continue;

            Keypoint p1 = queryKeypoints.get(pair.getQueryIdx());
            Keypoint p2 = trainKeypoints.get(pair.getNearestIdx());
            accepted.add(new Correspondence(p1.getX(), p1.getY(), p2.getX(), p2.getY()));
        }
        return accepted;
    }

    /** Runs {@code matcher} between frame and reference features, then the ratio test. */
    public List<Correspondence> match(KnnMatcher matcher, ImageFeatures frame, ImageFeatures reference) {
        if (frame.size() < 2 || reference.size() < 2) {
            return new ArrayList<>();
        }
        List<NeighborPair> candidates = matcher.knn(frame.getDescriptors(), reference.getDescriptors());
        return filter(candidates, frame.getKeypoints(), reference.getKeypoints());
    }
}

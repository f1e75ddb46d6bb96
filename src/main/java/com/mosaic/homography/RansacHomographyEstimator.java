package com.mosaic.homography;

import com.mosaic.matchAndTransform.Correspondence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Random sample consensus over {@link HomographyEstimator}.
 * <p>
 * Every sample is drawn from the injected {@link Random} before any trial is scored, so a seeded
 * generator gives the same answer whether the trials run sequentially or in parallel. Trials are
 * reduced by inlier count, the earliest trial winning ties.
 */
public class RansacHomographyEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RansacHomographyEstimator.class);

    private final HomographyEstimator estimator;
    private final Random random;
    private final boolean parallel;

    public RansacHomographyEstimator(HomographyEstimator estimator, Random random) {
        this(estimator, random, false);
    }

    public RansacHomographyEstimator(HomographyEstimator estimator, Random random, boolean parallel) {
        this.estimator = estimator;
        this.random = random;
        this.parallel = parallel;
    }

    /**
     * @param matches         all candidate correspondences
     * @param sampleSize      correspondences fitted per trial, at least 4
     * @param inlierThreshold squared reprojection error below which a match counts as inlier
     * @param iterations      number of trials; a degenerate sample still uses up its trial
     * @return the homography refitted on the largest inlier set, or null if no trial produced
     * a usable model
     */
    public HomographyMatrix estimate(List<Correspondence> matches, int sampleSize, double inlierThreshold, int iterations) {
        if (sampleSize < HomographyEstimator.MIN_CORRESPONDENCES) {
            throw new IllegalArgumentException("Sample size must be at least "
                    + HomographyEstimator.MIN_CORRESPONDENCES + ", got " + sampleSize);
        }
        if (sampleSize > matches.size()) {
            throw new IllegalArgumentException("Sample size " + sampleSize + " exceeds the "
                    + matches.size() + " available matches");
        }
        if (iterations <= 0) return null;

        // snapshot so later changes to the caller's list cannot leak into the inlier sets
        List<Correspondence> pool = new ArrayList<>(matches);

        int[][] samples = new int[iterations][];
        for (int i = 0; i < iterations; i++) {
            samples[i] = drawSample(pool.size(), sampleSize);
        }

        IntStream trials = IntStream.range(0, iterations);
        if (parallel) trials = trials.parallel();
        TrialResult[] results = new TrialResult[iterations];
        trials.forEach(i -> results[i] = runTrial(pool, samples[i], inlierThreshold));

        TrialResult best = null;
        for (TrialResult r : results) {
            if (r == null || r.inliers.isEmpty()) continue;
            if (best == null || r.inliers.size() > best.inliers.size()) best = r;
        }

        if (best == null) {
            logger.debug("RANSAC: no usable model in {} trials over {} matches", iterations, pool.size());
            return null;
        }

        logger.debug("RANSAC: best inliers {}/{} after {} trials", best.inliers.size(), pool.size(), iterations);
        if (best.inliers.size() < HomographyEstimator.MIN_CORRESPONDENCES) {
            return null;
        }
        try {
            return estimator.solve(best.inliers);
        } catch (DegenerateHomographyException e) {
            logger.debug("RANSAC: refit on best inlier set is degenerate: {}", e.getMessage());
            return null;
        }
    }

    /** Partial Fisher-Yates shuffle, k distinct indices out of n. */
    private int[] drawSample(int n, int k) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) idx[i] = i;
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        int[] sample = new int[k];
        System.arraycopy(idx, 0, sample, 0, k);
        return sample;
    }

    private TrialResult runTrial(List<Correspondence> pool, int[] sample, double inlierThreshold) {
        List<Correspondence> points = new ArrayList<>(sample.length);
        for (int i : sample) points.add(pool.get(i));

        HomographyMatrix H;
        try {
            H = estimator.solve(points);
        } catch (DegenerateHomographyException e) {
            return null;
        }

        double[] errors = estimator.reprojectionError(pool, H);
        List<Correspondence> inliers = new ArrayList<>();
        for (int i = 0; i < errors.length; i++) {
            if (errors[i] < inlierThreshold) inliers.add(pool.get(i));
        }
        return new TrialResult(Collections.unmodifiableList(inliers));
    }

    private static final class TrialResult {
        final List<Correspondence> inliers;

        TrialResult(List<Correspondence> inliers) {
            this.inliers = inliers;
        }
    }
}

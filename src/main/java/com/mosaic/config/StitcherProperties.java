package com.mosaic.config;

import com.mosaic.blender.BlendPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Every tunable of the stitcher, bound from {@code mosaic.stitcher.*}. Keys outside this set
 * are rejected at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "mosaic.stitcher", ignoreUnknownFields = false)
public class StitcherProperties {
    public static final int SAMPLE_SIZE_FLOOR = 4;

    /** Grayscale mean every frame is shifted to before matching. */
    private double targetBrightness = 128.0;

    private BlendPolicy blendPolicy = BlendPolicy.WEIGHTED_OVERLAP;

    /** Weight of the new frame where it overlaps existing content (weighted overlap policy). */
    private double blendMix = 0.75;

    /** Smallest accepted ratio of projected frame area to original frame area. */
    private double minAreaRatio = 0.1;

    /** Lowe ratio test threshold. */
    private double ratioTestThreshold = 0.75;

    /** Attempts per pass before the frame is given up (or retried against the whole mosaic). */
    private int maxAttempts = 5;

    /** Retry a failed frame once against the whole mosaic instead of the previous frame. */
    private boolean retryWholeImage = true;

    private int initialSampleSize = 16;

    private int minimumSampleSize = SAMPLE_SIZE_FLOOR;

    /** Squared reprojection error, in pixels^2, below which a match is an inlier. */
    private double inlierThreshold = 5.0;

    private int initialIterations = 1000;

    /** Extra RANSAC iterations granted on each further attempt. */
    private int iterationStep = 250;

    /**
     * @throws IllegalArgumentException on the first inconsistent value
     */
    public StitcherProperties validate() {
        check(targetBrightness >= 0 && targetBrightness <= 255, "targetBrightness must be in [0, 255]");
        check(blendPolicy != null, "blendPolicy must be set");
        check(blendMix >= 0 && blendMix <= 1, "blendMix must be in [0, 1]");
        check(minAreaRatio > 0, "minAreaRatio must be positive");
        check(ratioTestThreshold > 0 && ratioTestThreshold <= 1, "ratioTestThreshold must be in (0, 1]");
        check(maxAttempts >= 1, "maxAttempts must be at least 1");
        check(minimumSampleSize >= SAMPLE_SIZE_FLOOR, "minimumSampleSize must be at least " + SAMPLE_SIZE_FLOOR);
        check(initialSampleSize >= minimumSampleSize, "initialSampleSize must not be below minimumSampleSize");
        check(inlierThreshold > 0, "inlierThreshold must be positive");
        check(initialIterations >= 1, "initialIterations must be at least 1");
        check(iterationStep >= 0, "iterationStep must not be negative");
        return this;
    }

    private static void check(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }
}

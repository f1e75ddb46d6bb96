package com.mosaic.imageStitching;

import com.mosaic.config.StitcherProperties;
import com.mosaic.homography.HomographyEstimator;
import com.mosaic.homography.RansacHomographyEstimator;
import com.mosaic.matchAndTransform.BruteForceKnnMatcher;
import com.mosaic.matchAndTransform.FlannKnnMatcher;
import com.mosaic.matchAndTransform.SiftFeatureExtractor;
import com.mosaic.warper.PerspectiveWarper;
import lombok.RequiredArgsConstructor;

import java.util.Random;

/**
 * Builds a stitcher with its own OpenCV matchers and detector. The FLANN matcher keeps a trained
 * index between calls, so these objects are never shared between sessions.
 */
@RequiredArgsConstructor
public class StitcherFactory {
    private final StitcherProperties properties;

    public IncrementalStitcher create() {
        return new IncrementalStitcher(
                properties,
                new SiftFeatureExtractor(),
                new FlannKnnMatcher(),
                new BruteForceKnnMatcher(),
                new RansacHomographyEstimator(new HomographyEstimator(), new Random()),
                new PerspectiveWarper());
    }
}

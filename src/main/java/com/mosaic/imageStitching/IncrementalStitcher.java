package com.mosaic.imageStitching;

import com.mosaic.blender.CanvasCompositor;
import com.mosaic.blender.Placement;
import com.mosaic.config.StitcherProperties;
import com.mosaic.homography.GeometryValidator;
import com.mosaic.homography.HomographyMatrix;
import com.mosaic.homography.RansacHomographyEstimator;
import com.mosaic.imageOperator.BrightnessNormalizer;
import com.mosaic.imageOperator.ColourImageToGray;
import com.mosaic.matchAndTransform.Correspondence;
import com.mosaic.matchAndTransform.CorrespondenceFilter;
import com.mosaic.matchAndTransform.FeatureExtractor;
import com.mosaic.matchAndTransform.ImageFeatures;
import com.mosaic.matchAndTransform.KnnMatcher;
import com.mosaic.matchAndTransform.MatchStrategy;
import com.mosaic.warper.ImageWarper;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Grows a mosaic one frame at a time.
 * <p>
 * Each new frame is brightness normalised and matched against a reference, at first the previous
 * stitched frame. Up to {@code maxAttempts} estimation attempts are made; every attempt that runs
 * out of matches or of RANSAC consensus lowers the sample size by 4, and from the third attempt
 * on the exhaustive matcher replaces the approximate one. A candidate with too small a projected
 * area is dropped without lowering the sample size. If every attempt fails the frame gets one more
 * pass against the whole mosaic when {@code retryWholeImage} is set.
 * <p>
 * Not thread-safe: one instance per stitching session.
 */
public class IncrementalStitcher {
    private static final Logger logger = LoggerFactory.getLogger(IncrementalStitcher.class);

    static final int SAMPLE_SIZE_STEP = 4;
    static final int EXHAUSTIVE_FROM_ATTEMPT = 2;
    /** Upper bound on either side of a warped frame, larger placements are treated as implausible. */
    static final int MAX_WARP_DIMENSION = 30000;
    /** Upper bound on the pixel count of one warp buffer (400 MB as BGRA). */
    static final long MAX_WARP_PIXELS = 100_000_000L;
    /** Upper bound on the pixel count of the grown canvas (1 GB as BGRA). */
    static final long MAX_CANVAS_PIXELS = 250_000_000L;
    /** Projected corners further out than this are treated as sent to infinity. */
    private static final double MAX_COORDINATE = 1e9;
    /** Corners within this distance of a pixel boundary are snapped onto it. */
    private static final double SNAP_EPS = 1e-6;

    private final StitcherProperties properties;
    private final FeatureExtractor extractor;
    private final KnnMatcher approximateMatcher;
    private final KnnMatcher exhaustiveMatcher;
    private final RansacHomographyEstimator ransac;
    private final ImageWarper warper;

    private final BrightnessNormalizer brightnessNormalizer = new BrightnessNormalizer();
    private final CorrespondenceFilter correspondenceFilter;
    private final GeometryValidator geometryValidator;
    private final CanvasCompositor compositor;
    private final StitchHistory history = new StitchHistory();

    public IncrementalStitcher(StitcherProperties properties,
                               FeatureExtractor extractor,
                               KnnMatcher approximateMatcher,
                               KnnMatcher exhaustiveMatcher,
                               RansacHomographyEstimator ransac,
                               ImageWarper warper) {
        this.properties = properties.validate();
        this.extractor = extractor;
        this.approximateMatcher = approximateMatcher;
        this.exhaustiveMatcher = exhaustiveMatcher;
        this.ransac = ransac;
        this.warper = warper;
        this.correspondenceFilter = new CorrespondenceFilter(properties.getRatioTestThreshold());
        this.geometryValidator = new GeometryValidator(properties.getMinAreaRatio());
        this.compositor = new CanvasCompositor(properties.getBlendPolicy(), properties.getBlendMix());
    }

    public boolean stitch(Mat image) {
        return stitch(image, false, null);
    }

    public boolean stitch(Mat image, boolean useWholeImage) {
        return stitch(image, useWholeImage, null);
    }

    /**
     * Adds {@code image} to the mosaic.
     *
     * @param useWholeImage match against the whole mosaic straight away instead of the previous frame
     * @param metadata      stored as is on the resulting {@link StitchRecord}
     * @return false if no acceptable transform was found; canvas and history are then unchanged
     */
    public boolean stitch(Mat image, boolean useWholeImage, Object metadata) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot stitch an empty image");
        }

        Mat normalized = brightnessNormalizer.normalize(image, properties.getTargetBrightness());

        if (compositor.isEmpty()) {
            Placement p = compositor.place(normalized, 0, 0, false);
            history.append(new StitchRecord(image, normalized, ColourImageToGray.toGray(normalized),
                    p.getX(), p.getY(), HomographyMatrix.identity(), metadata));
            logger.info("Frame {} starts the mosaic ({}x{})", history.size(), image.cols(), image.rows());
            return true;
        }

        Mat frameGray = ColourImageToGray.toGray(normalized);
        try {
            ImageFeatures frameFeatures = extractor.extract(frameGray);

            boolean againstWhole = useWholeImage;
            boolean attemptedWholeMosaic = useWholeImage;
            while (true) {
                ImageFeatures referenceFeatures = extractReference(againstWhole);

                HomographyMatrix H = estimate(frameFeatures, referenceFeatures, image.cols(), image.rows(), againstWhole);
                if (H != null) {
                    commit(image, normalized, H, againstWhole, metadata);
                    return true;
                }

                if (attemptedWholeMosaic || !properties.isRetryWholeImage()) {
                    logger.warn("Frame {} could not be stitched after {} attempts{}", history.size() + 1,
                            properties.getMaxAttempts(), attemptedWholeMosaic ? " against the whole mosaic" : "");
                    return false;
                }
                logger.info("Frame {}: retrying against the whole mosaic", history.size() + 1);
                attemptedWholeMosaic = true;
                againstWhole = true;
            }
        } finally {
            frameGray.release();
            normalized.release();
        }
    }

    /** Current mosaic (BGRA), or null before the first frame. */
    public Mat getCanvas() {
        return compositor.getCanvas();
    }

    public StitchHistory getHistory() {
        return history;
    }

    public StitcherProperties getProperties() {
        return properties;
    }

    /**
     * One pass of the attempt loop.
     *
     * @return an accepted homography from frame pixels to reference pixels, or null
     */
    HomographyMatrix estimate(ImageFeatures frame, ImageFeatures reference, int width, int height,
                              boolean againstWhole) {
        int sampleSize = properties.getInitialSampleSize();

        for (int attempt = 0; attempt < properties.getMaxAttempts(); attempt++) {
            MatchStrategy strategy = strategyForAttempt(attempt);
            List<Correspondence> matchSet = correspondenceFilter.match(matcherFor(strategy), frame, reference);

            if (matchSet.size() < sampleSize) {
                logger.debug("Attempt {} ({}): {} matches, need {}", attempt, strategy, matchSet.size(), sampleSize);
                sampleSize = shrinkSampleSize(sampleSize);
                continue;
            }

            int iterations = iterationBudget(attempt);
            HomographyMatrix H = ransac.estimate(matchSet, sampleSize, properties.getInlierThreshold(), iterations);
            if (H == null) {
                logger.debug("Attempt {} ({}): RANSAC found no model, sample size {}, {} iterations",
                        attempt, strategy, sampleSize, iterations);
                sampleSize = shrinkSampleSize(sampleSize);
                continue;
            }

            if (!geometryValidator.isPlausible(H, width, height)) {
                logger.debug("Attempt {} ({}): rejected, area ratio {}", attempt, strategy,
                        GeometryValidator.areaRatio(H, width, height));
                continue;
            }
            long[] box = boundingBox(H, width, height);
            if (box == null || !fitsWarpLimit(box) || !fitsCanvasLimit(box, againstWhole)) {
                logger.debug("Attempt {} ({}): rejected, projected box {} out of bounds", attempt, strategy,
                        box == null ? "unbounded" : Arrays.toString(box));
                continue;
            }

            logger.debug("Attempt {} ({}): accepted with {} matches", attempt, strategy, matchSet.size());
            return H;
        }
        return null;
    }

    static MatchStrategy strategyForAttempt(int attempt) {
        return attempt < EXHAUSTIVE_FROM_ATTEMPT ? MatchStrategy.APPROXIMATE : MatchStrategy.EXHAUSTIVE;
    }

    int shrinkSampleSize(int sampleSize) {
        return Math.max(properties.getMinimumSampleSize(), sampleSize - SAMPLE_SIZE_STEP);
    }

    int iterationBudget(int attempt) {
        return properties.getInitialIterations() + attempt * properties.getIterationStep();
    }

    private KnnMatcher matcherFor(MatchStrategy strategy) {
        return strategy == MatchStrategy.APPROXIMATE ? approximateMatcher : exhaustiveMatcher;
    }

    private ImageFeatures extractReference(boolean againstWhole) {
        if (!againstWhole) {
            return extractor.extract(history.last().getWarpedGray());
        }
        Mat gray = ColourImageToGray.toGray(compositor.getCanvas());
        Mat stretched = ColourImageToGray.normalizeToRange(gray);
        gray.release();
        try {
            return extractor.extract(stretched);
        } finally {
            stretched.release();
        }
    }

    /** Width and height of the box, at least one pixel each. */
    private static long[] extent(long[] box) {
        return new long[]{Math.max(1, box[2] - box[0]), Math.max(1, box[3] - box[1])};
    }

    static boolean fitsWarpLimit(long[] box) {
        long[] size = extent(box);
        return size[0] <= MAX_WARP_DIMENSION && size[1] <= MAX_WARP_DIMENSION
                && size[0] * size[1] <= MAX_WARP_PIXELS;
    }

    private boolean fitsCanvasLimit(long[] box, boolean againstWhole) {
        long[] size = extent(box);
        long[] grown = compositor.grownSize(size[0], size[1], box[0], box[1], againstWhole);
        return grown[0] * grown[1] <= MAX_CANVAS_PIXELS;
    }

    /**
     * {minX, minY, maxX, maxY} of the projected frame, snapped outwards to whole pixels, or null
     * when a corner is behind the camera, non-finite or beyond {@link #MAX_COORDINATE}.
     */
    static long[] boundingBox(HomographyMatrix H, int width, int height) {
        double[][] corners = GeometryValidator.projectCorners(H, width, height);
        if (corners == null) return null;

        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (double[] p : corners) {
            if (!(Math.abs(p[0]) <= MAX_COORDINATE && Math.abs(p[1]) <= MAX_COORDINATE)) return null;
            minX = Math.min(minX, p[0]);
            maxX = Math.max(maxX, p[0]);
            minY = Math.min(minY, p[1]);
            maxY = Math.max(maxY, p[1]);
        }
        return new long[]{
                (long) Math.floor(minX + SNAP_EPS), (long) Math.floor(minY + SNAP_EPS),
                (long) Math.ceil(maxX - SNAP_EPS), (long) Math.ceil(maxY - SNAP_EPS)};
    }

    private void commit(Mat original, Mat normalized, HomographyMatrix H, boolean againstWhole, Object metadata) {
        // estimate() only accepts boxes within the warp and canvas limits, so the int casts are exact
        long[] box = boundingBox(H, original.cols(), original.rows());
        long[] size = extent(box);
        int minX = (int) box[0];
        int minY = (int) box[1];

        HomographyMatrix placed = H.translate(-minX, -minY);
        Mat warped = warper.warp(normalized, placed, (int) size[0], (int) size[1]);

        Placement p = compositor.place(warped, minX, minY, againstWhole);
        StitchRecord record = new StitchRecord(original, warped, ColourImageToGray.toGray(warped),
                p.getX(), p.getY(), placed, metadata);
        history.append(record);

        logger.info("Frame {} stitched at {} on a {}x{} canvas, {}", history.size(), p,
                compositor.getCanvas().cols(), compositor.getCanvas().rows(), record);
    }
}

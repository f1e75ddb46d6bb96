package com.mosaic.imageStitching;

import com.mosaic.homography.HomographyMatrix;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.time.Instant;
import java.util.Locale;

/**
 * One successfully stitched frame. The placement is in canvas pixels as they were right after
 * this frame was composited; later growth of the canvas does not update it.
 */
@Getter
public final class StitchRecord {
    private static final double DEGENERATE_DET = 1e-9;

    private final Mat originalImage;
    private final Mat warpedImage;
    private final Mat warpedGray;
    private final int xWarped;
    private final int yWarped;
    /** Maps original frame pixels into {@link #warpedImage} pixels. */
    private final HomographyMatrix homography;
    private final Instant timestamp;
    private final Object metadata;
    private final double determinant;

    public StitchRecord(Mat originalImage, Mat warpedImage, Mat warpedGray, int xWarped, int yWarped,
                        HomographyMatrix homography, Object metadata) {
        this.originalImage = originalImage;
        this.warpedImage = warpedImage;
        this.warpedGray = warpedGray;
        this.xWarped = xWarped;
        this.yWarped = yWarped;
        this.homography = homography;
        this.metadata = metadata;
        this.timestamp = Instant.now();
        this.determinant = homography.determinant();
    }

    public boolean isDegenerate() {
        return Math.abs(determinant) < DEGENERATE_DET;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Determinant: %.6f, Warped Image Coords: (%d, %d), Metadata: %s",
                determinant, xWarped, yWarped, metadata);
    }
}

package com.mosaic.homography;

/**
 * Plausibility check on a candidate homography: the frame's corners are projected and the area
 * of the resulting quadrilateral is compared to the frame's own area.
 */
public class GeometryValidator {
    public static final double DEFAULT_MIN_AREA_RATIO = 0.1;

    private final double minAreaRatio;

    public GeometryValidator() {
        this(DEFAULT_MIN_AREA_RATIO);
    }

    public GeometryValidator(double minAreaRatio) {
        this.minAreaRatio = minAreaRatio;
    }

    public double getMinAreaRatio() {
        return minAreaRatio;
    }

    /**
     * Shoelace area of a quadrilateral given as four (x, y) points in cyclic order. Positive for
     * counter-clockwise order in a y-up frame, which is clockwise on screen.
     */
    public static double shoelaceArea(double[][] p) {
        if (p.length != 4) {
            throw new IllegalArgumentException("Expected 4 corners, got " + p.length);
        }
        double a1 = p[0][0] * p[1][1] + p[1][0] * p[2][1] + p[2][0] * p[3][1] + p[3][0] * p[0][1];
        double a2 = p[0][1] * p[1][0] + p[1][1] * p[2][0] + p[2][1] * p[3][0] + p[3][1] * p[0][0];
        return 0.5 * (a1 - a2);
    }

    /** Corners (0,0), (w,0), (w,h), (0,h) mapped through H, or null if one goes to infinity. */
    public static double[][] projectCorners(HomographyMatrix H, int width, int height) {
        double[][] corners = {{0, 0}, {width, 0}, {width, height}, {0, height}};
        double[][] projected = new double[4][];
        for (int i = 0; i < 4; i++) {
            // a corner behind the camera folds the quadrilateral, treat it like infinity
            if (H.homogeneousScale(corners[i][0], corners[i][1]) <= 0) return null;
            projected[i] = H.project(corners[i][0], corners[i][1]);
            if (projected[i] == null) return null;
        }
        return projected;
    }

    /**
     * Signed projected area divided by {@code width * height}. Mirroring transforms give a
     * negative ratio. Returns NaN if a corner cannot be projected.
     */
    public static double areaRatio(HomographyMatrix H, int width, int height) {
        double[][] projected = projectCorners(H, width, height);
        if (projected == null) return Double.NaN;
        return shoelaceArea(projected) / ((double) width * height);
    }

    public boolean isPlausible(HomographyMatrix H, int width, int height) {
        double ratio = areaRatio(H, width, height);
        // NaN fails the comparison and is rejected
        return ratio >= minAreaRatio;
    }
}

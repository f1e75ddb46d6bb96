package com.mosaic.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * Immutable 3x3 projective transform. Instances built through {@link #normalized(double[][])}
 * have element [2][2] equal to 1.
 */
public final class HomographyMatrix {
    private static final double EPS = 1e-10;

    private final double[][] data;

    public HomographyMatrix(double[][] data) {
        if (data.length != 3 || data[0].length != 3 || data[1].length != 3 || data[2].length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][];
        for (int r = 0; r < 3; r++) this.data[r] = data[r].clone();
    }

    public static HomographyMatrix identity() {
        return new HomographyMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
    }

    public static HomographyMatrix translation(double tx, double ty) {
        return new HomographyMatrix(new double[][]{{1, 0, tx}, {0, 1, ty}, {0, 0, 1}});
    }

    /**
     * Scales {@code data} so that element [2][2] becomes 1.
     *
     * @throws DegenerateHomographyException if [2][2] is (close to) zero
     */
    public static HomographyMatrix normalized(double[][] data) {
        double h22 = data[2][2];
        if (Math.abs(h22) < EPS || !Double.isFinite(h22)) {
            throw new DegenerateHomographyException("Cannot normalise homography, H[2][2] = " + h22);
        }
        double[][] scaled = new double[3][3];
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                scaled[r][c] = data[r][c] / h22;
        return new HomographyMatrix(scaled);
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) copy[r] = data[r].clone();
        return copy;
    }

    /**
     * Maps (x, y) through the transform.
     *
     * @return the projected point, or null if it lands at infinity
     */
    public double[] project(double x, double y) {
        double z_prime = data[2][0] * x + data[2][1] * y + data[2][2];
        if (Math.abs(z_prime) < EPS) return null;

        double x_prime = (data[0][0] * x + data[0][1] * y + data[0][2]) / z_prime;
        double y_prime = (data[1][0] * x + data[1][1] * y + data[1][2]) / z_prime;

        return new double[]{x_prime, y_prime};
    }

    /** Homogeneous scale of (x, y, 1) after the transform. */
    public double homogeneousScale(double x, double y) {
        return data[2][0] * x + data[2][1] * y + data[2][2];
    }

    /** Returns {@code this * other}, i.e. {@code other} is applied first. */
    public HomographyMatrix multiply(HomographyMatrix other) {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                out[r][c] = data[r][0] * other.data[0][c] + data[r][1] * other.data[1][c] + data[r][2] * other.data[2][c];
        return new HomographyMatrix(out);
    }

    /** Shorthand for {@code translation(tx, ty).multiply(this)}. */
    public HomographyMatrix translate(double tx, double ty) {
        return translation(tx, ty).multiply(this);
    }

    public double determinant() {
        return data[0][0] * (data[1][1] * data[2][2] - data[1][2] * data[2][1])
                - data[0][1] * (data[1][0] * data[2][2] - data[1][2] * data[2][0])
                + data[0][2] * (data[1][0] * data[2][1] - data[1][1] * data[2][0]);
    }

    /** Copies the transform into a new 3x3 CV_64F matrix, the form warpPerspective expects. */
    public Mat toMat() {
        Mat m = new Mat(3, 3, CV_64F);
        try (DoubleIndexer idx = m.createIndexer()) {
            for (int r = 0; r < 3; r++)
                for (int c = 0; c < 3; c++)
                    idx.put(r, c, data[r][c]);
        }
        return m;
    }

    public boolean approximatelyEquals(HomographyMatrix other, double tolerance) {
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                if (Math.abs(data[r][c] - other.data[r][c]) > tolerance) return false;
        return true;
    }

    @Override
    public String toString() {
        return Arrays.deepToString(data);
    }
}

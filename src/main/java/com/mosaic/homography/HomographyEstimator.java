package com.mosaic.homography;

import com.mosaic.matchAndTransform.Correspondence;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.SVDecomp;

/**
 * Direct linear transform: least squares homography from four or more correspondences.
 */
public class HomographyEstimator {
    public static final int MIN_CORRESPONDENCES = 4;

    /** sigma_8 / sigma_1 below this means the null space is not one dimensional. */
    static final double RANK_EPS = 1e-8;
    static final double DET_EPS = 1e-10;
    private static final double EPS = 1e-12;

    /**
     * Fits H so that (x2, y2, 1) ~ H (x1, y1, 1) for every correspondence, minimising the
     * algebraic error. Points are Hartley normalised before the fit.
     *
     * @throws IllegalArgumentException if fewer than four correspondences are given
     * @throws DegenerateHomographyException if the correspondences do not fix a unique invertible H
     */
    public HomographyMatrix solve(List<Correspondence> correspondences) {
        int n = correspondences.size();
        if (n < MIN_CORRESPONDENCES) {
            throw new IllegalArgumentException("A homography needs at least " + MIN_CORRESPONDENCES
                    + " correspondences, got " + n);
        }

        double[] src = new double[2 * n];
        double[] dst = new double[2 * n];
        for (int i = 0; i < n; i++) {
            Correspondence c = correspondences.get(i);
            src[2 * i] = c.getX1();
            src[2 * i + 1] = c.getY1();
            dst[2 * i] = c.getX2();
            dst[2 * i + 1] = c.getY2();
        }
        double[] srcNorm = normalizePoints(src);
        double[] dstNorm = normalizePoints(dst);

        // An 8x9 system is padded with a zero row so the SVD always returns a full 9x9 V^T.
        int rows = Math.max(2 * n, 9);
        Mat A = new Mat(rows, 9, CV_64F);
        Mat w = new Mat();
        Mat u = new Mat();
        Mat vt = new Mat();
        try {
            try (DoubleIndexer a = A.createIndexer()) {
                for (int r = 0; r < rows; r++)
                    for (int c = 0; c < 9; c++)
                        a.put(r, c, 0.0);

                for (int i = 0; i < n; i++) {
                    double x = src[2 * i], y = src[2 * i + 1];
                    double u2 = dst[2 * i], v2 = dst[2 * i + 1];

                    int r1 = 2 * i;
                    a.put(r1, 3, x);
                    a.put(r1, 4, y);
                    a.put(r1, 5, 1.0);
                    a.put(r1, 6, -v2 * x);
                    a.put(r1, 7, -v2 * y);
                    a.put(r1, 8, -v2);

                    int r2 = 2 * i + 1;
                    a.put(r2, 0, x);
                    a.put(r2, 1, y);
                    a.put(r2, 2, 1.0);
                    a.put(r2, 6, -u2 * x);
                    a.put(r2, 7, -u2 * y);
                    a.put(r2, 8, -u2);
                }
            }

            SVDecomp(A, w, u, vt);

            double[] sigma = new double[9];
            double[] h = new double[9];
            try (DoubleIndexer wi = w.createIndexer(); DoubleIndexer vti = vt.createIndexer()) {
                for (int i = 0; i < 9; i++) sigma[i] = wi.get(i);
                for (int i = 0; i < 9; i++) h[i] = vti.get(8, i);
            }

            if (!(sigma[0] > EPS) || sigma[7] / sigma[0] < RANK_EPS) {
                throw new DegenerateHomographyException(String.format(
                        "Rank deficient DLT system (sigma_max=%.3e, sigma_8=%.3e)", sigma[0], sigma[7]));
            }

            double[][] hn = {{h[0], h[1], h[2]}, {h[3], h[4], h[5]}, {h[6], h[7], h[8]}};
            HomographyMatrix fitted = denormalize(new HomographyMatrix(hn), srcNorm, dstNorm);
            HomographyMatrix H = HomographyMatrix.normalized(fitted.getData());

            double det = H.determinant();
            if (Math.abs(det) < DET_EPS || !Double.isFinite(det)) {
                throw new DegenerateHomographyException("Singular homography, det = " + det);
            }
            return H;
        } finally {
            A.release();
            w.release();
            u.release();
            vt.release();
        }
    }

    /**
     * Squared distance between H*(x1, y1) and (x2, y2) for every correspondence. A point that
     * H sends to infinity gets {@link Double#POSITIVE_INFINITY}.
     */
    public double[] reprojectionError(List<Correspondence> correspondences, HomographyMatrix H) {
        double[] errors = new double[correspondences.size()];
        for (int i = 0; i < errors.length; i++) {
            Correspondence c = correspondences.get(i);
            double[] projected = H.project(c.getX1(), c.getY1());
            if (projected == null) {
                errors[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            double dx = projected[0] - c.getX2();
            double dy = projected[1] - c.getY2();
            errors[i] = dx * dx + dy * dy;
        }
        return errors;
    }

    /**
     * Moves the centroid of {@code pts} (interleaved x, y) to the origin and scales the mean
     * distance to sqrt(2), in place.
     *
     * @return {cx, cy, scale}
     */
    private static double[] normalizePoints(double[] pts) {
        int n = pts.length / 2;
        double cx = 0, cy = 0;
        for (int i = 0; i < n; i++) {
            cx += pts[2 * i];
            cy += pts[2 * i + 1];
        }
        cx /= n;
        cy /= n;

        double meanDist = 0;
        for (int i = 0; i < n; i++) {
            meanDist += Math.hypot(pts[2 * i] - cx, pts[2 * i + 1] - cy);
        }
        meanDist /= n;
        if (meanDist < EPS) {
            throw new DegenerateHomographyException("All points coincide");
        }

        double s = Math.sqrt(2.0) / meanDist;
        for (int i = 0; i < n; i++) {
            pts[2 * i] = (pts[2 * i] - cx) * s;
            pts[2 * i + 1] = (pts[2 * i + 1] - cy) * s;
        }
        return new double[]{cx, cy, s};
    }

    /** H = T_dst^-1 * Hn * T_src */
    private static HomographyMatrix denormalize(HomographyMatrix hn, double[] srcNorm, double[] dstNorm) {
        double sx = srcNorm[2], sd = dstNorm[2];
        HomographyMatrix tSrc = new HomographyMatrix(new double[][]{
                {sx, 0, -sx * srcNorm[0]},
                {0, sx, -sx * srcNorm[1]},
                {0, 0, 1}});
        HomographyMatrix tDstInv = new HomographyMatrix(new double[][]{
                {1 / sd, 0, dstNorm[0]},
                {0, 1 / sd, dstNorm[1]},
                {0, 0, 1}});
        return tDstInv.multiply(hn).multiply(tSrc);
    }
}

package com.mosaic.blender;

import com.mosaic.imageOperator.ColourImageToGray;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC4;

/**
 * Owns the mosaic buffer. Every placement that reaches outside the current canvas allocates a
 * new canvas covering the union of both boxes; the old buffer is copied in at its shifted origin
 * and the new image is blended over its own rectangle.
 */
public class CanvasCompositor {
    private static final Logger logger = LoggerFactory.getLogger(CanvasCompositor.class);

    public static final double DEFAULT_MIX = 0.75;

    private final BlendPolicy policy;
    private final double mix;

    private Mat canvas;
    private Placement lastPlacement;

    public CanvasCompositor(BlendPolicy policy, double mix) {
        if (!(mix >= 0.0 && mix <= 1.0)) {
            throw new IllegalArgumentException("Blend mix must be in [0, 1], got " + mix);
        }
        this.policy = policy;
        this.mix = mix;
    }

    public BlendPolicy getPolicy() {
        return policy;
    }

    /** Current mosaic (BGRA), or null before the first placement. */
    public Mat getCanvas() {
        return canvas;
    }

    public Placement getLastPlacement() {
        return lastPlacement;
    }

    public boolean isEmpty() {
        return canvas == null;
    }

    /**
     * Places {@code image} with its top-left at {@code (xOffset, yOffset)} relative to the previous
     * placement, or relative to the canvas origin if {@code useWholeImageOrigin}.
     *
     * @return where the image now sits on the (possibly reallocated) canvas
     */
    public Placement place(Mat image, int xOffset, int yOffset, boolean useWholeImageOrigin) {
        Mat src = image.channels() == 4 ? image : ColourImageToGray.toBgra(image);

        if (canvas == null) {
            canvas = src.clone();
            if (src != image) src.release();
            lastPlacement = Placement.ORIGIN;
            logger.debug("Canvas initialised at {}x{}", canvas.cols(), canvas.rows());
            return lastPlacement;
        }

        long[] union = union(src.cols(), src.rows(), xOffset, yOffset, useWholeImageOrigin);
        if (union[2] - union[0] > Integer.MAX_VALUE || union[3] - union[1] > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Placement at (" + xOffset + ", " + yOffset
                    + ") would grow the canvas past the addressable size");
        }

        int cw = canvas.cols();
        int ch = canvas.rows();
        int W = (int) (union[2] - union[0]);
        int H = (int) (union[3] - union[1]);
        int oldX = (int) -union[0];
        int oldY = (int) -union[1];
        int px = (int) (union[4] - union[0]);
        int py = (int) (union[5] - union[1]);

        Mat grown = new Mat(H, W, CV_8UC4, new Scalar(0, 0, 0, 0));
        Mat oldRegion = grown.apply(new Rect(oldX, oldY, cw, ch));
        canvas.copyTo(oldRegion);
        oldRegion.release();

        blendInto(grown, src, px, py);
        if (src != image) src.release();

        if (W != cw || H != ch) {
            logger.debug("Canvas grown {}x{} -> {}x{}, old origin now at ({}, {})", cw, ch, W, H, oldX, oldY);
        }
        canvas.release();
        canvas = grown;
        lastPlacement = new Placement(px, py);
        return lastPlacement;
    }

    /**
     * Canvas size, {width, height}, that placing a {@code width} x {@code height} image at the given
     * offset would produce. Before the first placement this is the image size.
     */
    public long[] grownSize(long width, long height, long xOffset, long yOffset, boolean useWholeImageOrigin) {
        if (canvas == null) {
            return new long[]{width, height};
        }
        long[] union = union(width, height, xOffset, yOffset, useWholeImageOrigin);
        return new long[]{union[2] - union[0], union[3] - union[1]};
    }

    /** {minX, minY, maxX, maxY, newX, newY} in current canvas coordinates. */
    private long[] union(long width, long height, long xOffset, long yOffset, boolean useWholeImageOrigin) {
        Placement base = useWholeImageOrigin ? Placement.ORIGIN : lastPlacement;
        long nx = base.getX() + xOffset;
        long ny = base.getY() + yOffset;
        return new long[]{
                Math.min(0, nx), Math.min(0, ny),
                Math.max(canvas.cols(), nx + width), Math.max(canvas.rows(), ny + height),
                nx, ny};
    }

    private void blendInto(Mat dst, Mat src, int px, int py) {
        int rows = src.rows();
        int cols = src.cols();
        try (UByteIndexer d = dst.createIndexer(); UByteIndexer s = src.createIndexer()) {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    int dy = py + y;
                    int dx = px + x;
                    if (policy == BlendPolicy.LEGACY) {
                        double alpha = s.get(y, x, 3) / 255.0;
                        for (int c = 0; c < 4; c++) {
                            double v = alpha * s.get(y, x, c) + (1.0 - alpha) * d.get(dy, dx, c);
                            d.put(dy, dx, c, (int) Math.round(v));
                        }
                    } else {
                        boolean newPresent = present(s, y, x);
                        if (!newPresent) continue;
                        boolean oldPresent = present(d, dy, dx);
                        for (int c = 0; c < 4; c++) {
                            int v = s.get(y, x, c);
                            if (oldPresent) {
                                v = (int) Math.round(mix * v + (1.0 - mix) * d.get(dy, dx, c));
                            }
                            d.put(dy, dx, c, v);
                        }
                    }
                }
            }
        }
    }

    private static boolean present(UByteIndexer idx, int y, int x) {
        return idx.get(y, x, 0) != 0 || idx.get(y, x, 1) != 0 || idx.get(y, x, 2) != 0 || idx.get(y, x, 3) != 0;
    }
}

package com.mosaic;

import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC4;

public final class TestImages {

    private TestImages() {
    }

    public static Mat solid(int rows, int cols, int b, int g, int r, int a) {
        return new Mat(rows, cols, CV_8UC4, new Scalar(b, g, r, a));
    }

    /** 3 channel image whose channels follow x and y, staying well inside [0, 255]. */
    public static Mat gradientBgr(int rows, int cols) {
        Mat m = new Mat(rows, cols, CV_8UC3);
        try (UByteIndexer idx = m.createIndexer()) {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    idx.put(y, x, 0, 60 + (x * 80) / cols);
                    idx.put(y, x, 1, 70 + (y * 90) / rows);
                    idx.put(y, x, 2, 50 + ((x + y) * 60) / (rows + cols));
                }
            }
        }
        return m;
    }

    public static int[] pixel(Mat m, int y, int x) {
        int[] px = new int[m.channels()];
        try (UByteIndexer idx = m.createIndexer()) {
            for (int c = 0; c < px.length; c++) px[c] = idx.get(y, x, c);
        }
        return px;
    }
}

package com.mosaic.imageOperator;

import com.mosaic.TestImages;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BrightnessNormalizerTest {
    private final BrightnessNormalizer normalizer = new BrightnessNormalizer();

    @Test
    void shiftsGrayMeanToTarget() {
        Mat image = TestImages.gradientBgr(60, 80);
        double before = BrightnessNormalizer.grayMean(image);

        Mat darker = normalizer.normalize(image, before - 30);
        Mat brighter = normalizer.normalize(image, before + 25);

        assertThat(BrightnessNormalizer.grayMean(darker)).isCloseTo(before - 30, within(1.0));
        assertThat(BrightnessNormalizer.grayMean(brighter)).isCloseTo(before + 25, within(1.0));
    }

    @Test
    void promotesToBgraAndLeavesInputUntouched() {
        Mat image = TestImages.gradientBgr(20, 20);
        int[] original = TestImages.pixel(image, 5, 5);

        Mat out = normalizer.normalize(image, 200);

        assertThat(out.channels()).isEqualTo(4);
        assertThat(TestImages.pixel(image, 5, 5)).containsExactly(original);
        assertThat(TestImages.pixel(out, 5, 5)[3]).isEqualTo(255);
    }

    @Test
    void clampsToByteRangeAndKeepsAlpha() {
        Mat image = TestImages.solid(10, 10, 250, 10, 128, 77);

        Mat out = normalizer.normalize(image, 250);

        try (UByteIndexer idx = out.createIndexer()) {
            for (int y = 0; y < 10; y++) {
                for (int x = 0; x < 10; x++) {
                    for (int c = 0; c < 3; c++) {
                        assertThat(idx.get(y, x, c)).isBetween(0, 255);
                    }
                    assertThat(idx.get(y, x, 3)).isEqualTo(77);
                }
            }
        }
        assertThat(TestImages.pixel(out, 0, 0)[0]).isEqualTo(255);
    }

    @Test
    void clampHelperRoundsAndBounds() {
        assertThat(BrightnessNormalizer.clamp(-3.2)).isEqualTo(0);
        assertThat(BrightnessNormalizer.clamp(12.5)).isEqualTo(13);
        assertThat(BrightnessNormalizer.clamp(300)).isEqualTo(255);
    }
}

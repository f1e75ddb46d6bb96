package com.mosaic.API;

import com.mosaic.imageStitching.IncrementalStitcher;
import com.mosaic.imageStitching.StitchRecord;
import com.mosaic.imageStitching.StitcherFactory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imencode;

@Service
@RequiredArgsConstructor
public class StitchingService {
    private static final Logger logger = LoggerFactory.getLogger(StitchingService.class);

    private final StitcherFactory stitcherFactory;

    /** Outcome of one frame of an upload. */
    @Getter
    @RequiredArgsConstructor
    public static class FrameResult {
        private final int index;
        private final String name;
        private final boolean success;
        private final StitchRecord record;
    }

    @Getter
    @RequiredArgsConstructor
    public static class StitchResult {
        private final List<FrameResult> frames;
        private final int width;
        private final int height;
        private final byte[] png;

        public long stitchedCount() {
            return frames.stream().filter(FrameResult::isSuccess).count();
        }
    }

    /**
     * Stitches the frames in the given order on a fresh canvas. Frames that fail are skipped
     * and reported; the mosaic holds every frame that succeeded.
     */
    public StitchResult stitchImages(List<String> names, List<byte[]> images, boolean wholeImage) {
        IncrementalStitcher stitcher = stitcherFactory.create();
        List<FrameResult> frames = new ArrayList<>();

        for (int i = 0; i < images.size(); i++) {
            String name = names.get(i);
            Mat frame = decode(images.get(i));
            if (frame.empty()) {
                throw new IllegalArgumentException("Cannot decode image: " + name);
            }
            boolean ok = stitcher.stitch(frame, wholeImage, name);
            frames.add(new FrameResult(i, name, ok, ok ? stitcher.getHistory().last() : null));
            if (!ok) logger.warn("Skipping {}: no acceptable transform", name);
        }

        Mat canvas = stitcher.getCanvas();
        if (canvas == null) {
            return new StitchResult(frames, 0, 0, new byte[0]);
        }
        return new StitchResult(frames, canvas.cols(), canvas.rows(), encodePng(canvas));
    }

    static Mat decode(byte[] bytes) {
        return imdecode(new Mat(bytes), IMREAD_COLOR);
    }

    static byte[] encodePng(Mat image) {
        BytePointer buf = new BytePointer();
        try {
            if (!imencode(".png", image, buf)) {
                throw new IllegalStateException("PNG encoding failed");
            }
            byte[] bytes = new byte[(int) buf.limit()];
            buf.get(bytes);
            return bytes;
        } finally {
            buf.close();
        }
    }
}

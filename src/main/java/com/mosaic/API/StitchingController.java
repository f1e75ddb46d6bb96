package com.mosaic.API;

import com.mosaic.imageStitching.StitchRecord;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class StitchingController {
    private static final Logger logger = LoggerFactory.getLogger(StitchingController.class);

    private final StitchingService stitchingService;

    @PostMapping(value = "/stitch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> stitchImages(
            @RequestParam(value = "images", required = false) List<MultipartFile> images,
            @RequestParam(value = "wholeImage", defaultValue = "false") boolean wholeImage) {
        if (images == null || images.isEmpty()) {
            return badRequest("No images uploaded.");
        }
        for (MultipartFile image : images) {
            if (!isValidImageFile(image)) {
                return badRequest("Invalid file: " + image.getOriginalFilename());
            }
        }

        try {
            List<String> names = new ArrayList<>();
            List<byte[]> bytes = new ArrayList<>();
            for (MultipartFile image : images) {
                names.add(image.getOriginalFilename());
                bytes.add(image.getBytes());
            }

            StitchingService.StitchResult result = stitchingService.stitchImages(names, bytes, wholeImage);

            List<Map<String, Object>> frames = new ArrayList<>();
            for (StitchingService.FrameResult frame : result.getFrames()) {
                Map<String, Object> f = new LinkedHashMap<>();
                f.put("index", frame.getIndex());
                f.put("name", frame.getName());
                f.put("success", frame.isSuccess());
                StitchRecord record = frame.getRecord();
                if (record != null) {
                    f.put("x", record.getXWarped());
                    f.put("y", record.getYWarped());
                    f.put("determinant", record.getDeterminant());
                }
                frames.add(f);
            }

            long stitched = result.stitchedCount();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", stitched == images.size());
            response.put("stitched", stitched);
            response.put("failed", images.size() - stitched);
            response.put("frames", frames);
            response.put("width", result.getWidth());
            response.put("height", result.getHeight());
            response.put("mosaic", Base64.getEncoder().encodeToString(result.getPng()));
            return ResponseEntity.ok().body(response);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Stitching request failed", e);
            Map<String, String> error = new HashMap<>();
            error.put("error", "Error: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    /** Image content type and a known image extension. */
    static boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|webp|tif|tiff)$");
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.badRequest().body(error);
    }
}

package com.stampfit.core.tools;

import com.stampfit.core.detect.ThresholdSourceDetector;
import com.stampfit.core.fit.FitResult;
import com.stampfit.core.fit.PatchFitter;
import com.stampfit.core.patch.AverageMode;
import com.stampfit.core.patch.CoordinatePatchCollection;
import com.stampfit.core.patch.PatchIdentifier;
import com.stampfit.core.patch.RegionGrid;
import com.stampfit.core.psf.GaussianPsf;
import com.stampfit.core.util.DataPathResolver;
import com.stampfit.core.util.StampfitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline tool: detects stars in a directory of images, stores their stamps,
 * builds regional templates and fits a Gaussian PSF to each template.
 * Usage: PsfCalibrationTool &lt;imageDir&gt;
 */
public class PsfCalibrationTool {

    private static final Logger logger = LoggerFactory.getLogger(PsfCalibrationTool.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: PsfCalibrationTool <imageDir>");
            System.exit(1);
        }

        File rootDir = new File(args[0]);
        if (!rootDir.exists() || !rootDir.isDirectory()) {
            System.err.println("Invalid image directory: " + args[0]);
            System.exit(1);
        }

        StampfitConfig config = StampfitConfig.loadDefault();
        try {
            run(rootDir.toPath(), config);
        } catch (Exception e) {
            logger.error("PSF calibration failed", e);
            System.exit(1);
        }
    }

    static Map<PatchIdentifier, FitResult> run(Path rootDir, StampfitConfig config) throws IOException {
        // 1. Load images
        List<double[][]> images = loadImages(rootDir);
        logger.info("Loaded {} images from {}", images.size(), rootDir);
        if (images.isEmpty()) {
            logger.warn("No images found, exiting.");
            return Map.of();
        }

        // 2. Detect and extract
        ThresholdSourceDetector detector = new ThresholdSourceDetector(config.detection.threshold,
                config.detection.minArea);
        CoordinatePatchCollection stamps = CoordinatePatchCollection.findStarsAndCreate(images,
                config.extraction.patchSize, detector);
        logger.info("Extracted {} stamps of size {}", stamps.size(), config.extraction.patchSize);

        String dbPath = DataPathResolver.resolveDbPath(config);
        stamps.save(Paths.get(dbPath));
        logger.info("Saved stamps to {}", dbPath);

        // 3. Regional templates over the largest image
        int rows = 0;
        int cols = 0;
        for (double[][] image : images) {
            rows = Math.max(rows, image.length);
            cols = Math.max(cols, image.length == 0 ? 0 : image[0].length);
        }
        List<int[]> corners = RegionGrid.corners(rows, cols, config.averaging.step);
        CoordinatePatchCollection templates = stamps.average(corners, config.averaging.step, config.averaging.size,
                AverageMode.fromLabel(config.averaging.mode));

        // 4. Fit
        Map<PatchIdentifier, FitResult> results = new PatchFitter(config.fitting).fit(templates, new GaussianPsf(),
                GaussianPsf.initialGuess(config.averaging.size));
        for (FitResult result : results.values()) {
            logger.info("{}", result);
        }
        return results;
    }

    /**
     * Loads every readable image under {@code rootDir}, sorted by path so that
     * image indices are stable between runs.
     */
    static List<double[][]> loadImages(Path rootDir) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(rootDir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (name.endsWith(".png") || name.endsWith(".tif") || name.endsWith(".tiff")
                        || name.endsWith(".jpg") || name.endsWith(".jpeg")) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);

        List<double[][]> images = new ArrayList<>();
        for (Path file : files) {
            try {
                BufferedImage bi = ImageIO.read(file.toFile());
                if (bi != null) {
                    images.add(toGray(bi));
                } else {
                    logger.warn("No reader for {}", file);
                }
            } catch (IOException e) {
                logger.warn("Failed to load {}", file, e);
            }
        }
        return images;
    }

    /**
     * Samples indexed [row][column]; multi-band images are averaged over their
     * first three bands.
     */
    static double[][] toGray(BufferedImage bi) {
        Raster raster = bi.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = Math.min(raster.getNumBands(), 3);
        double[][] pixels = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0.0;
                for (int b = 0; b < bands; b++) {
                    sum += raster.getSampleDouble(x, y, b);
                }
                pixels[y][x] = sum / bands;
            }
        }
        return pixels;
    }
}

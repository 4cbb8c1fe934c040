package com.starscape.imageedit.features.extractpatches.app;

import com.starscape.imageedit.common.image.ImageCodec;
import com.starscape.imageedit.features.extractpatches.domain.BoundingBox;
import com.starscape.imageedit.features.extractpatches.domain.CoordinateOrigin;
import com.starscape.imageedit.features.extractpatches.domain.Patch;
import com.starscape.imageedit.features.extractpatches.domain.Region;
import com.starscape.imageedit.features.extractpatches.domain.RegionConfig;
import com.starscape.imageedit.features.extractpatches.domain.RegionPoint;
import com.starscape.imageedit.features.extractpatches.infra.RegionConfigReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Crops the axis-aligned bounding box of every configured region out of a source image.
 *
 * Regions with fewer than four points, or whose box collapses to nothing after
 * clamping to the image, produce no patch. The part id of a patch is the index of its
 * region in the config, so ids stay stable even when earlier regions are skipped.
 */
@Service
public class PatchExtractor {

    private static final Logger log = LoggerFactory.getLogger(PatchExtractor.class);

    private final RegionConfigReader configReader;

    public PatchExtractor(RegionConfigReader configReader) {
        this.configReader = configReader;
    }

    public List<Patch> extract(Path imagePath, Path configPath, CoordinateOrigin origin) throws IOException {
        BufferedImage image = ImageCodec.read(imagePath);
        RegionConfig config = configReader.read(configPath);
        List<Patch> patches = extract(image, config.differences(), origin);
        log.info("Extracted {} patches from {} regions: image={}, origin={}",
            patches.size(), config.differences().size(), imagePath, origin.label());
        return patches;
    }

    public List<Patch> extract(BufferedImage image, List<Region> regions, CoordinateOrigin origin) throws IOException {
        int width = image.getWidth();
        int height = image.getHeight();
        List<Patch> patches = new ArrayList<>();

        for (int index = 0; index < regions.size(); index++) {
            Region region = regions.get(index);
            if (!region.hasEnoughPoints()) {
                log.debug("Skipping region {}: {} points", index, region.points().size());
                continue;
            }

            BoundingBox box = boundingBox(region.points(), width, height, origin);
            if (box.isEmpty()) {
                log.debug("Skipping region {}: degenerate box {}", index, box);
                continue;
            }

            BufferedImage crop = ImageCodec.copyRegion(image, box.xMin(), box.yMin(), box.width(), box.height());
            patches.add(new Patch(String.valueOf(index), region.text(), box, ImageCodec.encodePng(crop)));
        }

        return patches;
    }

    /**
     * Pixel box of normalized points: floor of the minimum, ceiling of the maximum,
     * clamped to [0, width] x [0, height]. May be empty.
     */
    public static BoundingBox boundingBox(List<RegionPoint> points, int width, int height, CoordinateOrigin origin) {
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (RegionPoint point : points) {
            double x = point.x() * (width - 1);
            double y = origin.toPixelY(point.y(), height);
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
        }

        int xMin = Math.max(0, (int) Math.floor(minX));
        int xMax = Math.min(width, (int) Math.ceil(maxX));
        int yMin = Math.max(0, (int) Math.floor(minY));
        int yMax = Math.min(height, (int) Math.ceil(maxY));
        return new BoundingBox(xMin, yMin, xMax, yMax);
    }
}

package com.starscape.imageedit.features.extractpatches.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imageedit.common.image.ImageCodec;
import com.starscape.imageedit.features.extractpatches.domain.BoundingBox;
import com.starscape.imageedit.features.extractpatches.domain.CoordinateOrigin;
import com.starscape.imageedit.features.extractpatches.domain.Patch;
import com.starscape.imageedit.features.extractpatches.domain.Region;
import com.starscape.imageedit.features.extractpatches.domain.RegionPoint;
import com.starscape.imageedit.features.extractpatches.infra.RegionConfigReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchExtractorTest {

    private final PatchExtractor extractor = new PatchExtractor(new RegionConfigReader(new ObjectMapper()));

    private static Region rect(double x0, double y0, double x1, double y1, String text) {
        return new Region(List.of(
            new RegionPoint(x0, y0), new RegionPoint(x1, y0),
            new RegionPoint(x1, y1), new RegionPoint(x0, y1)), text);
    }

    private static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, 0xFF000000 | (x << 16) | (y << 8) | ((x + y) & 0xFF));
            }
        }
        return image;
    }

    @Test
    void boundingBoxFloorsMinimumAndCeilsMaximum() {
        BoundingBox box = PatchExtractor.boundingBox(rect(0.25, 0.25, 0.75, 0.5, "").points(),
            101, 41, CoordinateOrigin.TOP_LEFT);
        assertEquals(new BoundingBox(25, 10, 75, 20), box);

        BoundingBox fractional = PatchExtractor.boundingBox(rect(0.25, 0.25, 0.75, 0.75, "").points(),
            11, 11, CoordinateOrigin.TOP_LEFT);
        assertEquals(new BoundingBox(2, 2, 8, 8), fractional);
    }

    @Test
    void bottomLeftOriginFlipsVerticalAxis() {
        BoundingBox box = PatchExtractor.boundingBox(rect(0.0, 0.0, 0.5, 0.25, "").points(),
            101, 101, CoordinateOrigin.BOTTOM_LEFT);

        assertEquals(new BoundingBox(0, 75, 50, 100), box);
    }

    @Test
    void boxIsClampedToImage() {
        BoundingBox box = PatchExtractor.boundingBox(rect(-0.5, -0.5, 1.5, 1.5, "").points(),
            40, 30, CoordinateOrigin.TOP_LEFT);

        assertEquals(new BoundingBox(0, 0, 40, 30), box);
    }

    @Test
    void degenerateAndShortRegionsAreSkippedButIdsKeepTheirIndex() throws Exception {
        List<Region> regions = List.of(
            rect(0.1, 0.1, 0.3, 0.3, "first"),
            rect(0.0, 0.5, 0.0, 0.75, "zero width"),
            new Region(List.of(new RegionPoint(0.1, 0.1), new RegionPoint(0.2, 0.2), new RegionPoint(0.3, 0.1)), "three points"),
            rect(0.6, 0.6, 0.9, 0.9, null));

        List<Patch> patches = extractor.extract(gradient(64, 48), regions, CoordinateOrigin.TOP_LEFT);

        assertEquals(2, patches.size());
        assertEquals("0", patches.get(0).partId());
        assertEquals("first", patches.get(0).prompt());
        assertEquals("3", patches.get(1).partId());
        assertEquals("", patches.get(1).prompt());
    }

    @Test
    void patchPixelsAreExactCopiesOfTheSource() throws Exception {
        BufferedImage source = gradient(64, 48);

        Patch patch = extractor.extract(source, List.of(rect(0.25, 0.25, 0.75, 0.75, "p")), CoordinateOrigin.TOP_LEFT).get(0);
        BufferedImage crop = ImageCodec.decode(patch.pngBytes());

        BoundingBox box = patch.box();
        assertEquals(box.width(), crop.getWidth());
        assertEquals(box.height(), crop.getHeight());
        for (int y = 0; y < crop.getHeight(); y++) {
            for (int x = 0; x < crop.getWidth(); x++) {
                assertEquals(source.getRGB(box.xMin() + x, box.yMin() + y), crop.getRGB(x, y));
            }
        }
    }

    @Test
    void readsImageAndConfigFromDisk(@TempDir Path dir) throws Exception {
        Path image = dir.resolve("scene.png");
        Files.write(image, ImageCodec.encodePng(gradient(32, 32)));
        Path config = dir.resolve("scene.json");
        Files.writeString(config, """
            {
              "version": 2,
              "differences": [
                {"points": [{"x": 0.1, "y": 0.1}, {"x": 0.4, "y": 0.1}, {"x": 0.4, "y": 0.4}, {"x": 0.1, "y": 0.4}],
                 "text": "make it red", "id": 7}
              ]
            }
            """);

        List<Patch> patches = extractor.extract(image, config, CoordinateOrigin.TOP_LEFT);

        assertEquals(1, patches.size());
        assertEquals("make it red", patches.get(0).prompt());
    }

    @Test
    void emptyDifferencesProduceNoPatches(@TempDir Path dir) throws Exception {
        Path image = dir.resolve("scene.png");
        Files.write(image, ImageCodec.encodePng(gradient(8, 8)));
        Path config = dir.resolve("scene.json");
        Files.writeString(config, "{\"differences\": []}");

        assertTrue(extractor.extract(image, config, CoordinateOrigin.TOP_LEFT).isEmpty());
    }

    @Test
    void missingConfigIsReported(@TempDir Path dir) throws Exception {
        Path image = dir.resolve("scene.png");
        Files.write(image, ImageCodec.encodePng(gradient(8, 8)));

        assertThrows(NoSuchFileException.class,
            () -> extractor.extract(image, dir.resolve("missing.json"), CoordinateOrigin.TOP_LEFT));
    }
}

package com.starscape.imageedit.common.image;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * ImageIO helpers shared by patch extraction and feathering.
 */
public final class ImageCodec {

    private static final Set<String> OPAQUE_SUFFIXES = Set.of("jpg", "jpeg", "bmp", "wbmp");

    private ImageCodec() {
    }

    public static BufferedImage read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return decode(Files.readAllBytes(path), path.toString());
    }

    public static BufferedImage decode(byte[] bytes) throws IOException {
        return decode(bytes, "<bytes>");
    }

    private static BufferedImage decode(byte[] bytes, String source) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Failed to decode image: " + source);
        }
        return image;
    }

    /**
     * PNG keeps the alpha channel and every pixel value.
     */
    public static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer for image type " + image.getType());
        }
        return out.toByteArray();
    }

    /**
     * Encodes an image in the format named by the destination's file extension.
     * Content already in that format, or a destination without an extension, is
     * returned unchanged. Transparency is flattened onto white for formats
     * without an alpha channel.
     *
     * @throws IOException if the content cannot be decoded or no writer handles the extension
     */
    public static byte[] encodeFor(String destination, byte[] content) throws IOException {
        String suffix = suffixOf(destination);
        if (suffix.isEmpty() || hasSuffix(content, suffix)) {
            return content;
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersBySuffix(suffix);
        if (!writers.hasNext()) {
            throw new IOException("No image writer for ." + suffix + ": " + destination);
        }
        BufferedImage image = decode(content, destination);
        if (OPAQUE_SUFFIXES.contains(suffix) && image.getColorModel().hasAlpha()) {
            image = flatten(image);
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            writer.write(image);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    private static String suffixOf(String destination) {
        String name = Path.of(destination).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static boolean hasSuffix(byte[] content, String suffix) throws IOException {
        try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                return false;
            }
            ImageReader reader = readers.next();
            String[] suffixes = reader.getOriginatingProvider().getFileSuffixes();
            reader.dispose();
            return suffixes != null && Arrays.stream(suffixes).anyMatch(suffix::equalsIgnoreCase);
        }
    }

    private static BufferedImage flatten(BufferedImage image) {
        BufferedImage opaque = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = opaque.createGraphics();
        try {
            g.drawImage(image, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return opaque;
    }

    /**
     * Copies a rectangle into a standalone image with the same colour model.
     * Unlike getSubimage the result does not share the source raster.
     */
    public static BufferedImage copyRegion(BufferedImage source, int x, int y, int width, int height) {
        BufferedImage view = source.getSubimage(x, y, width, height);
        ColorModel colorModel = view.getColorModel();
        WritableRaster raster = view.getRaster().createCompatibleWritableRaster(width, height);
        view.copyData(raster);
        return new BufferedImage(colorModel, raster, colorModel.isAlphaPremultiplied(), null);
    }

    /**
     * Reads every pixel as non-premultiplied ARGB.
     * Grayscale rasters are expanded sample by sample: BufferedImage.getRGB would
     * push them through a linear-to-sRGB conversion and change the values.
     */
    public static int[] readArgb(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = new int[width * height];

        if (isComponentGray(image.getColorModel())) {
            Raster raster = image.getRaster();
            int bands = raster.getNumBands();
            int bits = raster.getSampleModel().getSampleSize(0);
            int[] pixel = new int[bands];
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    raster.getPixel(x, y, pixel);
                    int gray = to8Bit(pixel[0], bits);
                    int alpha = bands > 1 ? to8Bit(pixel[1], bits) : 0xFF;
                    argb[y * width + x] = (alpha << 24) | (gray << 16) | (gray << 8) | gray;
                }
            }
            return argb;
        }

        image.getRGB(0, 0, width, height, argb, 0, width);
        return argb;
    }

    private static boolean isComponentGray(ColorModel colorModel) {
        return colorModel instanceof ComponentColorModel
                && colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    private static int to8Bit(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        int max = (1 << bits) - 1;
        return (int) Math.round(sample * 255.0 / max);
    }
}

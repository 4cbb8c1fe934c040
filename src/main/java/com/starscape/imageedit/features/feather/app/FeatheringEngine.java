package com.starscape.imageedit.features.feather.app;

import com.starscape.imageedit.common.config.FeatherProperties;
import com.starscape.imageedit.common.image.ImageCodec;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;

/**
 * Fades the border of an edited patch to transparent so it blends back into the
 * source image.
 *
 * The outermost pixel ring is always background (fully transparent) unless the
 * image is at most 2 pixels in either dimension. Opacity then ramps up with the
 * Euclidean distance from that ring and reaches 1 at {@code radius} pixels.
 * Erosion and the distance transform run on OpenCV.
 * Colour channels are never modified; an existing alpha channel is multiplied in.
 */
@Service
public class FeatheringEngine {

    private static final Logger log = LoggerFactory.getLogger(FeatheringEngine.class);

    private final FeatherOptions defaultOptions;

    public FeatheringEngine(FeatherProperties featherProperties) {
        this.defaultOptions = featherProperties.toOptions();
    }

    public FeatherOptions defaultOptions() {
        return defaultOptions;
    }

    /**
     * Decodes, feathers with the configured options and re-encodes as PNG.
     */
    public byte[] featherPng(byte[] imageBytes) throws IOException {
        return featherPng(imageBytes, defaultOptions);
    }

    public byte[] featherPng(byte[] imageBytes, FeatherOptions options) throws IOException {
        BufferedImage image = ImageCodec.decode(imageBytes);
        return ImageCodec.encodePng(feather(image, options));
    }

    /**
     * @return a new TYPE_INT_ARGB image with the feathered alpha channel
     */
    public BufferedImage feather(BufferedImage image, FeatherOptions options) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("Cannot feather an empty image");
        }

        double[] alpha = computeAlpha(width, height, options);
        int[] argb = ImageCodec.readArgb(image);

        for (int i = 0; i < argb.length; i++) {
            double existing = ((argb[i] >>> 24) & 0xFF) / 255.0;
            double combined = Math.min(1.0, Math.max(0.0, alpha[i] * existing));
            int alpha8 = (int) (combined * 255.0 + 0.5);
            argb[i] = (alpha8 << 24) | (argb[i] & 0x00FFFFFF);
        }

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, width, height, argb, 0, width);
        return out;
    }

    /**
     * Opacity in [0, 1] for every pixel of a width x height patch, row-major,
     * before any existing alpha is taken into account.
     */
    public static double[] computeAlpha(int width, int height, FeatherOptions options) {
        double[] alpha = new double[width * height];
        if (width <= 2 || height <= 2) {
            Arrays.fill(alpha, 1.0);
            return alpha;
        }

        NativeLibrary.ensureLoaded();
        Mat mask = borderMask(width, height);
        Mat distance = new Mat();
        try {
            if (options.shrink() > 0) {
                int size = 2 * options.shrink() + 1;
                Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(size, size));
                Imgproc.erode(mask, mask, kernel);
                kernel.release();
            }

            if (options.radius() > 0) {
                Imgproc.distanceTransform(mask, distance, Imgproc.DIST_L2, Imgproc.DIST_MASK_PRECISE);
                float[] values = new float[width * height];
                distance.get(0, 0, values);
                for (int i = 0; i < alpha.length; i++) {
                    alpha[i] = Math.min(1.0, Math.max(0.0, values[i] / options.radius()));
                }
            } else {
                byte[] values = new byte[width * height];
                mask.get(0, 0, values);
                for (int i = 0; i < alpha.length; i++) {
                    alpha[i] = values[i] != 0 ? 1.0 : 0.0;
                }
            }
        } finally {
            mask.release();
            distance.release();
        }

        if (options.appliesGamma()) {
            for (int i = 0; i < alpha.length; i++) {
                alpha[i] = Math.pow(alpha[i], options.gamma());
            }
        }
        return alpha;
    }

    /**
     * 8-bit mask: 0 on the outer pixel ring, 255 inside.
     */
    private static Mat borderMask(int width, int height) {
        Mat mask = Mat.zeros(height, width, CvType.CV_8UC1);
        Mat interior = mask.submat(1, height - 1, 1, width - 1);
        interior.setTo(new Scalar(255));
        interior.release();
        return mask;
    }

    /**
     * Loads the bundled OpenCV binaries on first use.
     */
    private static final class NativeLibrary {

        static {
            OpenCV.loadLocally();
            log.info("OpenCV native library loaded");
        }

        private NativeLibrary() {
        }

        static void ensureLoaded() {
            // class initialisation does the work
        }
    }
}

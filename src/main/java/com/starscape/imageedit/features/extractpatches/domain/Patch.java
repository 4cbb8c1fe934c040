package com.starscape.imageedit.features.extractpatches.domain;

/**
 * A cropped sub-image ready to be sent to the remote service.
 *
 * @param partId     index of the source region, as a string
 * @param prompt     edit instruction for this region
 * @param box        crop rectangle in source pixels
 * @param pngBytes   PNG-encoded crop
 */
public record Patch(
    String partId,
    String prompt,
    BoundingBox box,
    byte[] pngBytes
) {}

package com.starscape.imageedit.features.submitjob.app;

import java.nio.file.Path;

/**
 * Results are written next to the source image.
 */
final class OutputPaths {

    private OutputPaths() {
    }

    static String forImage(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot > 0 ? name.substring(dot) : "";
        return sibling(source, stem(source) + "_proto" + ext);
    }

    static String forPatch(Path source, String partId) {
        return sibling(source, stem(source) + "_region" + partId + ".png");
    }

    private static String stem(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String sibling(Path source, String fileName) {
        Path parent = source.toAbsolutePath().getParent();
        return (parent == null ? Path.of(fileName) : parent.resolve(fileName)).toString();
    }
}

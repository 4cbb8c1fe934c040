package com.starscape.imageedit.common.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemResultStoreTest {

    private final FileSystemResultStore store = new FileSystemResultStore();

    @Test
    void writesContentAndReturnsAbsolutePath(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/out_region0.png");

        String location = store.save(target.toString(), new byte[]{1, 2, 3});

        assertEquals(target.toAbsolutePath().toString(), location);
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(target));
    }

    @Test
    void replacesExistingFileWithoutLeavingTemporaries(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out_proto.jpg");
        Files.write(target, new byte[]{0});

        store.save(target.toString(), new byte[]{4, 5});

        assertArrayEquals(new byte[]{4, 5}, Files.readAllBytes(target));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }
}

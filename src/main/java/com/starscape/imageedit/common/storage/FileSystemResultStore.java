package com.starscape.imageedit.common.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes results next to their source images. The file is written under a
 * temporary name and moved into place, so readers never see a partial image.
 */
@Component
@ConditionalOnProperty(name = "app.storage.type", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemResultStore.class);

    @Override
    public String save(String destination, byte[] content) throws IOException {
        Path target = Path.of(destination).toAbsolutePath();
        Path directory = target.getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, ".partial-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.debug("Saved result: path={}, bytes={}", target, content.length);
        return target.toString();
    }
}

package com.starscape.imageedit.features.extractpatches.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.starscape.imageedit.features.extractpatches.domain.RegionConfig;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads region config JSON files. Fields other than "differences" are ignored.
 */
@Component
public class RegionConfigReader {

    private final ObjectReader reader;

    public RegionConfigReader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(RegionConfig.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public RegionConfig read(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new NoSuchFileException(configPath.toString());
        }
        RegionConfig config = reader.readValue(configPath.toFile());
        return config != null ? config : new RegionConfig(null);
    }
}

package com.starscape.imageedit.common.config;

import com.starscape.imageedit.features.extractpatches.domain.CoordinateOrigin;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for patch extraction.
 * Binds to app.extraction.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.extraction")
public class ExtractionProperties {

    private CoordinateOrigin coordinateOrigin = CoordinateOrigin.TOP_LEFT;

    public CoordinateOrigin getCoordinateOrigin() {
        return coordinateOrigin;
    }

    public void setCoordinateOrigin(CoordinateOrigin coordinateOrigin) {
        this.coordinateOrigin = coordinateOrigin;
    }
}

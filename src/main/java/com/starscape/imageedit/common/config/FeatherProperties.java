package com.starscape.imageedit.common.config;

import com.starscape.imageedit.features.feather.app.FeatherOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Feathering applied to batch patch results before they are stored.
 * Binds to app.feather.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.feather")
public class FeatherProperties {

    private int radius = 8;
    private int shrink = 0;
    private double gamma = 1.0;

    public int getRadius() {
        return radius;
    }

    public void setRadius(int radius) {
        this.radius = radius;
    }

    public int getShrink() {
        return shrink;
    }

    public void setShrink(int shrink) {
        this.shrink = shrink;
    }

    public double getGamma() {
        return gamma;
    }

    public void setGamma(double gamma) {
        this.gamma = gamma;
    }

    public FeatherOptions toOptions() {
        return new FeatherOptions(radius, shrink, gamma);
    }
}

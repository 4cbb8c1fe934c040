package com.starscape.imageedit.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where edit results are written.
 * Binds to app.storage.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /**
     * "filesystem" (default) or "s3".
     */
    private String type = "filesystem";
    private String bucket;
    private String keyPrefix = "";
    private String region = "us-east-1";
    private String profile;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }
}

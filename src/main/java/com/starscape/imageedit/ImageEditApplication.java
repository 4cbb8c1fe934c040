package com.starscape.imageedit;

import com.starscape.imageedit.common.config.ExtractionProperties;
import com.starscape.imageedit.common.config.FeatherProperties;
import com.starscape.imageedit.common.config.OrchestratorProperties;
import com.starscape.imageedit.common.config.RemoteServiceProperties;
import com.starscape.imageedit.common.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    OrchestratorProperties.class,
    RemoteServiceProperties.class,
    FeatherProperties.class,
    ExtractionProperties.class,
    StorageProperties.class
})
public class ImageEditApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageEditApplication.class, args);
    }
}

package com.starscape.imageedit.features.remotetask.infra;

import com.starscape.imageedit.common.config.RemoteServiceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RemoteClientConfig {

    public static final String RUNNING_HUB_REST_CLIENT = "runningHubRestClient";

    @Bean(name = RUNNING_HUB_REST_CLIENT)
    public RestClient runningHubRestClient(RestClient.Builder builder, RemoteServiceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        return builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}

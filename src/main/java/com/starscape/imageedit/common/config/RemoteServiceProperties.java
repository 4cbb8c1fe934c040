package com.starscape.imageedit.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the RunningHub workflow API.
 * Binds to app.remote.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.remote")
public class RemoteServiceProperties {

    private String baseUrl = "https://www.runninghub.cn";
    private String apiKey;
    private String webhookUrl;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);
    private Workflow single = new Workflow();
    private Workflow batch = new Workflow();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Workflow getSingle() {
        return single;
    }

    public void setSingle(Workflow single) {
        this.single = single;
    }

    public Workflow getBatch() {
        return batch;
    }

    public void setBatch(Workflow batch) {
        this.batch = batch;
    }

    /**
     * A remote workflow and the node fields the orchestrator fills in.
     * promptNodeId is unused by the whole-image workflow.
     */
    public static class Workflow {

        private String workflowId;
        private String imageNodeId;
        private String imageFieldName = "image";
        private String promptNodeId;
        private String promptFieldName = "prompt";

        public String getWorkflowId() {
            return workflowId;
        }

        public void setWorkflowId(String workflowId) {
            this.workflowId = workflowId;
        }

        public String getImageNodeId() {
            return imageNodeId;
        }

        public void setImageNodeId(String imageNodeId) {
            this.imageNodeId = imageNodeId;
        }

        public String getImageFieldName() {
            return imageFieldName;
        }

        public void setImageFieldName(String imageFieldName) {
            this.imageFieldName = imageFieldName;
        }

        public String getPromptNodeId() {
            return promptNodeId;
        }

        public void setPromptNodeId(String promptNodeId) {
            this.promptNodeId = promptNodeId;
        }

        public String getPromptFieldName() {
            return promptFieldName;
        }

        public void setPromptFieldName(String promptFieldName) {
            this.promptFieldName = promptFieldName;
        }
    }
}

package com.starscape.imageedit.features.remotetask.infra;

import com.starscape.imageedit.common.config.RemoteServiceProperties;
import com.starscape.imageedit.common.exception.RemoteServiceException;
import com.starscape.imageedit.features.remotetask.domain.NodeInfo;
import com.starscape.imageedit.features.remotetask.domain.RemoteTaskService;
import com.starscape.imageedit.features.remotetask.infra.dto.CreateTaskData;
import com.starscape.imageedit.features.remotetask.infra.dto.CreateTaskRequest;
import com.starscape.imageedit.features.remotetask.infra.dto.RunningHubResponse;
import com.starscape.imageedit.features.remotetask.infra.dto.UploadData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.List;

/**
 * RunningHub workflow OpenAPI client.
 * Uploads inputs, creates webhook-reporting tasks and downloads results.
 */
@Component
public class RunningHubClient implements RemoteTaskService {

    private static final Logger log = LoggerFactory.getLogger(RunningHubClient.class);

    static final String UPLOAD_PATH = "/task/openapi/upload";
    static final String CREATE_PATH = "/task/openapi/create";

    private final RestClient restClient;
    private final RemoteServiceProperties properties;

    public RunningHubClient(
            @Qualifier(RemoteClientConfig.RUNNING_HUB_REST_CLIENT) RestClient restClient,
            RemoteServiceProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public String upload(byte[] content, String filename, String fileType) {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("apiKey", properties.getApiKey());
        form.add("fileType", fileType);
        form.add("file", new NamedByteArrayResource(content, filename));

        RunningHubResponse<UploadData> response;
        try {
            response = restClient.post()
                    .uri(UPLOAD_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(new ParameterizedTypeReference<RunningHubResponse<UploadData>>() {});
        } catch (RestClientException e) {
            throw new RemoteServiceException("Upload failed for " + filename + ": " + e.getMessage(), e);
        }

        UploadData data = requireSuccess(response, "upload").data();
        if (data == null || data.fileName() == null) {
            throw new RemoteServiceException("Upload response carries no file name");
        }
        log.debug("Uploaded {} ({} bytes) as {}", filename, content.length, data.fileName());
        return data.fileName();
    }

    @Override
    public String createTask(String workflowId, List<NodeInfo> nodeInfoList) {
        CreateTaskRequest request = new CreateTaskRequest(
            properties.getApiKey(),
            workflowId,
            nodeInfoList,
            properties.getWebhookUrl()
        );

        RunningHubResponse<CreateTaskData> response;
        try {
            response = restClient.post()
                    .uri(CREATE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(new ParameterizedTypeReference<RunningHubResponse<CreateTaskData>>() {});
        } catch (RestClientException e) {
            throw new RemoteServiceException("Task creation failed for workflow " + workflowId + ": " + e.getMessage(), e);
        }

        CreateTaskData data = requireSuccess(response, "create task").data();
        if (data == null || data.taskId() == null || data.taskId().isBlank()) {
            throw new RemoteServiceException("Create task response carries no task id");
        }
        log.info("Created remote task: taskId={}, workflowId={}, status={}", data.taskId(), workflowId, data.taskStatus());
        return data.taskId();
    }

    @Override
    public byte[] download(String url) {
        if (url == null || url.isBlank()) {
            throw new RemoteServiceException("No result URL to download");
        }
        try {
            byte[] body = restClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(byte[].class);
            if (body == null) {
                throw new RemoteServiceException("Empty download from " + url);
            }
            return body;
        } catch (RestClientException | IllegalArgumentException e) {
            throw new RemoteServiceException("Download failed from " + url + ": " + e.getMessage(), e);
        }
    }

    private static <T> RunningHubResponse<T> requireSuccess(RunningHubResponse<T> response, String operation) {
        if (response == null) {
            throw new RemoteServiceException("Empty response to " + operation);
        }
        if (!response.isSuccess()) {
            throw new RemoteServiceException(
                String.format("%s rejected: code=%d, msg=%s", operation, response.code(), response.msg()),
                response.code());
        }
        return response;
    }

    /**
     * Multipart file parts need a file name, which a plain ByteArrayResource lacks.
     */
    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String filename;

        NamedByteArrayResource(byte[] content, String filename) {
            super(content);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}

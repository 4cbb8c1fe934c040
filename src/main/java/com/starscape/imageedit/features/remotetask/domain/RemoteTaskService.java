package com.starscape.imageedit.features.remotetask.domain;

import java.util.List;

/**
 * The asynchronous inference service. Task results are not returned here: the
 * service calls the configured webhook when a task finishes.
 *
 * Every method throws {@link com.starscape.imageedit.common.exception.RemoteServiceException}
 * on transport errors or a non-zero status code. Nothing is retried.
 */
public interface RemoteTaskService {

    /**
     * @return the service-side file name to reference from node parameters
     */
    String upload(byte[] content, String filename, String fileType);

    /**
     * @return the id under which the task's completion callback will arrive
     */
    String createTask(String workflowId, List<NodeInfo> nodeInfoList);

    byte[] download(String url);
}

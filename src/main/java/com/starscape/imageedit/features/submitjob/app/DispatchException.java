package com.starscape.imageedit.features.submitjob.app;

public class DispatchException extends RuntimeException {

    private final String jobId;

    public DispatchException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}

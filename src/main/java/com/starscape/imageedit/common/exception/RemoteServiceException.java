package com.starscape.imageedit.common.exception;

/**
 * A call to the remote workflow service failed, either at the transport level
 * or because the service answered with a non-zero status code.
 */
public class RemoteServiceException extends RuntimeException {

    private final Integer code;

    public RemoteServiceException(String message) {
        super(message);
        this.code = null;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.code = null;
    }

    public RemoteServiceException(String message, int code) {
        super(message);
        this.code = code;
    }

    /**
     * @return the service status code, or null for transport failures
     */
    public Integer getCode() {
        return code;
    }
}

package com.starscape.imageedit.common.storage;

import java.io.IOException;

/**
 * Persists edit results at the destination recorded for their task.
 */
public interface ResultStore {

    /**
     * @param destination output path derived from the source image
     * @return where the bytes ended up, for logs and job status
     */
    String save(String destination, byte[] content) throws IOException;
}

package com.realtyhub.backend.modules.storage.application;

/**
 * Object store holding listing images. Implementations raise {@code storage.unavailable} (502)
 * when the store cannot be reached.
 */
public interface BlobStorage {

    /**
     * Stores the bytes under a generated key inside {@code folder}.
     *
     * @return public URL of the stored object
     */
    String upload(byte[] content, String fileName, String folder, String contentType);

    void delete(String url);

    boolean exists(String url);
}

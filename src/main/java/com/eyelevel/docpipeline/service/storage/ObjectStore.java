package com.eyelevel.docpipeline.service.storage;

import java.io.InputStream;
import java.net.URL;

/**
 * Binary content access for documents and derived artifacts.
 */
public interface ObjectStore {

    /**
     * Opens the object for reading. The caller closes the stream.
     */
    InputStream getObject(String key);

    /**
     * Reads the whole object into memory.
     */
    byte[] getObjectBytes(String key);

    void uploadBuffer(String key, byte[] content, String contentType);

    void copyObject(String sourceKey, String destinationKey);

    void deleteObject(String key);

    URL getPresignedUploadUrl(String key, String contentType);

    URL getPresignedDownloadUrl(String key);
}

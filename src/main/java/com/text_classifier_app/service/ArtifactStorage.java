package com.text_classifier_app.service;

/**
 * Binary object store for model artifacts, addressed by path-like keys.
 */
public interface ArtifactStorage {

    void put(String key, byte[] content, String contentType);

    /**
     * @throws com.text_classifier_app.exception.ArtifactNotFoundException when nothing is stored under the key
     */
    byte[] get(String key);

    boolean exists(String key);

    void delete(String key);

    /**
     * @return number of objects removed
     */
    int deletePrefix(String prefix);
}

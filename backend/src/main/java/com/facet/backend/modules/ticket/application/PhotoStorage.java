package com.facet.backend.modules.ticket.application;

/**
 * Where photo bytes live. Keys are generated by the caller and are safe path segments.
 */
public interface PhotoStorage {

    void store(String storageKey, byte[] content);

    byte[] load(String storageKey);

    void delete(String storageKey);
}

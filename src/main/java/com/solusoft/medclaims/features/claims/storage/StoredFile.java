package com.solusoft.medclaims.features.claims.storage;

/**
 * Result of persisting an uploaded document.
 *
 * @param originalName name the client sent
 * @param path         where the bytes now live
 * @param contentType  MIME type detected from the content
 */
public record StoredFile(String originalName, String path, String contentType) {}

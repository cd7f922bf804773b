package dev.pekelund.reconciler.service;

import java.util.Objects;

/**
 * An uploaded PDF together with the name it was uploaded under.
 */
public record DocumentUpload(String fileName, byte[] content) {

    public DocumentUpload {
        Objects.requireNonNull(fileName, "fileName must not be null");
        content = content == null ? new byte[0] : content;
    }
}

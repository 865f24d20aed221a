package com.kmg.classifier.payload;

import com.kmg.classifier.config.ClassifierProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads payloads from the upload directory. A {@code payloadRef} is a path relative to the root;
 * absolute refs are accepted only when they stay inside it.
 */
@Service
public class FilePayloadStore implements PayloadStore {
    private final Path rootDir;

    @Autowired
    public FilePayloadStore(ClassifierProperties properties) {
        this(Path.of(properties.getPayload().getRootDir()));
    }

    public FilePayloadStore(Path rootDir) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
    }

    @Override
    public byte[] load(String payloadRef) {
        Path path = resolve(payloadRef);
        if (!Files.isRegularFile(path)) {
            throw new PayloadUnavailableException("File not found: " + payloadRef, true);
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            if (bytes.length == 0) {
                throw new PayloadUnavailableException("File is empty: " + payloadRef, true);
            }
            return bytes;
        } catch (NoSuchFileException e) {
            throw new PayloadUnavailableException("File not found: " + payloadRef, true, e);
        } catch (IOException e) {
            throw new PayloadUnavailableException("Failed to read " + payloadRef + ": " + e.getMessage(), false, e);
        }
    }

    Path resolve(String payloadRef) {
        if (payloadRef == null || payloadRef.isBlank()) {
            throw new PayloadUnavailableException("No payload reference provided", true);
        }
        Path resolved;
        try {
            resolved = rootDir.resolve(payloadRef).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new PayloadUnavailableException("Invalid payload reference: " + payloadRef, true, e);
        }
        if (!resolved.startsWith(rootDir)) {
            throw new PayloadUnavailableException("Payload reference outside upload root: " + payloadRef, true);
        }
        return resolved;
    }
}

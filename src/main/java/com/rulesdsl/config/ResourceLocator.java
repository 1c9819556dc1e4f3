package com.rulesdsl.config;

import com.rulesdsl.exception.ConfigurationException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Resolves configuration paths. Supports the classpath: prefix; anything else is a file path.
 */
public final class ResourceLocator {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceLocator() {
    }

    public static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Resource path is empty");
        }
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    /**
     * Read a whole text resource as UTF-8.
     */
    public static String readString(String path) {
        Resource resource = getResource(path);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read resource: " + path, e);
        }
    }
}

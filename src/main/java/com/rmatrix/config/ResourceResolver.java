package com.rmatrix.config;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Resolves configuration and rules paths.
 * Supports classpath: prefix for classpath resources.
 */
public final class ResourceResolver {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceResolver() {
    }

    public static Resource resolve(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }
}

package com.demoAuto.salesAgent.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading text and JSON resources from the classpath.
 * Used for the vehicle catalog and the knowledge base, both read once at startup.
 */
public class ClasspathResourceLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ClasspathResourceLoader() {}

    /**
     * Loads a classpath resource as a UTF-8 String.
     *
     * @param resourcePath The path to the resource (e.g., "catalog/vehicles.json")
     * @return The resource content
     * @throws IOException if the resource cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = ClasspathResourceLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON resource from the classpath as a JsonNode.
     *
     * @param resourcePath The path to the JSON resource
     * @return The JSON content as a JsonNode
     * @throws IOException if the resource cannot be read, doesn't exist, or is not valid JSON
     */
    public static JsonNode loadAsJsonNode(String resourcePath) throws IOException {
        return objectMapper.readTree(loadAsString(resourcePath));
    }
}

package com.irep;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.irep.util.GraphQLStringUtils;
import graphql.schema.GraphQLSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap; // Preserve query order
import java.util.Map;
import java.util.Objects;

/**
 * Loads the schema location and the sample queries to build from config.yaml.
 */
public class Config {

    // These field names must match the top-level keys in config.yaml
    private String schemaFile;
    private Map<String, QueryDefinition> queries = new LinkedHashMap<>();

    public String getSchemaFile() {
        return schemaFile;
    }

    public void setSchemaFile(String schemaFile) {
        this.schemaFile = schemaFile;
    }

    public Map<String, QueryDefinition> getQueries() {
        return queries;
    }

    public void setQueries(Map<String, QueryDefinition> queries) {
        this.queries = queries;
    }

    // --- Inner classes representing the structure in YAML ---

    public static class QueryDefinition {
        private String document;
        private String operationName;
        private Map<String, Object> variables;

        public String getDocument() {
            return document;
        }

        public void setDocument(String document) {
            this.document = document;
        }

        /**
         * @return The operation to print, or null for the document's only operation.
         */
        public String getOperationName() {
            return operationName;
        }

        public void setOperationName(String operationName) {
            this.operationName = operationName;
        }

        public Map<String, Object> getVariables() {
            return variables == null ? Collections.emptyMap() : variables;
        }

        public void setVariables(Map<String, Object> variables) {
            this.variables = variables;
        }
    }

    // --- Loading Logic ---

    /**
     * Loads configuration from the specified classpath resource path.
     * @param resourcePath Path relative to the classpath root (e.g., "config.yaml")
     * @return Loaded Config object.
     * @throws RuntimeException if loading fails.
     */
    public static Config loadFromResources(String resourcePath) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RuntimeException("Cannot find configuration file in classpath: " + resourcePath);
            }
            Config config = mapper.readValue(is, Config.class);
            if (config.getQueries() == null) {
                config.queries = Collections.emptyMap(); // Avoid NPE later
            }
            return config;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load configuration from " + resourcePath, e);
        }
    }

    /**
     * Reads the configured schema file from the classpath and builds the schema.
     * @throws RuntimeException if the file is missing or not valid SDL.
     */
    public GraphQLSchema loadSchema() {
        Objects.requireNonNull(schemaFile, "schemaFile is not configured");
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(schemaFile)) {
            if (is == null) {
                throw new RuntimeException("Cannot find schema file in classpath: " + schemaFile);
            }
            return GraphQLStringUtils.parseSchema(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read schema from " + schemaFile, e);
        }
    }

    /**
     * Gets a configured query by name.
     * @throws IllegalArgumentException if no query has that name.
     */
    public QueryDefinition getQuery(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        QueryDefinition query = queries.get(name);
        if (query == null) {
            throw new IllegalArgumentException("Query not found in config: " + name);
        }
        return query;
    }
}

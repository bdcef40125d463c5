package com.irep.util;

import graphql.language.AstPrinter;
import graphql.language.Document;
import graphql.language.Node;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import graphql.schema.idl.errors.SchemaProblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Utility methods for parsing and printing GraphQL text with graphql-java.
 */
public final class GraphQLStringUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphQLStringUtils.class);

    private GraphQLStringUtils() {}

    /**
     * Parses an executable document (operations and fragments).
     * @param query The document text.
     * @return The parsed Document.
     * @throws RuntimeException wrapping the syntax error if parsing fails.
     */
    public static Document parseDocument(String query) {
        Objects.requireNonNull(query, "query string cannot be null");
        try {
            return new Parser().parseDocument(query);
        } catch (InvalidSyntaxException e) {
            LOGGER.debug("Failed to parse document:\n{}", query);
            throw new RuntimeException("GraphQL Parsing Error: " + e.getMessage(), e);
        }
    }

    /**
     * Parses schema definition language into a schema without resolvers.
     * Only the type structure is needed to build the internal representation.
     * @param sdl The schema text.
     * @return The schema.
     * @throws RuntimeException if the SDL is invalid.
     */
    public static GraphQLSchema parseSchema(String sdl) {
        Objects.requireNonNull(sdl, "schema string cannot be null");
        try {
            TypeDefinitionRegistry registry = new SchemaParser().parse(sdl);
            return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
        } catch (SchemaProblem | InvalidSyntaxException e) {
            throw new RuntimeException("GraphQL Schema Error: " + e.getMessage(), e);
        }
    }

    /**
     * Prints an AST node back into GraphQL text.
     * @param node The AST node.
     * @return The printed text, or "NULL" for a null node.
     */
    public static String print(Node<?> node) {
        if (node == null) {
            return "NULL";
        }
        return AstPrinter.printAst(node);
    }
}

package com.irep;

import com.irep.ir.InternalRepresentation;
import com.irep.ir.IrNode;
import graphql.schema.GraphQLSchema;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

public class Main {

    public static void main(String[] args) {
        printHeader();

        // --- Load Config ---
        Config config;
        GraphQLSchema schema;
        try {
            config = Config.loadFromResources(args.length > 0 ? args[0] : "config.yaml");
            schema = config.loadSchema();
            System.out.println("INFO: Configuration loaded successfully.");
            System.out.println("Schema: " + config.getSchemaFile());
            System.out.println("Loaded Queries: " + config.getQueries().keySet());
        } catch (Exception e) {
            System.err.println("FATAL: Configuration loading failed: " + e.getMessage());
            e.printStackTrace();
            return;
        }

        InternalRepresentationBuilder builder = new InternalRepresentationBuilder(schema);
        for (Map.Entry<String, Config.QueryDefinition> entry : config.getQueries().entrySet()) {
            Config.QueryDefinition query = entry.getValue();
            System.out.println("\n========================================================");
            System.out.println("QUERY: " + entry.getKey());
            System.out.println("========================================================");
            System.out.println(query.getDocument().trim());
            System.out.println("--------------------------------------------------------");
            try {
                InternalRepresentation irep = builder.build(query.getDocument(), query.getVariables());
                Optional<IrNode> operation = irep.selectOperation(query.getOperationName());
                if (operation.isPresent()) {
                    System.out.print(operation.get().toString(""));
                } else {
                    System.out.println("No operation selected (name: " + query.getOperationName() + ")");
                }
                if (!irep.getUnresolvedFragments().isEmpty()) {
                    System.out.println("Unresolved fragments: " + irep.getUnresolvedFragments());
                }
            } catch (Exception e) {
                System.err.println("ERROR: Failed to build " + entry.getKey() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Prints a header with current timestamp.
     */
    private static void printHeader() {
        ZonedDateTime zdtNow = ZonedDateTime.now(ZoneId.systemDefault());
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
        System.out.println("--- GraphQL Internal Representation ---");
        System.out.println("Run Time: " + zdtNow.format(formatter));
        System.out.println("---------------------------------------");
    }
}

package com.irep;

import com.irep.ir.InternalRepresentation;
import com.irep.ir.IrNode;
import graphql.schema.GraphQLSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ConfigTest {

    private Config config;

    @BeforeAll
    void setup() {
        config = Config.loadFromResources("config.yaml");
    }

    @Test
    @DisplayName("Queries are loaded in file order")
    void testQueriesLoaded() {
        assertEquals("schema.graphqls", config.getSchemaFile());
        assertEquals(List.of("siblings", "interfaceSelections", "sharedFragment", "conditional"),
                List.copyOf(config.getQueries().keySet()));
        assertEquals(Map.of("withOwner", false), config.getQuery("conditional").getVariables());
        assertTrue(config.getQuery("siblings").getVariables().isEmpty());
        assertNull(config.getQuery("siblings").getOperationName());
    }

    @Test
    @DisplayName("The configured schema loads")
    void testSchemaLoaded() {
        GraphQLSchema schema = config.loadSchema();
        assertNotNull(schema.getType("Pet"));
        assertNotNull(schema.getMutationType());
    }

    @Test
    @DisplayName("Every configured query builds")
    void testConfiguredQueriesBuild() {
        InternalRepresentationBuilder builder = new InternalRepresentationBuilder(config.loadSchema());
        for (Map.Entry<String, Config.QueryDefinition> entry : config.getQueries().entrySet()) {
            InternalRepresentation irep = builder.build(entry.getValue().getDocument(), entry.getValue().getVariables());
            IrNode operation = irep.selectOperation(entry.getValue().getOperationName()).orElseThrow();
            assertFalse(operation.getScopedChildren().isEmpty(), entry.getKey() + " built an empty operation");
            assertTrue(irep.getUnresolvedFragments().isEmpty());
        }
    }

    @Test
    @DisplayName("The conditional query drops the excluded owner")
    void testConditionalQuery() {
        InternalRepresentationBuilder builder = new InternalRepresentationBuilder(config.loadSchema());
        Config.QueryDefinition query = config.getQuery("conditional");
        IrNode root = builder.build(query.getDocument(), query.getVariables()).getOperations().get("Conditional");
        IrNode cat = root.getTypedChildren().values().iterator().next().get("cat");
        assertEquals(List.of("name"), List.copyOf(cat.getTypedChildren().values().iterator().next().keySet()));
    }

    @Test
    @DisplayName("Missing resources and unknown queries fail")
    void testFailures() {
        assertThrows(RuntimeException.class, () -> Config.loadFromResources("missing.yaml"));
        assertThrows(IllegalArgumentException.class, () -> config.getQuery("nope"));

        Config broken = new Config();
        broken.setSchemaFile("missing.graphqls");
        assertThrows(RuntimeException.class, broken::loadSchema);
    }
}

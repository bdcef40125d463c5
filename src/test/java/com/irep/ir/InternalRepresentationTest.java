package com.irep.ir;

import com.irep.TestSchemas;
import com.irep.schema.TypeContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.irep.TestSchemas.type;
import static org.junit.jupiter.api.Assertions.*;

public class InternalRepresentationTest {

    private final TypeContext typeContext = TestSchemas.typeContext();

    private IrNode root(String name) {
        return new IrNode(typeContext, name, type("Query"), type("Query"));
    }

    @Test
    @DisplayName("Without a name the only operation is selected")
    void testSelectSoleOperation() {
        IrNode only = root("Only");
        InternalRepresentation irep = new InternalRepresentation(Map.of("Only", only), Map.of(), Set.of());

        assertSame(only, irep.selectOperation(null).orElseThrow());
        assertSame(only, irep.selectOperation("Only").orElseThrow());
        assertTrue(irep.selectOperation("Other").isEmpty());
    }

    @Test
    @DisplayName("Several operations need a name")
    void testSelectAmongSeveral() {
        Map<String, IrNode> operations = new LinkedHashMap<>();
        operations.put("First", root("First"));
        operations.put("Second", root("Second"));
        InternalRepresentation irep = new InternalRepresentation(operations, Map.of(), Set.of());

        assertTrue(irep.selectOperation(null).isEmpty());
        assertSame(operations.get("Second"), irep.selectOperation("Second").orElseThrow());
    }

    @Test
    @DisplayName("A document without operations selects nothing")
    void testSelectWithoutOperations() {
        InternalRepresentation irep = new InternalRepresentation(Map.of(), Map.of("F", root("F")), Set.of("F"));
        assertTrue(irep.selectOperation(null).isEmpty());
        assertEquals(Set.of("F"), irep.getUnresolvedFragments());
        assertThrows(UnsupportedOperationException.class, () -> irep.getFragmentDefinitions().clear());
    }
}

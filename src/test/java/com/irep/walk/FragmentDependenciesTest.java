package com.irep.walk;

import com.irep.TestSchemas;
import com.irep.util.GraphQLStringUtils;
import graphql.language.FragmentSpread;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FragmentDependenciesTest {

    private final List<String> order = new ArrayList<>();
    private final Map<String, List<FragmentSpread>> spreads = new LinkedHashMap<>();
    private final Map<String, Boolean> defined = new LinkedHashMap<>();

    private FragmentDependencies resolve(String query) {
        FragmentDependencies dependencies = new FragmentDependencies();
        new DocumentWalker(TestSchemas.typeContext(), List.of(dependencies))
                .walk(GraphQLStringUtils.parseDocument(query));
        dependencies.resolve((name, definition, fragmentSpreads) -> {
            order.add(name);
            spreads.put(name, fragmentSpreads);
            defined.put(name, definition != null);
        });
        return dependencies;
    }

    @Test
    @DisplayName("Fragments are reported after the fragments they spread")
    void testBottomUpOrder() {
        resolve("{ pet { ...A } }\n"
                + "fragment A on Pet { ...B ...C }\n"
                + "fragment B on Pet { ...C name }\n"
                + "fragment C on Pet { name }");

        assertEquals(List.of("C", "B", "A"), order);
    }

    @Test
    @DisplayName("Fragments used before their definition are handled the same way")
    void testForwardReferences() {
        resolve("fragment Outer on Cat { ...Inner }\n"
                + "{ cat { ...Outer } }\n"
                + "fragment Inner on Cat { meow }");

        assertEquals(List.of("Inner", "Outer"), order);
        assertEquals(1, spreads.get("Outer").size());
        assertEquals(1, spreads.get("Inner").size());
    }

    @Test
    @DisplayName("Every spread of a fragment is reported, in document order")
    void testAllSpreads() {
        resolve("{ cat { ...F } dog { owner { pets { ...F } } } }\n"
                + "fragment F on Pet { name }\n"
                + "fragment G on Pet { ...F }");

        assertEquals(List.of("F", "G"), order);
        assertEquals(3, spreads.get("F").size());
        assertTrue(spreads.get("G").isEmpty());
        spreads.get("F").forEach(spread -> assertEquals("F", spread.getName()));
    }

    @Test
    @DisplayName("Undefined fragments come first without a definition")
    void testUndefinedFragments() {
        resolve("{ cat { ...Missing ...Known } }\n"
                + "fragment Known on Cat { ...AlsoMissing meow }");

        assertEquals(List.of("Missing", "AlsoMissing", "Known"), order);
        assertFalse(defined.get("Missing"));
        assertFalse(defined.get("AlsoMissing"));
        assertTrue(defined.get("Known"));
    }

    @Test
    @DisplayName("Cycles and fragments depending on them are left unresolved")
    void testCycles() {
        FragmentDependencies dependencies = resolve("{ cat { ...A ...Free } }\n"
                + "fragment A on Cat { ...B }\n"
                + "fragment B on Cat { ...A }\n"
                + "fragment Self on Cat { ...Self }\n"
                + "fragment OnTop on Cat { ...A }\n"
                + "fragment Free on Cat { name }");

        assertEquals(List.of("Free"), order);
        assertEquals(Set.of("A", "B", "Self", "OnTop"), dependencies.getUnresolvedFragments());
    }

    @Test
    @DisplayName("Resolution runs only once")
    void testResolveOnce() {
        FragmentDependencies dependencies = resolve("{ cat { name } }");
        assertTrue(order.isEmpty());
        assertThrows(IllegalStateException.class, () -> dependencies.resolve((name, definition, s) -> { }));
    }
}

package com.irep.ir;

import com.irep.TestSchemas;
import com.irep.schema.TypeContext;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNamedType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.irep.TestSchemas.type;
import static org.junit.jupiter.api.Assertions.*;

public class ScopeTest {

    private final TypeContext typeContext = TestSchemas.typeContext();

    @Test
    @DisplayName("Object types make a concrete scope, abstract types stay unexpanded")
    void testConstruct() {
        Scope cat = Scope.of(typeContext, type("Cat"));
        assertEquals(Scope.Mode.CONCRETE, cat.getMode());
        assertEquals(Set.of(type("Cat")), cat.getTypes());
        assertNull(cat.getAbstractType());

        Scope pet = Scope.of(typeContext, type("Pet"));
        assertEquals(Scope.Mode.ABSTRACT, pet.getMode());
        assertSame(type("Pet"), pet.getAbstractType());
        assertEquals(Set.of(type("Cat"), type("Dog")), pet.getTypes());

        Scope listed = Scope.of(typeContext, List.of(type("Cat"), type("Dog"), type("Cat")));
        assertEquals(Scope.Mode.CONCRETE, listed.getMode());
        assertEquals(Set.of(type("Cat"), type("Dog")), listed.getTypes());
    }

    @Test
    @DisplayName("Entering the current value returns the same scope")
    void testEnterSameValue() {
        Scope pet = Scope.of(typeContext, type("Pet"));
        assertSame(pet, pet.enter(type("Pet")));

        Scope cat = Scope.of(typeContext, type("Cat"));
        assertSame(cat, cat.enter(type("Cat")));

        Scope catsAndDogs = Scope.of(typeContext, Set.of(type("Cat"), type("Dog")));
        assertSame(catsAndDogs, catsAndDogs.enter(List.of(type("Dog"), type("Cat"))));
    }

    @Test
    @DisplayName("A concrete scope intersects with the requested types")
    void testConcreteEnter() {
        Scope catsAndDogs = Scope.of(typeContext, Set.of(type("Cat"), type("Dog")));

        Scope cats = catsAndDogs.enter(type("HumanOrCat"));
        assertEquals(Scope.Mode.CONCRETE, cats.getMode());
        assertEquals(Set.of(type("Cat")), cats.getTypes());

        Scope none = Scope.of(typeContext, type("Human")).enter(type("Pet"));
        assertTrue(none.isEmpty());
    }

    @Test
    @DisplayName("An abstract scope keeps a narrower abstract type unexpanded")
    void testAbstractEnterSubset() {
        Scope named = Scope.of(typeContext, type("Named"));
        Scope pet = named.enter(type("Pet"));
        assertNotSame(named, pet);
        assertEquals(Scope.Mode.ABSTRACT, pet.getMode());
        assertSame(type("Pet"), pet.getAbstractType());

        // Same possible types, different abstract type: still a subset
        Scope catOrDog = pet.enter(type("CatOrDog"));
        assertEquals(Scope.Mode.ABSTRACT, catOrDog.getMode());
        assertSame(type("CatOrDog"), catOrDog.getAbstractType());

        Scope cat = pet.enter(type("Cat"));
        assertEquals(Scope.Mode.CONCRETE, cat.getMode());
        assertEquals(Set.of(type("Cat")), cat.getTypes());
    }

    @Test
    @DisplayName("An abstract scope degrades to concrete when the abstract views disagree")
    void testAbstractEnterDegrades() {
        Scope pet = Scope.of(typeContext, type("Pet"));

        Scope cat = pet.enter(type("HumanOrCat"));
        assertEquals(Scope.Mode.CONCRETE, cat.getMode());
        assertEquals(Set.of(type("Cat")), cat.getTypes());

        Scope named = pet.enter(type("Named"));
        assertEquals(Scope.Mode.CONCRETE, named.getMode());
        assertEquals(Set.of(type("Cat"), type("Dog")), named.getTypes());

        Scope humans = pet.enter(type("Human"));
        assertTrue(humans.isEmpty());

        Scope fromSet = pet.enter(List.of(type("Cat"), type("Human")));
        assertEquals(Scope.Mode.CONCRETE, fromSet.getMode());
        assertEquals(Set.of(type("Cat")), fromSet.getTypes());
    }

    @Test
    @DisplayName("Nested type conditions never widen the scope")
    void testMonotonicNarrowing() {
        List<String> chain = List.of("Pet", "Named", "CatOrDog", "HumanOrCat", "Pet", "Cat", "Named");
        Scope scope = Scope.of(typeContext, type("Named"));
        for (String typeName : chain) {
            Scope next = scope.enter(type(typeName));
            Set<GraphQLNamedType> parentTypes = scope.getTypes();
            assertTrue(parentTypes.containsAll(next.getTypes()),
                    next + " is not within " + scope + " after entering " + typeName);
            scope = next;
        }
        assertEquals(Set.of(type("Cat")), scope.getTypes());
    }

    @Test
    @DisplayName("The empty scope stays empty")
    void testEmptyScope() {
        Scope empty = Scope.empty(typeContext);
        assertTrue(empty.isEmpty());
        assertTrue(empty.enter(type("Pet")).isEmpty());
        assertTrue(empty.enter(type("Cat")).isEmpty());
    }

    @Test
    @DisplayName("Values outside the known type variants are rejected")
    void testMalformedInput() {
        Scope pet = Scope.of(typeContext, type("Pet"));
        Scope cat = Scope.of(typeContext, type("Cat"));

        assertThrows(IllegalArgumentException.class, () -> pet.enter(GraphQLList.list(type("Cat"))));
        assertThrows(IllegalArgumentException.class, () -> cat.enter(type("PetFilter")));
        assertThrows(IllegalArgumentException.class, () -> cat.enter(List.of(type("Cat"), type("Pet"))));
        assertThrows(IllegalArgumentException.class, () -> Scope.of(typeContext, type("PetFilter")));
    }

    @Test
    @DisplayName("toString names the scope's types")
    void testToString() {
        assertEquals("Scope[abstract Pet]", Scope.of(typeContext, type("Pet")).toString());
        assertEquals("Scope[Cat]", Scope.of(typeContext, type("Cat")).toString());
    }
}

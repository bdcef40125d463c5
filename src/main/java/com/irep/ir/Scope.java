package com.irep.ir;

import com.irep.schema.TypeContext;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of concrete types that a point in the traversal applies to.
 * <p>
 * A scope is either CONCRETE (an explicit set of object types) or ABSTRACT (a single
 * union or interface, left unexpanded until two abstract views have to be reconciled).
 * Scopes are immutable; {@link #enter} returns the narrowed scope and never widens.
 */
public final class Scope {

    public enum Mode {
        CONCRETE,
        ABSTRACT
    }

    private final TypeContext typeContext;
    private final Mode mode;
    private final Set<GraphQLNamedType> concreteTypes; // CONCRETE only
    private final GraphQLNamedType abstractType;       // ABSTRACT only

    private Scope(TypeContext typeContext, Mode mode, Set<GraphQLNamedType> concreteTypes, GraphQLNamedType abstractType) {
        this.typeContext = Objects.requireNonNull(typeContext, "typeContext is null");
        this.mode = mode;
        this.concreteTypes = concreteTypes;
        this.abstractType = abstractType;
    }

    /**
     * Creates a scope over a single type: abstract types stay unexpanded,
     * object, scalar and enum types become a one-element concrete set.
     * @throws IllegalArgumentException for wrapper types, input types or null.
     */
    public static Scope of(TypeContext typeContext, GraphQLType type) {
        if (typeContext.isAbstract(type)) {
            return new Scope(typeContext, Mode.ABSTRACT, null, (GraphQLNamedType) type);
        }
        return new Scope(typeContext, Mode.CONCRETE, concreteSetOf(typeContext, type), null);
    }

    /**
     * Creates a concrete scope over an explicit set (or sequence) of types.
     */
    public static Scope of(TypeContext typeContext, Collection<? extends GraphQLNamedType> types) {
        return new Scope(typeContext, Mode.CONCRETE, concreteSetOf(types), null);
    }

    /**
     * A scope that applies to no type at all. Used below selections that produce no IR.
     */
    public static Scope empty(TypeContext typeContext) {
        return new Scope(typeContext, Mode.CONCRETE, Collections.emptySet(), null);
    }

    /**
     * Narrows this scope by a type condition.
     * @param type The type condition (object, union or interface).
     * @return This instance when the condition is the current value, otherwise a new scope
     *         whose effective types are a subset of this scope's.
     */
    public Scope enter(GraphQLType type) {
        if (mode == Mode.ABSTRACT) {
            if (type == abstractType) {
                return this;
            }
            Set<GraphQLNamedType> currentTypes = typeContext.possibleConcreteTypes(abstractType);
            Set<GraphQLNamedType> requestedTypes = concreteSetOf(typeContext, type);
            if (currentTypes.containsAll(requestedTypes)) {
                // Still within the enclosing abstract type, keep the requested type unexpanded
                return Scope.of(typeContext, type);
            }
            return new Scope(typeContext, Mode.CONCRETE, intersect(currentTypes, requestedTypes), null);
        }
        return enterConcrete(concreteSetOf(typeContext, type));
    }

    /**
     * Narrows this scope by an explicit set of concrete types.
     */
    public Scope enter(Collection<? extends GraphQLNamedType> types) {
        Set<GraphQLNamedType> requestedTypes = concreteSetOf(types);
        if (mode == Mode.ABSTRACT) {
            Set<GraphQLNamedType> currentTypes = typeContext.possibleConcreteTypes(abstractType);
            return new Scope(typeContext, Mode.CONCRETE, intersect(currentTypes, requestedTypes), null);
        }
        return enterConcrete(requestedTypes);
    }

    private Scope enterConcrete(Set<GraphQLNamedType> requestedTypes) {
        if (requestedTypes.equals(concreteTypes)) {
            return this;
        }
        return new Scope(typeContext, Mode.CONCRETE, intersect(concreteTypes, requestedTypes), null);
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * @return The unexpanded union or interface, or null in CONCRETE mode.
     */
    public GraphQLNamedType getAbstractType() {
        return abstractType;
    }

    /**
     * @return The effective concrete types, expanding the abstract type if needed.
     */
    public Set<GraphQLNamedType> getTypes() {
        if (mode == Mode.ABSTRACT) {
            return typeContext.possibleConcreteTypes(abstractType);
        }
        return concreteTypes;
    }

    public boolean isEmpty() {
        return getTypes().isEmpty();
    }

    @Override
    public String toString() {
        if (mode == Mode.ABSTRACT) {
            return "Scope[abstract " + abstractType.getName() + "]";
        }
        StringBuilder sb = new StringBuilder("Scope[");
        boolean first = true;
        for (GraphQLNamedType type : concreteTypes) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(type.getName());
            first = false;
        }
        return sb.append("]").toString();
    }

    // --- Helpers ---

    private static Set<GraphQLNamedType> concreteSetOf(TypeContext typeContext, GraphQLType type) {
        if (typeContext.isAbstract(type)) {
            return typeContext.possibleConcreteTypes(type);
        }
        if (type instanceof GraphQLObjectType || type instanceof GraphQLScalarType || type instanceof GraphQLEnumType) {
            return Collections.singleton((GraphQLNamedType) type);
        }
        throw new IllegalArgumentException("Unexpected types to enter: " + type);
    }

    private static Set<GraphQLNamedType> concreteSetOf(Collection<? extends GraphQLNamedType> types) {
        if (types == null) {
            throw new IllegalArgumentException("Unexpected types to enter: null");
        }
        Set<GraphQLNamedType> result = new LinkedHashSet<>();
        for (Object type : types) {
            if (!(type instanceof GraphQLObjectType || type instanceof GraphQLScalarType || type instanceof GraphQLEnumType)) {
                throw new IllegalArgumentException("Unexpected types to enter: " + type);
            }
            result.add((GraphQLNamedType) type);
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<GraphQLNamedType> intersect(Set<GraphQLNamedType> left, Set<GraphQLNamedType> right) {
        Set<GraphQLNamedType> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return Collections.unmodifiableSet(result);
    }
}

package com.irep.schema;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLUnionType;

import java.util.Set;

/**
 * Type lookups the internal representation needs from the schema.
 * Implementations must return the same type instances for the same names,
 * since types are used as map keys throughout the IR.
 */
public interface TypeContext {

    /**
     * Looks up a field on a composite type, including the introspection meta fields.
     * @param type The type the field is selected on (may be null).
     * @param fieldName The field name as written in the document.
     * @return The field definition, or null if the type has no such field.
     */
    GraphQLFieldDefinition fieldDefinitionFor(GraphQLType type, String fieldName);

    /**
     * Returns the concrete types a type stands for: the possible types of a union or
     * interface, the type itself for objects, scalars and enums, nothing for input types.
     */
    Set<GraphQLNamedType> possibleConcreteTypes(GraphQLType type);

    /**
     * Strips list and non-null wrappers.
     */
    GraphQLNamedType unwrap(GraphQLType type);

    /**
     * @return The root type for the operation kind, or null if the schema does not define one.
     */
    GraphQLObjectType rootTypeFor(OperationDefinition.Operation operation);

    /**
     * @return The named type, or null if the schema has none by that name.
     */
    GraphQLNamedType getType(String typeName);

    default boolean isAbstract(GraphQLType type) {
        return type instanceof GraphQLUnionType || type instanceof GraphQLInterfaceType;
    }
}

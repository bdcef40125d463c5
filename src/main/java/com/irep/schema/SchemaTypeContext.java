package com.irep.schema;

import graphql.introspection.Introspection;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TypeContext} backed by a graphql-java {@link GraphQLSchema}.
 * Possible-type sets of abstract types are computed once and cached.
 */
public class SchemaTypeContext implements TypeContext {

    private final GraphQLSchema schema;
    private final Map<String, Set<GraphQLNamedType>> possibleTypesCache = new HashMap<>();

    public SchemaTypeContext(GraphQLSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema is null");
    }

    public GraphQLSchema getSchema() {
        return schema;
    }

    @Override
    public GraphQLFieldDefinition fieldDefinitionFor(GraphQLType type, String fieldName) {
        if (type == null || fieldName == null) {
            return null;
        }
        // __typename is valid on every composite type, unions included
        if (Introspection.TypeNameMetaFieldDef.getName().equals(fieldName)
                && (type instanceof GraphQLFieldsContainer || type instanceof GraphQLUnionType)) {
            return Introspection.TypeNameMetaFieldDef;
        }
        if (type == schema.getQueryType()) {
            if (Introspection.SchemaMetaFieldDef.getName().equals(fieldName)) {
                return Introspection.SchemaMetaFieldDef;
            }
            if (Introspection.TypeMetaFieldDef.getName().equals(fieldName)) {
                return Introspection.TypeMetaFieldDef;
            }
        }
        if (type instanceof GraphQLFieldsContainer) {
            return ((GraphQLFieldsContainer) type).getFieldDefinition(fieldName);
        }
        return null;
    }

    @Override
    public Set<GraphQLNamedType> possibleConcreteTypes(GraphQLType type) {
        if (type instanceof GraphQLObjectType || type instanceof GraphQLScalarType || type instanceof GraphQLEnumType) {
            return Collections.singleton((GraphQLNamedType) type);
        }
        if (type instanceof GraphQLInterfaceType) {
            GraphQLInterfaceType interfaceType = (GraphQLInterfaceType) type;
            return possibleTypesCache.computeIfAbsent(interfaceType.getName(),
                    name -> Collections.unmodifiableSet(new LinkedHashSet<GraphQLNamedType>(schema.getImplementations(interfaceType))));
        }
        if (type instanceof GraphQLUnionType) {
            GraphQLUnionType unionType = (GraphQLUnionType) type;
            return possibleTypesCache.computeIfAbsent(unionType.getName(), name -> {
                Set<GraphQLNamedType> members = new LinkedHashSet<>();
                for (GraphQLNamedOutputType member : unionType.getTypes()) {
                    if (member instanceof GraphQLObjectType) {
                        members.add(member);
                    }
                }
                return Collections.unmodifiableSet(members);
            });
        }
        // Input objects and wrappers have no concrete output types
        return Collections.emptySet();
    }

    @Override
    public GraphQLNamedType unwrap(GraphQLType type) {
        if (type == null) {
            return null;
        }
        return GraphQLTypeUtil.unwrapAll(type);
    }

    @Override
    public GraphQLObjectType rootTypeFor(OperationDefinition.Operation operation) {
        if (operation == null) {
            return schema.getQueryType();
        }
        switch (operation) {
            case MUTATION:
                return schema.getMutationType();
            case SUBSCRIPTION:
                return schema.getSubscriptionType();
            case QUERY:
            default:
                return schema.getQueryType();
        }
    }

    @Override
    public GraphQLNamedType getType(String typeName) {
        if (typeName == null) {
            return null;
        }
        GraphQLType type = schema.getType(typeName);
        return type instanceof GraphQLNamedType ? (GraphQLNamedType) type : null;
    }
}

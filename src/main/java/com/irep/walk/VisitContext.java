package com.irep.walk;

import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;

import java.util.ArrayList;
import java.util.List;

/**
 * Type information at the walker's current position. Any of the values may be null
 * when the document refers to types or fields the schema does not have.
 */
public class VisitContext {

    // ArrayList based stacks, unlike ArrayDeque they accept null entries
    private final List<GraphQLNamedType> typeStack = new ArrayList<>();
    private final List<GraphQLNamedType> parentTypeStack = new ArrayList<>();
    private final List<GraphQLFieldDefinition> fieldDefinitionStack = new ArrayList<>();

    /**
     * @return The type in effect: the root type or type condition of a definition, the type
     *         condition of an inline fragment (or the enclosing type without one), the unwrapped
     *         return type of a field.
     */
    public GraphQLNamedType getTypeDefinition() {
        return peek(typeStack);
    }

    /**
     * @return The type of the selection set the current selection belongs to.
     */
    public GraphQLNamedType getParentTypeDefinition() {
        return peek(parentTypeStack);
    }

    /**
     * @return The definition of the innermost field being visited.
     */
    public GraphQLFieldDefinition getFieldDefinition() {
        return peek(fieldDefinitionStack);
    }

    void pushType(GraphQLNamedType type) {
        typeStack.add(type);
    }

    void popType() {
        typeStack.remove(typeStack.size() - 1);
    }

    void pushParentType(GraphQLNamedType type) {
        parentTypeStack.add(type);
    }

    void popParentType() {
        parentTypeStack.remove(parentTypeStack.size() - 1);
    }

    void pushFieldDefinition(GraphQLFieldDefinition fieldDefinition) {
        fieldDefinitionStack.add(fieldDefinition);
    }

    void popFieldDefinition() {
        fieldDefinitionStack.remove(fieldDefinitionStack.size() - 1);
    }

    private static <T> T peek(List<T> stack) {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }
}

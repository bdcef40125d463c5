package com.irep.walk;

import com.irep.schema.TypeContext;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Walks the executable definitions of a document depth-first and notifies visitors,
 * tracking the schema types in effect along the way.
 * <p>
 * Visitors are entered in registration order and left in reverse order.
 * Fragment spreads are reported but not followed; fragment definitions are walked
 * on their own, as top level definitions.
 */
public class DocumentWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWalker.class);

    private final TypeContext typeContext;
    private final List<DocumentVisitor> visitors;
    private final List<DocumentVisitor> reversedVisitors;

    public DocumentWalker(TypeContext typeContext, List<DocumentVisitor> visitors) {
        this.typeContext = Objects.requireNonNull(typeContext, "typeContext is null");
        this.visitors = List.copyOf(Objects.requireNonNull(visitors, "visitors is null"));
        List<DocumentVisitor> reversed = new ArrayList<>(this.visitors);
        Collections.reverse(reversed);
        this.reversedVisitors = reversed;
    }

    /**
     * Walks every operation and fragment definition of the document, in document order.
     */
    public void walk(Document document) {
        Objects.requireNonNull(document, "document is null");
        VisitContext context = new VisitContext();
        for (Definition<?> definition : document.getDefinitions()) {
            if (definition instanceof OperationDefinition) {
                walkOperation((OperationDefinition) definition, context);
            } else if (definition instanceof FragmentDefinition) {
                walkFragmentDefinition((FragmentDefinition) definition, context);
            } else {
                LOGGER.debug("Skipping non-executable definition {}", definition.getClass().getSimpleName());
            }
        }
    }

    private void walkOperation(OperationDefinition node, VisitContext context) {
        context.pushType(typeContext.rootTypeFor(node.getOperation()));
        for (DocumentVisitor visitor : visitors) {
            visitor.enterOperationDefinition(node, context);
        }
        walkSelectionSet(node.getSelectionSet(), context);
        for (DocumentVisitor visitor : reversedVisitors) {
            visitor.leaveOperationDefinition(node, context);
        }
        context.popType();
    }

    private void walkFragmentDefinition(FragmentDefinition node, VisitContext context) {
        context.pushType(resolveTypeCondition(node.getTypeCondition()));
        for (DocumentVisitor visitor : visitors) {
            visitor.enterFragmentDefinition(node, context);
        }
        walkSelectionSet(node.getSelectionSet(), context);
        for (DocumentVisitor visitor : reversedVisitors) {
            visitor.leaveFragmentDefinition(node, context);
        }
        context.popType();
    }

    private void walkSelectionSet(SelectionSet selectionSet, VisitContext context) {
        if (selectionSet == null) {
            return;
        }
        context.pushParentType(context.getTypeDefinition());
        for (Selection<?> selection : selectionSet.getSelections()) {
            if (selection instanceof Field) {
                walkField((Field) selection, context);
            } else if (selection instanceof InlineFragment) {
                walkInlineFragment((InlineFragment) selection, context);
            } else if (selection instanceof FragmentSpread) {
                for (DocumentVisitor visitor : visitors) {
                    visitor.enterFragmentSpread((FragmentSpread) selection, context);
                }
            }
        }
        context.popParentType();
    }

    private void walkField(Field node, VisitContext context) {
        GraphQLFieldDefinition fieldDefinition = typeContext.fieldDefinitionFor(context.getParentTypeDefinition(), node.getName());
        context.pushFieldDefinition(fieldDefinition);
        context.pushType(fieldDefinition == null ? null : typeContext.unwrap(fieldDefinition.getType()));
        for (DocumentVisitor visitor : visitors) {
            visitor.enterField(node, context);
        }
        walkSelectionSet(node.getSelectionSet(), context);
        for (DocumentVisitor visitor : reversedVisitors) {
            visitor.leaveField(node, context);
        }
        context.popType();
        context.popFieldDefinition();
    }

    private void walkInlineFragment(InlineFragment node, VisitContext context) {
        GraphQLNamedType type = node.getTypeCondition() == null
                ? context.getParentTypeDefinition()
                : resolveTypeCondition(node.getTypeCondition());
        context.pushType(type);
        for (DocumentVisitor visitor : visitors) {
            visitor.enterInlineFragment(node, context);
        }
        walkSelectionSet(node.getSelectionSet(), context);
        for (DocumentVisitor visitor : reversedVisitors) {
            visitor.leaveInlineFragment(node, context);
        }
        context.popType();
    }

    private GraphQLNamedType resolveTypeCondition(TypeName typeCondition) {
        if (typeCondition == null) {
            return null;
        }
        GraphQLNamedType type = typeContext.getType(typeCondition.getName());
        if (!(type instanceof GraphQLCompositeType)) {
            LOGGER.debug("Type condition {} does not name a composite type", typeCondition.getName());
            return null;
        }
        return type;
    }
}

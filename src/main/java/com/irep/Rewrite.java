package com.irep;

import com.irep.ir.InternalRepresentation;
import com.irep.ir.IrNode;
import com.irep.ir.Scope;
import com.irep.schema.TypeContext;
import com.irep.walk.DirectiveChecks;
import com.irep.walk.DocumentVisitor;
import com.irep.walk.VisitContext;
import graphql.language.DirectivesContainer;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Node;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the internal representation of a document while {@link com.irep.walk.DocumentWalker}
 * visits it.
 * <p>
 * Every operation and fragment definition gets a root {@link IrNode}. Fields become child
 * nodes keyed by the type they were selected on and their response key, so repeated
 * selections of the same key collapse into one node. Inline fragments only narrow the
 * current {@link Scope}. Fragment spreads are recorded and merged later by
 * {@link #mergeFragment}, once the spread fragment's own tree is complete.
 * <p>
 * One instance builds one document and is not thread safe.
 */
public class Rewrite implements DocumentVisitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Rewrite.class);

    private final TypeContext typeContext;
    private final Map<String, Object> variables;

    private final Map<String, IrNode> operations = new LinkedHashMap<>();
    private final Map<String, IrNode> fragmentDefinitions = new LinkedHashMap<>();

    // The active parent nodes and the scope at the current point of the walk
    private final Deque<List<IrNode>> nodesStack = new ArrayDeque<>();
    private final Deque<Scope> scopeStack = new ArrayDeque<>();
    // Spread AST node -> nodes the spread fragment gets merged into
    private final Map<FragmentSpread, Set<IrNode>> spreadParents = new IdentityHashMap<>();
    // AST nodes whose subtree is excluded by @skip / @include; non-empty means "inside a skipped subtree"
    private final Set<Node<?>> skipNodes = Collections.newSetFromMap(new IdentityHashMap<>());

    public Rewrite(TypeContext typeContext, Map<String, Object> variables) {
        this.typeContext = Objects.requireNonNull(typeContext, "typeContext is null");
        this.variables = variables == null ? Collections.emptyMap() : variables;
    }

    // --- Definitions ---

    @Override
    public void enterOperationDefinition(OperationDefinition node, VisitContext context) {
        String name = node.getName() == null ? "" : node.getName();
        enterDefinition(operations, name, node, context.getTypeDefinition());
    }

    @Override
    public void leaveOperationDefinition(OperationDefinition node, VisitContext context) {
        leaveDefinition();
    }

    @Override
    public void enterFragmentDefinition(FragmentDefinition node, VisitContext context) {
        enterDefinition(fragmentDefinitions, node.getName(), node, context.getTypeDefinition());
    }

    @Override
    public void leaveFragmentDefinition(FragmentDefinition node, VisitContext context) {
        leaveDefinition();
    }

    private void enterDefinition(Map<String, IrNode> roots, String name, Node<?> astNode, GraphQLNamedType ownerType) {
        // Definitions start from scratch, whatever scope was active before
        IrNode root = new IrNode(typeContext, name, ownerType, ownerType);
        root.addAstNode(astNode);
        roots.put(name, root);
        nodesStack.push(List.of(root));
        scopeStack.push(ownerType == null ? Scope.empty(typeContext) : Scope.of(typeContext, ownerType));
    }

    private void leaveDefinition() {
        nodesStack.pop();
        scopeStack.pop();
    }

    // --- Selections ---

    @Override
    public void enterInlineFragment(InlineFragment node, VisitContext context) {
        checkSkip(node);
        if (skipNodes.isEmpty()) {
            GraphQLNamedType typeCondition = context.getTypeDefinition();
            Scope scope = scopeStack.peek();
            scopeStack.push(typeCondition == null ? Scope.empty(typeContext) : scope.enter(typeCondition));
        }
    }

    @Override
    public void leaveInlineFragment(InlineFragment node, VisitContext context) {
        if (skipNodes.isEmpty()) {
            scopeStack.pop();
        }
        skipNodes.remove(node);
    }

    @Override
    public void enterField(Field node, VisitContext context) {
        checkSkip(node);
        if (!skipNodes.isEmpty()) {
            return;
        }
        String key = node.getAlias() == null ? node.getName() : node.getAlias();
        // Resolve against the type being visited, not a possibly abstract declaring type
        GraphQLNamedType ownerType = context.getParentTypeDefinition();
        GraphQLFieldDefinition fieldDefinition = typeContext.fieldDefinitionFor(ownerType, node.getName());
        if (fieldDefinition == null) {
            LOGGER.debug("No field {} on {}, no IR for this selection", node.getName(), ownerType == null ? null : ownerType.getName());
            nodesStack.push(Collections.emptyList());
            scopeStack.push(Scope.empty(typeContext));
            return;
        }

        GraphQLNamedType returnType = typeContext.unwrap(fieldDefinition.getType());
        List<IrNode> nextNodes = new ArrayList<>();
        for (IrNode parent : nodesStack.peek()) {
            IrNode child = parent.getOrCreateChild(ownerType, key, returnType);
            child.addAstNode(node);
            child.addDefinition(fieldDefinition);
            nextNodes.add(child);
        }
        if (nextNodes.size() > 1) {
            LOGGER.debug("Field {} reached through {} parent nodes", key, nextNodes.size());
        }
        nodesStack.push(nextNodes);
        scopeStack.push(Scope.of(typeContext, returnType));
    }

    @Override
    public void leaveField(Field node, VisitContext context) {
        if (skipNodes.isEmpty()) {
            nodesStack.pop();
            scopeStack.pop();
        }
        skipNodes.remove(node);
    }

    @Override
    public void enterFragmentSpread(FragmentSpread node, VisitContext context) {
        if (skipNodes.isEmpty() && !DirectiveChecks.shouldSkip(node.getDirectives(), variables)) {
            spreadParents.computeIfAbsent(node, spread -> new LinkedHashSet<>()).addAll(nodesStack.peek());
        }
    }

    private void checkSkip(DirectivesContainer<?> node) {
        if (DirectiveChecks.shouldSkip(node.getDirectives(), variables)) {
            skipNodes.add(node);
        }
    }

    // --- Fragment resolution ---

    /**
     * Merges a finished fragment into every node that spread it.
     * Undefined fragments and spreads that were skipped are ignored.
     * @param fragmentName The fragment to merge.
     * @param spreads The spreads of that fragment.
     */
    public void mergeFragment(String fragmentName, Collection<FragmentSpread> spreads) {
        IrNode fragmentNode = fragmentDefinitions.get(fragmentName);
        if (fragmentNode == null) {
            LOGGER.debug("Fragment {} is not defined, nothing to merge", fragmentName);
            return;
        }
        for (FragmentSpread spread : spreads) {
            Set<IrNode> parents = spreadParents.get(spread);
            if (parents == null) {
                continue;
            }
            for (IrNode parent : parents) {
                parent.mergeSelections(fragmentNode);
            }
        }
    }

    // --- Results ---

    /**
     * @return The current top of the scope stack, or null outside any definition.
     */
    public Scope currentScope() {
        return scopeStack.peek();
    }

    public Map<String, IrNode> getOperations() {
        return Collections.unmodifiableMap(operations);
    }

    public Map<String, IrNode> getFragmentDefinitions() {
        return Collections.unmodifiableMap(fragmentDefinitions);
    }

    public InternalRepresentation getResult(Set<String> unresolvedFragments) {
        return new InternalRepresentation(operations, fragmentDefinitions, unresolvedFragments);
    }
}

package com.irep;

import com.irep.ir.InternalRepresentation;
import com.irep.schema.SchemaTypeContext;
import com.irep.schema.TypeContext;
import com.irep.util.GraphQLStringUtils;
import com.irep.walk.DocumentWalker;
import com.irep.walk.FragmentDependencies;
import graphql.language.Document;
import graphql.schema.GraphQLSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link InternalRepresentation} of GraphQL documents against one schema.
 * <p>
 * The document is walked once with a {@link Rewrite} and a {@link FragmentDependencies}
 * visitor; fragments are then merged into their spreads bottom-up. The document is
 * expected to have passed validation: invalid selections are left out, not reported.
 */
public class InternalRepresentationBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(InternalRepresentationBuilder.class);

    private final TypeContext typeContext;

    public InternalRepresentationBuilder(GraphQLSchema schema) {
        this(new SchemaTypeContext(schema));
    }

    public InternalRepresentationBuilder(TypeContext typeContext) {
        this.typeContext = Objects.requireNonNull(typeContext, "typeContext is null");
    }

    /**
     * Parses and builds a query string.
     * @throws RuntimeException if the query text does not parse.
     */
    public InternalRepresentation build(String query, Map<String, Object> variables) {
        return build(GraphQLStringUtils.parseDocument(query), variables);
    }

    /**
     * Builds the internal representation of every operation and fragment in the document.
     * @param document The parsed, validated document.
     * @param variables Runtime variables used by {@code @skip} and {@code @include} (may be null).
     */
    public InternalRepresentation build(Document document, Map<String, Object> variables) {
        Objects.requireNonNull(document, "document is null");
        Rewrite rewrite = new Rewrite(typeContext, variables);
        FragmentDependencies dependencies = new FragmentDependencies();

        new DocumentWalker(typeContext, List.of(rewrite, dependencies)).walk(document);
        dependencies.resolve((name, definition, spreads) -> rewrite.mergeFragment(name, spreads));

        InternalRepresentation result = rewrite.getResult(dependencies.getUnresolvedFragments());
        LOGGER.debug("Built internal representation: operations={}, fragments={}",
                result.getOperations().keySet(), result.getFragmentDefinitions().keySet());
        return result;
    }

    public TypeContext getTypeContext() {
        return typeContext;
    }
}

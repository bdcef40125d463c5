package com.irep.walk;

import graphql.language.Argument;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.Value;
import graphql.language.VariableReference;

import java.util.List;
import java.util.Map;

/**
 * Evaluates the {@code @skip} and {@code @include} directives of a selection.
 */
public final class DirectiveChecks {

    public static final String SKIP = "skip";
    public static final String INCLUDE = "include";

    private DirectiveChecks() {}

    /**
     * @param directives Directives on a field, inline fragment or fragment spread.
     * @param variables Runtime variables; a referenced variable that is missing reads as false.
     * @return True if the selection carries {@code @skip(if: true)} or {@code @include(if: false)}.
     */
    public static boolean shouldSkip(List<Directive> directives, Map<String, Object> variables) {
        if (directives == null || directives.isEmpty()) {
            return false;
        }
        for (Directive directive : directives) {
            if (SKIP.equals(directive.getName()) && ifArgument(directive, variables, false)) {
                return true;
            }
            if (INCLUDE.equals(directive.getName()) && !ifArgument(directive, variables, true)) {
                return true;
            }
        }
        return false;
    }

    private static boolean ifArgument(Directive directive, Map<String, Object> variables, boolean whenAbsent) {
        Argument argument = directive.getArgument("if");
        if (argument == null) {
            return whenAbsent;
        }
        Value<?> value = argument.getValue();
        if (value instanceof BooleanValue) {
            return ((BooleanValue) value).isValue();
        }
        if (value instanceof VariableReference) {
            Object variable = variables == null ? null : variables.get(((VariableReference) value).getName());
            return Boolean.TRUE.equals(variable);
        }
        return whenAbsent;
    }
}

package com.slidebind.template.parser;

/**
 * Host hook consulted before the built-in resolution steps.
 * Returning null declines and lets the evaluator continue.
 */
@FunctionalInterface
public interface VariableResolver {
    Value resolve(String expression, Environment env);
}

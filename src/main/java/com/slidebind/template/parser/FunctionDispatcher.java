package com.slidebind.template.parser;

import com.slidebind.template.parser.ExpressionToken.FunctionCall;

/**
 * Executes a {@code ppt.Name(...)} call once the environment has resolved the
 * function value it names.
 */
@FunctionalInterface
public interface FunctionDispatcher {
    EvaluationResult dispatch(String qualifiedName, FunctionCall call, Environment env);
}

package com.slidebind.template.plugins;

import java.util.List;

import com.slidebind.template.ProcessingContext;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.Value;

/** A callable registered under the {@code ppt} namespace. */
@FunctionalInterface
public interface TemplateFunction {
    /**
     * @param ctx   the shape being processed
     * @param bound value of the first positional argument, or nil
     * @param args  parsed arguments in call order
     */
    FunctionResult execute(ProcessingContext ctx, Value bound, List<FunctionArgument> args);
}

package com.slidebind.template.plugins;

import java.util.List;

import com.slidebind.debug.Debug;
import com.slidebind.template.ProcessingContext;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.Value;

/** {@code ppt.Chart(...)}: chart binding is not implemented and renders {@code TBD}. */
public final class ChartFunction implements TemplateFunction {

    public static final String NAME = "Chart";
    public static final String NOT_IMPLEMENTED = "TBD";

    public static void register(FunctionRegistry registry) {
        registry.register(NAME, new ChartFunction());
    }

    @Override
    public FunctionResult execute(ProcessingContext ctx, Value bound, List<FunctionArgument> args) {
        Debug.get().d("slidebind.fn", "Chart function is not implemented; args " + args);
        return FunctionResult.text(NOT_IMPLEMENTED);
    }
}

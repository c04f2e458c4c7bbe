package com.slidebind.template.plugins;

/** Registers the functions every binder offers by default. */
public final class BuiltInFunctions {

    private BuiltInFunctions() {}

    public static void register(FunctionRegistry registry) {
        ImageFunction.register(registry);
        ChartFunction.register(registry);
        TableFunction.register(registry);
    }
}

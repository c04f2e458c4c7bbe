package com.slidebind.template.plugins;

import java.util.List;

import com.slidebind.debug.Debug;
import com.slidebind.template.ProcessingContext;
import com.slidebind.template.parser.ArgumentParser;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.Value;

/**
 * {@code ppt.Table(dataSource, headers: bool, startRow: N, endRow: N, style: name)}.
 * Table binding is not implemented: once the data source resolves, the call
 * renders a placeholder describing the requested table.
 */
public final class TableFunction implements TemplateFunction {

    private static final String TAG = "slidebind.fn";
    public static final String NAME = "Table";

    public static void register(FunctionRegistry registry) {
        registry.register(NAME, new TableFunction());
    }

    @Override
    public FunctionResult execute(ProcessingContext ctx, Value bound, List<FunctionArgument> args) {
        FunctionArgument source = ImageFunction.firstPositional(args);
        if (source == null || source.getValue().trim().isEmpty()) {
            Debug.get().w(TAG, "Table function called without required data source parameter");
            return FunctionResult.text("[Error: Data source required]");
        }

        String dataSource = source.getValue().trim();
        EvaluationResult r = ctx.evaluate(dataSource);
        if (r.getKind() != EvaluationResult.Kind.VALUE || r.getValue().isNull()) {
            Debug.get().w(TAG, "Data source '" + dataSource + "' not found");
            return FunctionResult.text("[Error: Data source '" + dataSource + "' not found]");
        }

        boolean headers = ImageFunction.boolArg(args, "headers", true);
        int startRow = ImageFunction.intArg(args, "startRow", 0);
        int endRow = ImageFunction.intArg(args, "endRow", -1);
        FunctionArgument styleArg = ArgumentParser.keyword(args, "style");
        String style = (styleArg == null) ? "Medium" : styleArg.getValue();

        Debug.get().d(TAG, "Table " + dataSource + " headers:" + headers + " startRow:" + startRow
                + " endRow:" + endRow + " style:" + style);
        return FunctionResult.text("[Table: " + dataSource + ", Headers: " + (headers ? "True" : "False")
                + ", StartRow: " + startRow + ", EndRow: " + endRow + ", Style: " + style + "]");
    }
}

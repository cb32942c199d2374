package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.FunctionInfo;

import java.util.List;

/**
 * A registry entry: canonical name, aliases, description, arity and implementation.
 */
public final class FunctionDefinition {
    private final String name;
    private final List<String> aliases;
    private final String description;
    private final Arity arity;
    private final SpreadsheetFunction implementation;

    public FunctionDefinition(String name, List<String> aliases, String description,
                              Arity arity, SpreadsheetFunction implementation) {
        this.name = name;
        this.aliases = List.copyOf(aliases);
        this.description = description;
        this.arity = arity;
        this.implementation = implementation;
    }

    /**
     * Checks the argument count, then runs the function.
     * The name reported in errors is the one the formula used.
     */
    public Object invoke(String calledAs, List<Object> args) {
        arity.check(calledAs, args.size());
        return implementation.apply(args);
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getDescription() {
        return description;
    }

    public FunctionInfo toInfo() {
        Integer maxArgs = arity.isUnbounded() ? null : arity.getMax();
        return new FunctionInfo(name, description, aliases, arity.getMin(), maxArgs);
    }
}

package com.spreadsheet.formula.models;

import java.util.List;

/**
 * Catalog entry for one built-in function, used by UI affordances
 * such as a function picker. Plays no part in evaluation.
 */
public class FunctionInfo {
    private final String name;
    private final String description;
    private final List<String> aliases;
    private final int minArgs;
    // null when the function takes any number of arguments
    private final Integer maxArgs;

    public FunctionInfo(String name, String description, List<String> aliases, int minArgs, Integer maxArgs) {
        this.name = name;
        this.description = description;
        this.aliases = List.copyOf(aliases);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public Integer getMaxArgs() {
        return maxArgs;
    }
}

package com.spreadsheet.formula.functions;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name -> function lookup. Names are stored uppercase, so lookups
 * are case-insensitive.
 */
public class FunctionRegistry {

    private final Map<String, FormulaFunction> functions = new ConcurrentHashMap<>();

    /**
     * A registry preloaded with the math, statistics, logical, text
     * and game data families.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        MathFunctions.registerAll(registry);
        StatisticalFunctions.registerAll(registry);
        LogicalFunctions.registerAll(registry);
        TextFunctions.registerAll(registry);
        GameDataFunctions.registerAll(registry);
        return registry;
    }

    /**
     * Adds or replaces a function.
     */
    public void register(String name, FormulaFunction function) {
        functions.put(name.toUpperCase(), function);
    }

    /**
     * Returns the function, or null when the name isn't registered.
     */
    public FormulaFunction find(String name) {
        return functions.get(name.toUpperCase());
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toUpperCase());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }
}

package com.linlay.calculatoragent.calculator.symbolic;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interns symbols by name. x, y and z are always present; any other name is created on first use.
 * Not thread-safe: create one table per evaluation.
 */
public final class SymbolTable {

    private final Map<String, Atom.Symbol> symbols = new LinkedHashMap<>();

    public SymbolTable() {
        for (String name : new String[]{"x", "y", "z"}) {
            symbols.put(name, new Atom.Symbol(name));
        }
    }

    public Atom.Symbol symbol(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("symbol name must not be blank");
        }
        return symbols.computeIfAbsent(name.trim(), Atom.Symbol::new);
    }

    public boolean isDefined(String name) {
        return symbols.containsKey(name);
    }
}

package com.textforge.formatter.core;

public enum IndentUnit {
    SPACES,
    TABS;

    public String unit(int indentSize) {
        return this == TABS ? "\t" : " ".repeat(indentSize);
    }
}

package com.textforge.formatter.core;

public enum FormatMode {
    BEAUTIFY,
    MINIFY
}

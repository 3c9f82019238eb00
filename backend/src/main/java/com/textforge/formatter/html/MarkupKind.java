package com.textforge.formatter.html;

public enum MarkupKind {
    DOCTYPE,
    COMMENT,
    OPEN_TAG,
    CLOSE_TAG,
    SELF_CLOSING_TAG,
    TEXT,
    /** Unparsed body of a script or style element. */
    RAW_TEXT
}

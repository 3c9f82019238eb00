package com.textforge.formatter.html;

import com.textforge.formatter.core.Diagnostic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tag balance checks over a markup token stream. Unclosed elements are reported last,
 * at their opening tag.
 */
public class HtmlValidator {

    public List<Diagnostic> validate(List<MarkupToken> tokens) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<MarkupToken> open = new ArrayList<>();

        for (MarkupToken token : tokens) {
            switch (token.kind()) {
                case OPEN_TAG -> open.add(token);
                case CLOSE_TAG -> {
                    if (open.isEmpty()) {
                        diagnostics.add(Diagnostic.error("unexpected-closing-tag",
                                "Unexpected closing tag </" + token.name() + ">", token.line(), token.column()));
                    } else {
                        MarkupToken last = open.remove(open.size() - 1);
                        if (!last.name().equals(token.name())) {
                            diagnostics.add(Diagnostic.error("mismatched-tag",
                                    "Mismatched tag: expected </" + last.name() + "> but found </" + token.name() + ">",
                                    token.line(), token.column(),
                                    "Close <" + last.name() + "> opened at line " + last.line() + " first"));
                        }
                    }
                }
                case COMMENT -> {
                    if (!token.text().endsWith("-->") || token.text().length() < 7) {
                        diagnostics.add(Diagnostic.warning("unclosed-comment",
                                "Comment is not closed before end of input", token.line(), token.column(),
                                "Add '-->' to close the comment"));
                    }
                }
                case SELF_CLOSING_TAG, DOCTYPE, TEXT, RAW_TEXT -> {
                }
            }

            if (token.isElementStart()) {
                checkAttributes(token, diagnostics);
            }
        }

        for (MarkupToken tag : open) {
            diagnostics.add(Diagnostic.error("unclosed-tag",
                    "Unclosed tag <" + tag.name() + ">", tag.line(), tag.column(),
                    "Add </" + tag.name() + ">"));
        }
        return diagnostics;
    }

    private void checkAttributes(MarkupToken token, List<Diagnostic> diagnostics) {
        Set<String> seen = new HashSet<>();
        for (MarkupToken.Attribute attribute : token.attributes()) {
            if (!seen.add(attribute.name())) {
                diagnostics.add(Diagnostic.warning("duplicate-attribute",
                        "Attribute '" + attribute.name() + "' is repeated on <" + token.name() + ">",
                        token.line(), token.column(),
                        "Remove the duplicate; browsers keep only the first occurrence"));
            }
        }
    }
}

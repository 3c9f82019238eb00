package com.textforge.formatter.core;

/**
 * Style policy for one SQL formatting call. Instances are immutable; use {@link #builder()}.
 */
public final class FormatterConfig {

    private final FormatMode mode;
    private final int indentSize;
    private final IndentUnit indentUnit;
    private final LetterCase keywordCase;
    private final LetterCase functionCase;
    private final LetterCase identifierCase;
    private final int blankLinesBetweenStatements;
    private final boolean validate;
    private final boolean breakAfterJoin;
    private final boolean breakBeforeComma;

    private FormatterConfig(Builder builder) {
        if (builder.indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0");
        }
        if (builder.blankLinesBetweenStatements < 0) {
            throw new IllegalArgumentException("blankLinesBetweenStatements must be >= 0");
        }
        this.mode = builder.mode;
        this.indentSize = builder.indentSize;
        this.indentUnit = builder.indentUnit;
        this.keywordCase = builder.keywordCase;
        this.functionCase = builder.functionCase;
        this.identifierCase = builder.identifierCase;
        this.blankLinesBetweenStatements = builder.blankLinesBetweenStatements;
        this.validate = builder.validate;
        this.breakAfterJoin = builder.breakAfterJoin;
        this.breakBeforeComma = builder.breakBeforeComma;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FormatterConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .indentSize(indentSize)
                .indentUnit(indentUnit)
                .keywordCase(keywordCase)
                .functionCase(functionCase)
                .identifierCase(identifierCase)
                .blankLinesBetweenStatements(blankLinesBetweenStatements)
                .validate(validate)
                .breakAfterJoin(breakAfterJoin)
                .breakBeforeComma(breakBeforeComma);
    }

    public String indent() {
        return indentUnit.unit(indentSize);
    }

    public FormatMode mode() {
        return mode;
    }

    public int indentSize() {
        return indentSize;
    }

    public IndentUnit indentUnit() {
        return indentUnit;
    }

    public LetterCase keywordCase() {
        return keywordCase;
    }

    public LetterCase functionCase() {
        return functionCase;
    }

    public LetterCase identifierCase() {
        return identifierCase;
    }

    public int blankLinesBetweenStatements() {
        return blankLinesBetweenStatements;
    }

    public boolean validate() {
        return validate;
    }

    public boolean breakAfterJoin() {
        return breakAfterJoin;
    }

    public boolean breakBeforeComma() {
        return breakBeforeComma;
    }

    @Override
    public String toString() {
        return "FormatterConfig{mode=" + mode
                + ", indent=" + indentSize + " " + indentUnit
                + ", keywordCase=" + keywordCase
                + ", functionCase=" + functionCase
                + ", identifierCase=" + identifierCase
                + ", blankLines=" + blankLinesBetweenStatements
                + ", validate=" + validate
                + ", breakAfterJoin=" + breakAfterJoin
                + ", breakBeforeComma=" + breakBeforeComma + "}";
    }

    public static final class Builder {
        private FormatMode mode = FormatMode.BEAUTIFY;
        private int indentSize = 4;
        private IndentUnit indentUnit = IndentUnit.SPACES;
        private LetterCase keywordCase = LetterCase.UPPER;
        private LetterCase functionCase = LetterCase.UPPER;
        private LetterCase identifierCase = LetterCase.PRESERVE;
        private int blankLinesBetweenStatements = 1;
        private boolean validate = true;
        private boolean breakAfterJoin = true;
        private boolean breakBeforeComma = false;

        private Builder() {
        }

        public Builder mode(FormatMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder indentUnit(IndentUnit indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder keywordCase(LetterCase keywordCase) {
            this.keywordCase = keywordCase;
            return this;
        }

        public Builder functionCase(LetterCase functionCase) {
            this.functionCase = functionCase;
            return this;
        }

        public Builder identifierCase(LetterCase identifierCase) {
            this.identifierCase = identifierCase;
            return this;
        }

        public Builder blankLinesBetweenStatements(int blankLinesBetweenStatements) {
            this.blankLinesBetweenStatements = blankLinesBetweenStatements;
            return this;
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder breakAfterJoin(boolean breakAfterJoin) {
            this.breakAfterJoin = breakAfterJoin;
            return this;
        }

        public Builder breakBeforeComma(boolean breakBeforeComma) {
            this.breakBeforeComma = breakBeforeComma;
            return this;
        }

        public FormatterConfig build() {
            return new FormatterConfig(this);
        }
    }
}

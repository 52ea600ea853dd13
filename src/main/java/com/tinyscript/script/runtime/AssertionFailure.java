package com.tinyscript.script.runtime;

import com.fasterxml.jackson.databind.JsonNode;

/** A falsy {@code assert}. Carries the asserted source text and a JSON snapshot of the value it produced. */
public final class AssertionFailure extends ScriptError {
    private static final long serialVersionUID = 1L;

    private final String sourceText;
    private final transient JsonNode valueSnapshot;

    public AssertionFailure(String sourceText, JsonNode valueSnapshot) {
        super(Kind.ASSERTION_FAILURE, "Assertion failed: " + sourceText);
        this.sourceText = sourceText;
        this.valueSnapshot = valueSnapshot;
    }

    public String sourceText() { return sourceText; }

    public JsonNode valueSnapshot() { return valueSnapshot; }
}

package com.tinyscript.protocol;

import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tinyscript.script.TinyScript;
import com.tinyscript.script.runtime.AssertionFailure;
import com.tinyscript.script.runtime.ScriptError;

/**
 * Structured rendering of a run failure for external reporters.
 *
 * {"kind": "ASSERTION_FAILURE", "message": "...", "exitStatus": 1,
 *  "line": 12, "column": 5, "expression": "n <= 55", "value": false,
 *  "trace": ["Fibonacci.fib (called at line 4)", "Test.main"]}
 *
 * line/column appear only when known; expression/value only for assertions.
 */
public final class FailureJson {

    private static final ObjectMapper om = new ObjectMapper();

    private FailureJson() {}

    public static ObjectNode toJson(ScriptError failure) {
        ObjectNode out = om.createObjectNode();
        out.put("kind", failure.kind().name());
        out.put("message", failure.getMessage());
        out.put("exitStatus", failure.exitStatus());

        if (failure.location().isKnown()) {
            out.put("line", failure.location().line);
            if (failure.location().column > 0) out.put("column", failure.location().column);
        }

        if (failure instanceof AssertionFailure) {
            AssertionFailure af = (AssertionFailure) failure;
            out.put("expression", af.sourceText());
            out.set("value", af.valueSnapshot());
        }

        ArrayNode trace = out.putArray("trace");
        for (String frame : failure.scriptTrace()) trace.add(frame);
        return out;
    }

    public static String toJsonString(ScriptError failure) {
        try {
            return om.writeValueAsString(toJson(failure));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failure", e);
        }
    }

    /** A reporter that writes one compact JSON document per failure, tagged with the entry point. */
    public static TinyScript.FailureReporter reporter(Consumer<String> sink) {
        return (failure, entryPoint) -> {
            ObjectNode doc = toJson(failure);
            doc.put("entry", entryPoint);
            try {
                sink.accept(om.writeValueAsString(doc));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize failure", e);
            }
        };
    }
}

package com.tinyscript.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tinyscript.script.runtime.Instance;
import com.tinyscript.script.runtime.Value;

/**
 * Converts runtime values to and from Jackson trees.
 *
 * Encoding:
 *  - null/bool/number/string/list/dict map to their JSON counterparts
 *  - instance:  {"$instance": "ClassName", "fields": {...}}
 *  - function:  {"$function": "ClassName.method"}
 *  - class:     {"$class": "ClassName"}
 *  - a container reached again while it is being encoded: {"$cycle": true}
 *
 * Decoding accepts plain JSON data only; the "$" forms are not turned back into values.
 */
public final class ValueJson {

    private static final JsonNodeFactory NF = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        return encode(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static JsonNode encode(Value v, Set<Object> open) {
        switch (v.type) {
            case NULL:
                return NF.nullNode();
            case BOOL:
                return NF.booleanNode(v.asBool());
            case NUMBER:
                return v.isInteger() ? NF.numberNode(v.asLong()) : NF.numberNode(v.asDouble());
            case STRING:
                return NF.textNode(v.asString());
            case FUNCTION: {
                ObjectNode o = NF.objectNode();
                o.put("$function", v.asFunction().function().qualifiedName());
                return o;
            }
            case CLASS: {
                ObjectNode o = NF.objectNode();
                o.put("$class", v.asClass().name());
                return o;
            }
            case LIST: {
                if (!open.add(v.value)) return cycle();
                ArrayNode arr = NF.arrayNode();
                for (Value item : v.asList()) arr.add(encode(item, open));
                open.remove(v.value);
                return arr;
            }
            case DICT: {
                if (!open.add(v.value)) return cycle();
                ObjectNode o = encodeEntries(v.asDict(), open);
                open.remove(v.value);
                return o;
            }
            case INSTANCE: {
                Instance inst = v.asInstance();
                if (!open.add(inst)) return cycle();
                ObjectNode o = NF.objectNode();
                o.put("$instance", inst.scriptClass().name());
                o.set("fields", encodeEntries(inst.fields(), open));
                open.remove(inst);
                return o;
            }
            default:
                throw new IllegalStateException("Unhandled value type: " + v.type);
        }
    }

    private static ObjectNode encodeEntries(Map<String, Value> entries, Set<Object> open) {
        ObjectNode o = NF.objectNode();
        for (Map.Entry<String, Value> e : entries.entrySet()) {
            o.set(e.getKey(), encode(e.getValue(), open));
        }
        return o;
    }

    private static ObjectNode cycle() {
        ObjectNode o = NF.objectNode();
        o.put("$cycle", true);
        return o;
    }

    /** Plain JSON data to a value. Integral numbers that fit a long stay integers. */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isIntegralNumber() && node.canConvertToLong()) return Value.number(node.longValue());
        if (node.isNumber()) return Value.number(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());

        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.list(items);
        }

        if (node.isObject()) {
            Map<String, Value> m = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                m.put(e.getKey(), fromJson(e.getValue()));
            }
            return Value.dict(m);
        }

        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }
}

package com.numeval.expr.json;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numeval.expr.parser.EvalException;

/**
 * JSON in/out for hosts that pass variables and read results as JSON.
 *
 * Variables: a JSON object. Numbers bind as-is, booleans as 1.0 / 0.0, and
 * nested objects flatten with '.':
 *
 *   {"price": 2.5, "order": {"qty": 4, "rush": true}}
 *   -> price=2.5, order.qty=4.0, order.rush=1.0
 *
 * Results: {"ok":true,"result":n} / {"ok":false,"kind":"...","error":"..."}.
 */
public final class NumEvalJson {

    private static final ObjectMapper om = new ObjectMapper();

    private NumEvalJson() {}

    public static Map<String, Double> readVariables(String json) {
        JsonNode root;
        try {
            root = om.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new EvalException(EvalException.Kind.PARSE, "Invalid variables JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw EvalException.parse("Variables JSON must be an object");
        }

        Map<String, Double> out = new LinkedHashMap<>();
        flatten("", root, out);
        return out;
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Double> out) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
            JsonNode v = e.getValue();

            if (v.isObject()) {
                flatten(key, v, out);
            } else if (v.isNumber()) {
                out.put(key, v.doubleValue());
            } else if (v.isBoolean()) {
                out.put(key, v.booleanValue() ? 1.0 : 0.0);
            } else {
                throw EvalException.resolution("Variable '" + key + "' must be a number, boolean or object, got " + v.getNodeType());
            }
        }
    }

    public static ObjectNode result(double value) {
        ObjectNode resp = om.createObjectNode();
        resp.put("ok", true);
        resp.put("result", value);
        return resp;
    }

    public static ObjectNode error(EvalException e) {
        ObjectNode resp = om.createObjectNode();
        resp.put("ok", false);
        resp.put("kind", e.kind().name());
        resp.put("error", e.getMessage());
        return resp;
    }

    public static ObjectNode names(Set<String> names) {
        ObjectNode resp = om.createObjectNode();
        resp.put("ok", true);
        ArrayNode arr = resp.putArray("names");
        for (String n : names) arr.add(n);
        return resp;
    }

    public static String write(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON write failed: " + e.getMessage(), e);
        }
    }
}

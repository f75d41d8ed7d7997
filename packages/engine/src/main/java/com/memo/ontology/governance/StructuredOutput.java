package com.memo.ontology.governance;

import com.fasterxml.jackson.databind.JsonNode;
import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.utility.JacksonUtility;
import com.memo.ontology.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;

/** Strict readers for the JSON objects returned by analysis prompts. */
final class StructuredOutput {
  private StructuredOutput() {}

  static JsonNode object(String raw, String what) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(StringUtility.unwrapJson(raw));
    } catch (Exception e) {
      throw new ExternalCapabilityException(what + " output is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ExternalCapabilityException(what + " output must be a JSON object");
    }
    return root;
  }

  static String requiredText(JsonNode root, String field, String what) {
    JsonNode v = root.get(field);
    if (v == null || !v.isTextual()) {
      throw new ExternalCapabilityException("%s output: '%s' must be a string".formatted(what, field));
    }
    return v.asText();
  }

  static Double optionalNumber(JsonNode root, String field, String what) {
    JsonNode v = root.get(field);
    if (v == null || v.isNull()) return null;
    if (!v.isNumber()) {
      throw new ExternalCapabilityException("%s output: '%s' must be a number".formatted(what, field));
    }
    return v.asDouble();
  }

  static List<String> stringList(JsonNode root, String field, String what) {
    JsonNode v = root.get(field);
    List<String> out = new ArrayList<>();
    if (v == null || v.isNull()) return out;
    if (!v.isArray()) {
      throw new ExternalCapabilityException("%s output: '%s' must be an array".formatted(what, field));
    }
    for (JsonNode item : v) {
      if (!item.isTextual()) {
        throw new ExternalCapabilityException(
            "%s output: '%s' must only hold strings".formatted(what, field));
      }
      out.add(item.asText());
    }
    return out;
  }
}

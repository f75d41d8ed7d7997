package com.memo.ontology.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.exception.MemoException;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.utility.JacksonUtility;
import com.memo.ontology.utility.StringUtility;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Strict parser for the extraction payload. Any structural or enum mismatch rejects the whole
 * payload; numeric ranges are left to the store so bad items can be skipped individually.
 */
public final class ExtractionParser {
  static final Set<NodeType> CLAIM_TYPES =
      EnumSet.of(NodeType.CLAIM, NodeType.EVIDENCE, NodeType.DEFINITION, NodeType.SOURCE);
  static final Set<NodeType> ENTITY_TYPES =
      EnumSet.of(NodeType.PERSON, NodeType.SOURCE, NodeType.DEFINITION);

  private ExtractionParser() {}

  /**
   * @param raw model output, optionally wrapped in a ```json fence
   * @throws ExternalCapabilityException when the payload does not match the expected shape
   */
  public static ExtractionProposal parse(String raw) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(StringUtility.unwrapJson(raw));
    } catch (Exception e) {
      throw new ExternalCapabilityException("Extraction output is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw malformed("top level must be a JSON object");
    }

    List<ExtractionProposal.ProposedClaim> claims = new ArrayList<>();
    for (JsonNode c : array(root, "claims")) {
      NodeType type = nodeType(c, "claims", CLAIM_TYPES);
      claims.add(
          new ExtractionProposal.ProposedClaim(
              requiredText(c, "text", "claims"), optionalNumber(c, "qualifier", "claims"), type));
    }

    List<ExtractionProposal.ProposedEntity> entities = new ArrayList<>();
    for (JsonNode e : array(root, "entities")) {
      NodeType type = nodeType(e, "entities", ENTITY_TYPES);
      entities.add(
          new ExtractionProposal.ProposedEntity(requiredText(e, "name", "entities"), type));
    }

    List<ExtractionProposal.ProposedRelationship> relationships = new ArrayList<>();
    for (JsonNode r : array(root, "relationships")) {
      relationships.add(
          new ExtractionProposal.ProposedRelationship(
              requiredIndex(r, "source_index"),
              requiredIndex(r, "target_index"),
              edgeType(r),
              optionalNumber(r, "weight", "relationships")));
    }
    return new ExtractionProposal(claims, relationships, entities);
  }

  private static Iterable<JsonNode> array(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) return List.of();
    if (!node.isArray()) {
      throw malformed("'" + field + "' must be an array");
    }
    for (JsonNode item : node) {
      if (!item.isObject()) throw malformed("'" + field + "' items must be objects");
    }
    return node;
  }

  private static String requiredText(JsonNode item, String field, String list) {
    JsonNode v = item.get(field);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      throw malformed("%s.%s must be a non-empty string".formatted(list, field));
    }
    return v.asText().trim();
  }

  private static Double optionalNumber(JsonNode item, String field, String list) {
    JsonNode v = item.get(field);
    if (v == null || v.isNull()) return null;
    if (!v.isNumber()) {
      throw malformed("%s.%s must be a number".formatted(list, field));
    }
    return v.asDouble();
  }

  private static int requiredIndex(JsonNode item, String field) {
    JsonNode v = item.get(field);
    if (v == null || !v.isIntegralNumber()) {
      throw malformed("relationships.%s must be an integer".formatted(field));
    }
    return v.asInt();
  }

  private static NodeType nodeType(JsonNode item, String list, Set<NodeType> allowed) {
    JsonNode v = item.get("type");
    if (v == null || !v.isTextual()) {
      throw malformed(list + ".type must be a string");
    }
    NodeType type;
    try {
      type = NodeType.fromWire(v.asText());
    } catch (MemoException e) {
      throw malformed("%s.type '%s' is not a node type".formatted(list, v.asText()));
    }
    if (!allowed.contains(type)) {
      throw malformed("%s.type '%s' is not allowed here".formatted(list, v.asText()));
    }
    return type;
  }

  private static EdgeType edgeType(JsonNode item) {
    JsonNode v = item.get("type");
    if (v == null || !v.isTextual()) {
      throw malformed("relationships.type must be a string");
    }
    try {
      return EdgeType.fromWire(v.asText());
    } catch (MemoException e) {
      throw malformed("relationships.type '%s' is not an edge type".formatted(v.asText()));
    }
  }

  private static ExternalCapabilityException malformed(String detail) {
    return new ExternalCapabilityException("Malformed extraction output: " + detail);
  }
}

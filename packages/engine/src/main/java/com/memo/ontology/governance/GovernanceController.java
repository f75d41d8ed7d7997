package com.memo.ontology.governance;

import com.fasterxml.jackson.databind.JsonNode;
import com.memo.ontology.exception.ConflictException;
import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.graph.ProvenanceMethod;
import com.memo.ontology.model.LlmClient;
import com.memo.ontology.model.LlmClientRegistry;
import com.memo.ontology.model.ModelSelection;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.store.ArgumentLink;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.utility.JacksonUtility;
import com.memo.ontology.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Human review of AI output and AI-assisted curation. Status moves delegate to the store, which
 * makes them idempotent and audited; the analysis operations write one audit entry each.
 *
 * <p>Deprecating a piece of evidence does not re-evaluate the claims it supported.
 */
public class GovernanceController {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(GovernanceController.class);

  static final String LINK_PROMPT = "link-suggest";
  static final String ANALYZE_PROMPT = "analyze";
  private static final int NODE_EXCERPT_CHARS = 1000;

  private final OntologyStore store;
  private final LlmClientRegistry models;
  private final PromptRepository prompts;

  public GovernanceController(
      OntologyStore store, LlmClientRegistry models, PromptRepository prompts) {
    this.store = Objects.requireNonNull(store, "store");
    this.models = Objects.requireNonNull(models, "models");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
  }

  public Node approveNode(String ownerId, String nodeId, Actor actor) {
    return store.transitionNodeStatus(ownerId, nodeId, GovernanceStatus.ACTIVE, actor);
  }

  public Node deprecateNode(String ownerId, String nodeId, Actor actor) {
    return store.transitionNodeStatus(ownerId, nodeId, GovernanceStatus.DEPRECATED, actor);
  }

  public Edge approveEdge(String ownerId, String edgeId, Actor actor) {
    return store.transitionEdgeStatus(ownerId, edgeId, GovernanceStatus.ACTIVE, actor);
  }

  public Edge deprecateEdge(String ownerId, String edgeId, Actor actor) {
    return store.transitionEdgeStatus(ownerId, edgeId, GovernanceStatus.DEPRECATED, actor);
  }

  /**
   * Asks the model for relationships among the given nodes and records each as an Experimental
   * AI edge. Suggestions the store rejects, or that point outside the submitted nodes, are skipped.
   *
   * @throws ExternalCapabilityException when the model output is not a suggestions object
   */
  public LinkSuggestionReport suggestLinks(
      String ownerId, List<String> nodeIds, ModelSelection selection) {
    Set<String> ids = new LinkedHashSet<>(nodeIds == null ? List.of() : nodeIds);
    if (ids.size() < 2) {
      throw new ValidationException(
          "Link suggestion needs at least two distinct nodes", Map.of("field", "node_ids"));
    }
    List<Node> nodes = ids.stream().map(id -> store.getNode(ownerId, id)).toList();
    ModelSelection model = models.resolveCompletion(selection);

    StringBuilder listing = new StringBuilder();
    for (Node n : nodes) {
      listing
          .append("- id: ")
          .append(n.id())
          .append("\n  type: ")
          .append(n.type().wireName())
          .append("\n  title: ")
          .append(n.title())
          .append("\n  content: ")
          .append(StringUtility.truncate(n.content(), NODE_EXCERPT_CHARS).replace("\n", " "))
          .append('\n');
    }
    List<LlmClient.Message> messages =
        prompts
            .get(LINK_PROMPT)
            .newSession()
            .enable("nodes", Map.of("nodes", listing.toString()))
            .renderMessages();
    String raw = models.client(model.provider()).complete(model.model(), messages);

    JsonNode root = StructuredOutput.object(raw, "Link suggestion");
    JsonNode suggestions = root.get("suggestions");
    if (suggestions == null || !suggestions.isArray()) {
      throw new ExternalCapabilityException(
          "Link suggestion output: 'suggestions' must be an array");
    }

    Actor actor = Actor.ai(model.model());
    List<String> edgeIds = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    int index = 0;
    for (JsonNode s : suggestions) {
      String label = "suggestion " + index++;
      try {
        EdgeDraft draft = toDraft(s, ids);
        edgeIds.add(store.createEdge(ownerId, draft, actor).id());
      } catch (ValidationException | ConflictException | NotFoundException e) {
        log.warn("Link suggestion skipped, {}: {}", label, e.getMessage());
        skipped.add(label + ": " + e.getMessage());
      }
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("node_ids", List.copyOf(ids));
    metadata.put("proposed", suggestions.size());
    metadata.put("created", edgeIds.size());
    metadata.put("created_edge_ids", edgeIds);
    metadata.put("skipped", skipped);
    ProvenanceLogEntry entry =
        store.recordActivity(
            ownerId,
            ProvenanceAction.LINK_SUGGEST,
            actor,
            "AI link_suggest analysis completed",
            nodes.get(0).id(),
            metadata);
    log.info(
        "Link suggestion for owner {}: {} proposed, {} created",
        ownerId,
        suggestions.size(),
        edgeIds.size());
    return new LinkSuggestionReport(
        suggestions.size(), edgeIds, skipped, model.toString(), entry.id());
  }

  private static EdgeDraft toDraft(JsonNode s, Set<String> allowed) {
    if (!s.isObject()) {
      throw new ValidationException("suggestion is not an object");
    }
    String source = s.path("source_id").asText(null);
    String target = s.path("target_id").asText(null);
    if (source == null || target == null) {
      throw new ValidationException("source_id and target_id are required");
    }
    if (!allowed.contains(source) || !allowed.contains(target)) {
      throw new ValidationException("endpoints must be among the submitted nodes");
    }
    JsonNode weightNode = s.get("weight");
    if (weightNode != null && !weightNode.isNull() && !weightNode.isNumber()) {
      throw new ValidationException("weight must be a number");
    }
    Double weight = weightNode == null || weightNode.isNull() ? null : weightNode.asDouble();
    EdgeType type = EdgeType.fromWire(s.path("type").asText(""));
    String reason = s.path("reason").asText(null);
    return new EdgeDraft(
        source, target, type, weight, reason, null, weight, ProvenanceMethod.LINK_SUGGEST);
  }

  /** Toulmin summary of one node; audited as {@code summarize} on that node, nothing else written. */
  public NodeSummary summarizeNode(String ownerId, String nodeId, ModelSelection selection) {
    Node node = store.getNode(ownerId, nodeId);
    ModelSelection model = models.resolveCompletion(selection);
    String raw = analyze(model, "summarize", "TEXT", node.title() + "\n\n" + node.content());

    JsonNode root = StructuredOutput.object(raw, "Summary");
    NodeSummary result =
        new NodeSummary(
            nodeId,
            StructuredOutput.requiredText(root, "summary", "Summary"),
            root.path("claim").asText(""),
            StructuredOutput.stringList(root, "grounds", "Summary"),
            StructuredOutput.optionalNumber(root, "qualifier", "Summary"),
            model.toString(),
            null);
    ProvenanceLogEntry entry = logAnalysis(ownerId, model, nodeId, "summarize", result);
    return new NodeSummary(
        result.nodeId(),
        result.summary(),
        result.claim(),
        result.grounds(),
        result.qualifier(),
        result.model(),
        entry.id());
  }

  /** Asks the model to judge a claim against its supporting and refuting neighbors. */
  public ArgumentAssessment assessArgument(
      String ownerId, String claimId, ModelSelection selection) {
    Node claim = store.getNode(ownerId, claimId);
    List<ArgumentLink> links = store.argumentation(ownerId, claimId);
    ModelSelection model = models.resolveCompletion(selection);

    StringBuilder text = new StringBuilder("Claim: ").append(claim.content());
    for (ArgumentLink link : links) {
      text.append("\n- ")
          .append(link.supporting() ? "Supported by" : "Refuted by")
          .append(" (")
          .append(link.counterpart().type().wireName())
          .append(", weight ")
          .append(link.edge().weight())
          .append("): ")
          .append(StringUtility.truncate(link.counterpart().content(), NODE_EXCERPT_CHARS));
    }
    if (links.isEmpty()) text.append("\n(No connected evidence)");

    String raw = analyze(model, "argumentation_check", "CLAIM AND EVIDENCE", text.toString());
    JsonNode root = StructuredOutput.object(raw, "Argumentation check");
    String assessment = StructuredOutput.requiredText(root, "assessment", "Argumentation check");
    if (!List.of("strong", "moderate", "weak").contains(assessment)) {
      throw new ExternalCapabilityException(
          "Argumentation check output: unknown assessment '" + assessment + "'");
    }
    ArgumentAssessment result =
        new ArgumentAssessment(
            claimId,
            assessment,
            StructuredOutput.stringList(root, "missing_evidence", "Argumentation check"),
            StructuredOutput.stringList(root, "potential_rebuttals", "Argumentation check"),
            StructuredOutput.optionalNumber(root, "suggested_qualifier", "Argumentation check"),
            root.path("reasoning").asText(""),
            model.toString(),
            null);
    ProvenanceLogEntry entry =
        logAnalysis(ownerId, model, claimId, "argumentation_check", result);
    return new ArgumentAssessment(
        result.claimId(),
        result.assessment(),
        result.missingEvidence(),
        result.potentialRebuttals(),
        result.suggestedQualifier(),
        result.reasoning(),
        result.model(),
        entry.id());
  }

  private String analyze(ModelSelection model, String section, String label, String text) {
    List<LlmClient.Message> messages =
        prompts
            .get(ANALYZE_PROMPT)
            .newSession()
            .enable(section, Map.of())
            .enable("text", Map.of("label", label, "text", text))
            .renderMessages();
    return models.client(model.provider()).complete(model.model(), messages);
  }

  private ProvenanceLogEntry logAnalysis(
      String ownerId, ModelSelection model, String nodeId, String analysis, Object result) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("analysis", analysis);
    metadata.put("node_ids", List.of(nodeId));
    metadata.put("result", JacksonUtility.toMap(result));
    return store.recordActivity(
        ownerId,
        ProvenanceAction.SUMMARIZE,
        Actor.ai(model.model()),
        "AI %s analysis completed".formatted(analysis),
        nodeId,
        metadata);
  }
}

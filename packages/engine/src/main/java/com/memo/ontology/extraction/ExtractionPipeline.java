package com.memo.ontology.extraction;

import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.exception.MemoException;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.graph.ProvenanceMethod;
import com.memo.ontology.model.LlmClient;
import com.memo.ontology.model.LlmClientRegistry;
import com.memo.ontology.model.ModelSelection;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.utility.StringUtility;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns free text into Experimental graph content: Submitted, then Analyzed by the reasoning
 * capability, then Committed (possibly partially) or Failed.
 *
 * <p>Each created node or edge is its own store write with its own audit entry; an item the store
 * rejects is skipped and the batch continues. A committed batch always ends with one {@code
 * extract_graph} summary entry. The pipeline never retries the model.
 */
public class ExtractionPipeline {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(ExtractionPipeline.class);

  static final String PROMPT = "extract-graph";

  private final OntologyStore store;
  private final LlmClientRegistry models;
  private final PromptRepository prompts;
  private final int titleMaxChars;

  public ExtractionPipeline(
      OntologyStore store, LlmClientRegistry models, PromptRepository prompts, int titleMaxChars) {
    this.store = Objects.requireNonNull(store, "store");
    this.models = Objects.requireNonNull(models, "models");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.titleMaxChars = titleMaxChars;
  }

  /**
   * Runs one batch.
   *
   * @throws ValidationException on a blank owner or blank text
   * @throws com.memo.ontology.exception.NotFoundException when the source node is not the owner's
   */
  public ExtractionReport extract(ExtractionRequest request) {
    Objects.requireNonNull(request, "request");
    OntologyStore.requireOwner(request.ownerId());
    if (request.text() == null || request.text().isBlank()) {
      throw new ValidationException("Text to extract from is required", Map.of("field", "text"));
    }
    if (request.sourceNodeId() != null) {
      store.getNode(request.ownerId(), request.sourceNodeId());
    }

    ModelSelection selection =
        models.resolveCompletion(
            request.model() != null ? request.model() : models.extractionSelection());
    log.debug("Extraction submitted for owner {} using {}", request.ownerId(), selection);

    List<LlmClient.Message> messages =
        prompts
            .get(PROMPT)
            .newSession()
            .enable("text", Map.of("text", request.text()))
            .renderMessages();

    ExtractionProposal proposal;
    try {
      String raw = models.client(selection.provider()).complete(selection.model(), messages);
      proposal = ExtractionParser.parse(raw);
    } catch (ExternalCapabilityException e) {
      log.warn("Extraction failed for owner {}: {}", request.ownerId(), e.getMessage());
      return ExtractionReport.failed(selection.toString(), e.getMessage());
    }
    log.debug(
        "Extraction analyzed: {} claim(s), {} relationship(s), {} entit(ies)",
        proposal.claims().size(),
        proposal.relationships().size(),
        proposal.entities().size());

    return commit(request, selection, proposal);
  }

  private ExtractionReport commit(
      ExtractionRequest request, ModelSelection selection, ExtractionProposal proposal) {
    String ownerId = request.ownerId();
    Actor actor = Actor.ai(selection.model());
    List<String> skipped = new ArrayList<>();

    // position i holds the node created for proposal item i, or null when it was skipped
    String[] slots = new String[proposal.claims().size() + proposal.entities().size()];

    int slot = 0;
    for (ExtractionProposal.ProposedClaim claim : proposal.claims()) {
      NodeDraft draft =
          NodeDraft.builder()
              .title(StringUtility.truncate(claim.text(), titleMaxChars))
              .content(claim.text())
              .type(claim.type())
              .status(GovernanceStatus.EXPERIMENTAL)
              .sourceNodeId(request.sourceNodeId())
              .confidence(claim.qualifier())
              .method(ProvenanceMethod.EXTRACT_GRAPH)
              .build();
      slots[slot] = createNode(ownerId, draft, actor, "claim " + slot, skipped);
      slot++;
    }
    for (ExtractionProposal.ProposedEntity entity : proposal.entities()) {
      NodeDraft draft =
          NodeDraft.builder()
              .title(StringUtility.truncate(entity.name(), titleMaxChars))
              .content("Entity: " + entity.name())
              .type(entity.type())
              .status(GovernanceStatus.EXPERIMENTAL)
              .sourceNodeId(request.sourceNodeId())
              .method(ProvenanceMethod.EXTRACT_GRAPH)
              .build();
      slots[slot] = createNode(ownerId, draft, actor, "entity " + slot, skipped);
      slot++;
    }

    List<String> edgeIds = new ArrayList<>();
    int relIndex = 0;
    for (ExtractionProposal.ProposedRelationship rel : proposal.relationships()) {
      String label = "relationship " + relIndex++;
      String sourceId = resolve(slots, rel.sourceIndex());
      String targetId = resolve(slots, rel.targetIndex());
      if (sourceId == null || targetId == null || sourceId.equals(targetId)) {
        skip(
            skipped,
            "%s: unresolved endpoints %d -> %d"
                .formatted(label, rel.sourceIndex(), rel.targetIndex()));
        continue;
      }
      EdgeDraft draft =
          new EdgeDraft(
              sourceId,
              targetId,
              rel.type(),
              rel.weight(),
              null,
              request.sourceNodeId(),
              null,
              ProvenanceMethod.EXTRACT_GRAPH);
      try {
        Edge edge = store.createEdge(ownerId, draft, actor);
        edgeIds.add(edge.id());
      } catch (MemoException e) {
        skip(skipped, label + ": " + e.getMessage());
      }
    }

    List<String> nodeIds = Arrays.stream(slots).filter(Objects::nonNull).toList();

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("claims", proposal.claims().size());
    summary.put("entities", proposal.entities().size());
    summary.put("relationships", proposal.relationships().size());
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("source_node_id", request.sourceNodeId());
    metadata.put("created_node_ids", nodeIds);
    metadata.put("created_edge_ids", edgeIds);
    metadata.put("extraction_summary", summary);
    if (!skipped.isEmpty()) metadata.put("skipped", skipped);

    ProvenanceLogEntry entry =
        store.recordActivity(
            ownerId,
            ProvenanceAction.EXTRACT_GRAPH,
            actor,
            "Extracted %d nodes and %d edges from text".formatted(nodeIds.size(), edgeIds.size()),
            null,
            metadata);

    log.info(
        "Extraction committed for owner {}: {} node(s), {} edge(s), {} skipped",
        ownerId,
        nodeIds.size(),
        edgeIds.size(),
        skipped.size());
    return new ExtractionReport(
        ExtractionState.COMMITTED,
        null,
        selection.toString(),
        proposal.claims().size(),
        proposal.relationships().size(),
        proposal.entities().size(),
        nodeIds,
        edgeIds,
        skipped,
        entry.id());
  }

  private String createNode(
      String ownerId, NodeDraft draft, Actor actor, String label, List<String> skipped) {
    try {
      Node node = store.createNode(ownerId, draft, actor);
      return node.id();
    } catch (MemoException e) {
      skip(skipped, label + ": " + e.getMessage());
      return null;
    }
  }

  private static String resolve(String[] slots, int index) {
    return index >= 0 && index < slots.length ? slots[index] : null;
  }

  private static void skip(List<String> skipped, String reason) {
    log.warn("Extraction item skipped, {}", reason);
    skipped.add(reason);
  }
}

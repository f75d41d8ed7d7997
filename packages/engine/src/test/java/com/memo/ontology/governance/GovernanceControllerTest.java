package com.memo.ontology.governance;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.MemoEngine;
import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.graph.ProvenanceMethod;
import com.memo.ontology.support.FakeLlmClient;
import com.memo.ontology.support.TestEngine;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GovernanceControllerTest {
  private static final String OWNER = "u1";

  private FakeLlmClient llm;
  private MemoEngine engine;
  private GovernanceController governance;
  private Node claim;
  private Node evidence;

  @BeforeEach
  void setUp() {
    llm = new FakeLlmClient();
    engine = TestEngine.create(llm);
    governance = engine.governance();
    claim =
        engine
            .store()
            .createNode(
                OWNER,
                NodeDraft.builder().title("Water boils at 100C").type(NodeType.CLAIM).build(),
                Actor.user());
    evidence =
        engine
            .store()
            .createNode(
                OWNER,
                NodeDraft.builder()
                    .title("Sea level measurement")
                    .content("100C observed")
                    .type(NodeType.EVIDENCE)
                    .build(),
                Actor.user());
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  @DisplayName("Approving AI content twice writes a single approval entry")
  void approveTwice() {
    Node draft =
        engine
            .store()
            .createNode(OWNER, NodeDraft.builder().title("AI idea").build(), Actor.ai("m"));

    assertEquals(
        GovernanceStatus.ACTIVE, governance.approveNode(OWNER, draft.id(), Actor.user()).status());
    assertEquals(
        GovernanceStatus.ACTIVE, governance.approveNode(OWNER, draft.id(), Actor.user()).status());

    long approvals =
        engine.store().provenanceFor(OWNER, draft.id()).stream()
            .filter(e -> e.action() == ProvenanceAction.APPROVE)
            .count();
    assertEquals(1, approvals);
  }

  @Test
  @DisplayName("Link suggestions become Experimental AI edges; bad items are skipped")
  void suggestLinks() {
    llm.reply(
        """
        {"suggestions": [
          {"source_id": "%1$s", "target_id": "%2$s", "type": "supports", "weight": 0.8, "reason": "measurement backs the claim"},
          {"source_id": "%1$s", "target_id": "%1$s", "type": "supports", "weight": 0.5},
          {"source_id": "%1$s", "target_id": "elsewhere", "type": "supports", "weight": 0.5},
          {"source_id": "%2$s", "target_id": "%1$s", "type": "contradicts", "weight": 0.5},
          {"source_id": "%2$s", "target_id": "%1$s", "type": "defines", "weight": 1.5}
        ]}
        """
            .formatted(evidence.id(), claim.id()));

    LinkSuggestionReport report =
        governance.suggestLinks(OWNER, List.of(claim.id(), evidence.id()), null);

    assertEquals(5, report.proposed());
    assertEquals(1, report.created());
    assertEquals(4, report.skipped().size());

    Edge edge = engine.store().getEdge(OWNER, report.edgeIds().get(0));
    assertEquals(GovernanceStatus.EXPERIMENTAL, edge.status());
    assertEquals(EdgeType.SUPPORTS, edge.type());
    assertEquals("measurement backs the claim", edge.label());
    assertEquals(ProvenanceMethod.LINK_SUGGEST, edge.provenance().method());
    assertEquals(0.8, edge.provenance().confidence());

    ProvenanceLogEntry entry = engine.store().provenanceLog(OWNER, 1).get(0);
    assertEquals(ProvenanceAction.LINK_SUGGEST, entry.action());
    assertEquals(claim.id(), entry.targetNodeId());
    assertEquals(1, entry.metadata().get("created"));
    assertTrue(llm.lastUserMessage().contains("id: " + evidence.id()));
  }

  @Test
  @DisplayName("Link suggestion needs two existing nodes and a suggestions array")
  void suggestLinksValidation() {
    assertThrows(
        ValidationException.class,
        () -> governance.suggestLinks(OWNER, List.of(claim.id(), claim.id()), null));
    assertThrows(
        NotFoundException.class,
        () -> governance.suggestLinks(OWNER, List.of(claim.id(), "missing"), null));

    llm.reply("{\"suggestions\": \"none\"}");
    assertThrows(
        ExternalCapabilityException.class,
        () -> governance.suggestLinks(OWNER, List.of(claim.id(), evidence.id()), null));
  }

  @Test
  @DisplayName("Summaries are parsed and audited on the node without touching it")
  void summarize() {
    llm.reply(
        "```json\n{\"summary\": \"Boiling point claim\", \"claim\": \"Water boils at 100C\","
            + " \"grounds\": [\"measurement\"], \"qualifier\": 0.8}\n```");

    NodeSummary summary = governance.summarizeNode(OWNER, claim.id(), null);

    assertEquals("Boiling point claim", summary.summary());
    assertEquals(List.of("measurement"), summary.grounds());
    assertEquals(0.8, summary.qualifier());

    ProvenanceLogEntry entry = engine.store().provenanceFor(OWNER, claim.id()).get(0);
    assertEquals(summary.logId(), entry.id());
    assertEquals(ProvenanceAction.SUMMARIZE, entry.action());
    assertEquals("summarize", entry.metadata().get("analysis"));
    assertEquals(claim, engine.store().getNode(OWNER, claim.id()));

    List<com.memo.ontology.model.LlmClient.Message> messages = llm.completionCalls.get(0);
    assertEquals(2, messages.size());
    assertTrue(messages.get(0).content().startsWith("Summarize the following text"));
    assertTrue(messages.get(1).content().startsWith("TEXT:\nWater boils at 100C"));
  }

  @Test
  @DisplayName("Argument assessment sees the claim's supporting evidence")
  void assessArgument() {
    engine
        .store()
        .createEdge(
            OWNER, EdgeDraft.of(evidence.id(), claim.id(), EdgeType.SUPPORTS, 0.9), Actor.user());
    llm.reply(
        "{\"assessment\": \"moderate\", \"missing_evidence\": [\"altitude data\"],"
            + " \"potential_rebuttals\": [], \"suggested_qualifier\": 0.7, \"reasoning\": \"ok\"}");

    ArgumentAssessment result = governance.assessArgument(OWNER, claim.id(), null);

    assertEquals("moderate", result.assessment());
    assertEquals(List.of("altitude data"), result.missingEvidence());
    assertTrue(llm.lastUserMessage().contains("Supported by (Evidence, weight 0.9): 100C observed"));
    @SuppressWarnings("unchecked")
    Map<String, Object> logged =
        (Map<String, Object>)
            engine.store().provenanceFor(OWNER, claim.id()).get(0).metadata().get("result");
    assertEquals("moderate", logged.get("assessment"));
  }

  @Test
  @DisplayName("Unknown assessment values are rejected")
  void assessArgumentRejectsUnknownGrade() {
    llm.reply("{\"assessment\": \"excellent\"}");
    assertThrows(
        ExternalCapabilityException.class,
        () -> governance.assessArgument(OWNER, claim.id(), null));
  }
}

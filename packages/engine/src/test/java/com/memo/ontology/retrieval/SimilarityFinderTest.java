package com.memo.ontology.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.MemoEngine;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.support.FakeLlmClient;
import com.memo.ontology.support.TestEngine;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimilarityFinderTest {
  private static final String OWNER = "u1";

  private FakeLlmClient llm;
  private MemoEngine engine;

  @BeforeEach
  void setUp() {
    llm = new FakeLlmClient();
    engine = TestEngine.create(llm);
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  private Node note(String title, String content) {
    return engine
        .store()
        .createNode(OWNER, NodeDraft.builder().title(title).content(content).build(), Actor.user());
  }

  @Test
  @DisplayName("Node embeddings are computed from title and content")
  void embedNode() {
    Node node = note("Boiling", "Water boils at 100C");
    llm.vector("Boiling\n\nWater boils at 100C", 1f, 0f, 0f);

    Node embedded = engine.embeddings().embedNode(OWNER, node.id());

    assertArrayEquals(new float[] {1f, 0f, 0f}, embedded.embedding());
    assertEquals(List.of("Boiling\n\nWater boils at 100C"), llm.embeddedTexts);
  }

  @Test
  @DisplayName("Provider vectors are fitted to the configured dimensionality")
  void fitsDimensions() {
    llm.vector("short", 0.5f).vector("long", 1f, 2f, 3f, 4f, 5f);

    assertArrayEquals(new float[] {0.5f, 0f, 0f}, engine.embeddings().embedText("short"));
    assertArrayEquals(new float[] {1f, 2f, 3f}, engine.embeddings().embedText("long"));
    assertThrows(ValidationException.class, () -> engine.embeddings().embedText(" "));
  }

  @Test
  @DisplayName("Similar notes are ranked, thresholded and exclude deprecated nodes")
  void findSimilar() {
    Node close = note("close", "");
    Node medium = note("medium", "");
    Node far = note("far", "");
    Node gone = note("gone", "");
    engine.store().setEmbedding(OWNER, close.id(), new float[] {1f, 0.1f, 0f});
    engine.store().setEmbedding(OWNER, medium.id(), new float[] {1f, 1f, 0f});
    engine.store().setEmbedding(OWNER, far.id(), new float[] {0f, 1f, 0f});
    engine.store().setEmbedding(OWNER, gone.id(), new float[] {1f, 0f, 0f});
    engine.store().transitionNodeStatus(OWNER, gone.id(), GovernanceStatus.DEPRECATED, Actor.user());
    llm.vector("draft", 1f, 0f, 0f);

    List<ScoredNode> hits = engine.similarity().findSimilar(OWNER, "draft");

    assertEquals(
        List.of(close.id(), medium.id()), hits.stream().map(h -> h.node().id()).toList());
    assertTrue(hits.get(0).score() > hits.get(1).score());
    assertEquals(1, engine.similarity().findSimilar(OWNER, "draft", 1).size());
  }
}

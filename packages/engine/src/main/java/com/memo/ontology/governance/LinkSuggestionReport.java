package com.memo.ontology.governance;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Outcome of a link-suggest run; rejected suggestions are listed with their reason. */
public record LinkSuggestionReport(
    int proposed,
    @JsonProperty("edge_ids") List<String> edgeIds,
    List<String> skipped,
    String model,
    @JsonProperty("log_id") String logId) {

  public LinkSuggestionReport {
    edgeIds = List.copyOf(edgeIds);
    skipped = List.copyOf(skipped);
  }

  public int created() {
    return edgeIds.size();
  }
}

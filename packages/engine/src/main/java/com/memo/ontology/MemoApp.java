package com.memo.ontology;

import com.memo.ontology.exception.ExceptionUtil;
import com.memo.ontology.exception.MemoException;
import com.memo.ontology.extraction.ExtractionRequest;
import com.memo.ontology.graph.NodeQuery;
import com.memo.ontology.model.ModelSelection;
import com.memo.ontology.utility.JacksonUtility;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 *   --mode ask      --owner u1 --text "question"  [--model provider:model]
 *   --mode extract  --owner u1 --text "raw text"  [--source-node id] [--model provider:model]
 *   --mode similar  --owner u1 --text "draft"     [--top-k 3]
 *   --mode inbox    --owner u1
 *   --config-file classpath:application.yaml
 * </pre>
 */
public class MemoApp {

  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(MemoApp.class);

  private static final String USAGE =
      """
      Usage: memo --mode <ask|extract|similar|inbox|help> --owner <ownerId> [options]
        --text <text>           question, raw text or draft, depending on the mode
        --model <provider:model> overrides the configured model
        --source-node <id>      extract: node the text came from
        --top-k <n>             similar: number of results
        --config-file <loc>     classpath:... or a filesystem path
      """;

  public static void main(String[] args) {
    try {
      StartupParameters params = new StartupParameters(args);
      if ("help".equals(params.mode())) {
        System.out.println(USAGE);
        return;
      }
      // Disable java logging entirely.
      LogManager.getLogManager().reset();
      Logger.getLogger("").setLevel(Level.OFF);

      ConfigurationProvider configurationProvider = new ConfigurationProvider(params.configFile());
      com.memo.ontology.logging.LoggingService.applyConfiguration(configurationProvider.config());
      try (MemoEngine engine = new MemoEngine(configurationProvider.config())) {
        System.out.println(JacksonUtility.toJson(run(engine, params)));
      }
    } catch (MemoException e) {
      log.error("Operation failed: {}", e.toString());
      System.err.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
    } catch (IllegalArgumentException e) {
      log.error("Invalid arguments: {}", e.getMessage());
      System.err.println(USAGE);
    } catch (Exception e) {
      log.error("Application failed", e);
    }
  }

  static Object run(MemoEngine engine, StartupParameters params) {
    String owner = params.owner().orElseThrow();
    ModelSelection model =
        params.getOptionalParameter("model", String.class).map(ModelSelection::parse).orElse(null);
    switch (params.mode()) {
      case "ask":
        return engine.rag().ask(owner, params.requireText(), model);
      case "extract":
        ExtractionRequest request = ExtractionRequest.of(owner, params.requireText()).using(model);
        return params
            .getOptionalParameter("source-node", String.class)
            .map(request::fromNode)
            .map(r -> engine.extraction().extract(r))
            .orElseGet(() -> engine.extraction().extract(request));
      case "similar":
        return engine
            .similarity()
            .findSimilar(owner, params.requireText(), params.intParameter("top-k", 0));
      case "inbox":
        return engine.store().listNodes(owner, NodeQuery.inbox());
      default:
        throw new IllegalArgumentException("Invalid mode: " + params.mode());
    }
  }
}

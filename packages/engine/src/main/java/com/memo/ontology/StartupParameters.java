package com.memo.ontology;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Command line parameters in {@code --name value} form; a flag without a value maps to null. */
public class StartupParameters {
  static final List<String> MODES = List.of("help", "ask", "extract", "similar", "inbox");

  final Map<String, Object> parameters = new HashMap<>();

  public StartupParameters(String[] arguments) {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "help");
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) continue;
      String name = arguments[p].substring(2);
      boolean hasValue = p + 1 < arguments.length && !arguments[p + 1].startsWith("--");
      parameters.put(name, hasValue ? arguments[++p] : null);
    }
    validate();
  }

  private void validate() {
    String mode = getParameter("mode", String.class);
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode + ", expected one of " + MODES);
    }
    if (configFile().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if (!"help".equals(mode) && owner().isEmpty()) {
      throw new IllegalArgumentException("Mode '" + mode + "' requires --owner <ownerId>");
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /** E.g. "classpath:application.yaml" or "/etc/memo.yaml". */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("");
  }

  public Optional<String> owner() {
    return getOptionalParameter("owner", String.class).filter(o -> !o.isBlank());
  }

  /** The non-blank {@code --text} value the current mode works on. */
  public String requireText() {
    return getOptionalParameter("text", String.class)
        .filter(t -> !t.isBlank())
        .orElseThrow(() -> new IllegalArgumentException("Mode '" + mode() + "' requires --text"));
  }

  /** Positive integer option, or {@code fallback} when absent. */
  public int intParameter(String name, int fallback) {
    Optional<String> raw = getOptionalParameter(name, String.class);
    if (raw.isEmpty()) return fallback;
    try {
      int value = Integer.parseInt(raw.get().trim());
      if (value <= 0) throw new IllegalArgumentException("--" + name + " must be positive");
      return value;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " expects a number, got '" + raw.get() + "'");
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(getParameter(name, type));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}

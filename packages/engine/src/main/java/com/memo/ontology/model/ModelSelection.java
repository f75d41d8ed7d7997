package com.memo.ontology.model;

import com.memo.ontology.exception.ValidationException;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Explicit per-request choice of provider and model. A null model means the provider default.
 *
 * <p>The textual form is {@code provider} or {@code provider:model}.
 */
public record ModelSelection(String provider, String model) {

  public ModelSelection {
    if (provider == null || provider.isBlank()) {
      throw new ValidationException("Model provider is required", Map.of("field", "provider"));
    }
    provider = provider.trim().toLowerCase();
    model = model == null || model.isBlank() ? null : model.trim();
  }

  public static ModelSelection of(String provider, String model) {
    return new ModelSelection(provider, model);
  }

  public static ModelSelection parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Empty model selection", Map.of("field", "model"));
    }
    int colon = value.indexOf(':');
    return colon < 0
        ? new ModelSelection(value, null)
        : new ModelSelection(value.substring(0, colon), value.substring(colon + 1));
  }

  /**
   * Reads {@code <prefix>.provider} and {@code <prefix>.model}, falling back to {@code fallback}
   * when the provider key is absent.
   */
  public static ModelSelection fromConfiguration(
      Configuration cfg, String prefix, ModelSelection fallback) {
    String provider = cfg.getString(prefix + ".provider", null);
    if (provider == null || provider.isBlank()) return fallback;
    return new ModelSelection(provider, cfg.getString(prefix + ".model", null));
  }

  public ModelSelection withModel(String newModel) {
    return new ModelSelection(provider, newModel);
  }

  @Override
  public String toString() {
    return model == null ? provider : provider + ":" + model;
  }
}

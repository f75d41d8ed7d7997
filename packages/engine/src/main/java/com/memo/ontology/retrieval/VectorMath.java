package com.memo.ontology.retrieval;

/** Small numeric helpers over embedding vectors. */
public final class VectorMath {
  private VectorMath() {}

  /**
   * Cosine similarity of two equally sized vectors; 0 when either has zero norm.
   *
   * @throws IllegalArgumentException on a length mismatch
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector length mismatch: " + a.length + " vs " + b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) return 0;
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Zero-pads or truncates {@code vector} to exactly {@code dimensions} entries. */
  public static float[] fit(float[] vector, int dimensions) {
    if (vector.length == dimensions) return vector;
    float[] out = new float[dimensions];
    System.arraycopy(vector, 0, out, 0, Math.min(vector.length, dimensions));
    return out;
  }
}

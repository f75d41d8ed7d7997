package com.memo.ontology.retrieval;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Trigram similarity with PostgreSQL {@code pg_trgm} semantics: text is lower-cased and split
 * into words of letters and digits, each word is padded with two leading blanks and one trailing
 * blank, and the score is the Jaccard index of the two trigram sets.
 */
public final class TrigramSimilarity {
  private TrigramSimilarity() {}

  public static Set<String> trigrams(String text) {
    Set<String> result = new HashSet<>();
    if (text == null || text.isEmpty()) return result;
    StringBuilder word = new StringBuilder();
    String lower = text.toLowerCase(Locale.ROOT);
    for (int i = 0; i <= lower.length(); i++) {
      char c = i < lower.length() ? lower.charAt(i) : ' ';
      if (Character.isLetterOrDigit(c)) {
        word.append(c);
      } else if (word.length() > 0) {
        addWord(word.toString(), result);
        word.setLength(0);
      }
    }
    return result;
  }

  private static void addWord(String word, Set<String> out) {
    String padded = "  " + word + " ";
    for (int i = 0; i + 3 <= padded.length(); i++) {
      out.add(padded.substring(i, i + 3));
    }
  }

  public static double similarity(String a, String b) {
    return similarity(trigrams(a), trigrams(b));
  }

  public static double similarity(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) return 0.0;
    int common = 0;
    for (String t : a) {
      if (b.contains(t)) common++;
    }
    int union = a.size() + b.size() - common;
    return (double) common / union;
  }
}

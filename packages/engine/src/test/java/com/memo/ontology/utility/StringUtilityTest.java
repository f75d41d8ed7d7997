package com.memo.ontology.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StringUtilityTest {

  @Test
  @DisplayName("Word count splits on any whitespace")
  void wordCount() {
    assertEquals(0, StringUtility.wordCount(null));
    assertEquals(0, StringUtility.wordCount("   "));
    assertEquals(4, StringUtility.wordCount(" Water\tboils\n at  100C "));
  }

  @Test
  @DisplayName("Truncate keeps short text and null as is")
  void truncate() {
    assertNull(StringUtility.truncate(null, 3));
    assertEquals("abc", StringUtility.truncate("abc", 5));
    assertEquals("ab", StringUtility.truncate("abc", 2));
  }

  @Test
  @DisplayName("JSON fences are stripped from model output")
  void unwrapJson() {
    assertEquals("{\"a\":1}", StringUtility.unwrapJson("```json\n{\"a\":1}\n```"));
    assertEquals("{\"a\":1}", StringUtility.unwrapJson("Sure:\n```\n{\"a\":1}\n```\nDone."));
    assertEquals("{\"a\":1}", StringUtility.unwrapJson("  {\"a\":1}  "));
    assertNull(StringUtility.extractSnippet("no fence", "json"));
  }
}

package com.gentoro.verifier.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.verifier.exception.ConfigException;
import com.gentoro.verifier.exception.StateException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptTemplateTest {

  @Test
  void placeholdersAreSubstituted() {
    PromptTemplate t = new PromptTemplate("t", "Job {{id}} costs {{ budget }} ($ not special)");
    assertEquals("Job 7 costs 100 ($ not special)", t.render(Map.of("id", 7, "budget", "100")));
  }

  @Test
  void missingValueIsAnError() {
    PromptTemplate t = new PromptTemplate("t", "Job {{id}}");
    assertThrows(StateException.class, () -> t.render(Map.of()));
  }

  @Test
  void bundledPromptsLoad() {
    PromptRepository repo = new PromptRepository();
    assertTrue(repo.get(PromptRepository.DISPUTE_RESOLUTION).text().contains("YES or NO"));
    assertTrue(repo.get(PromptRepository.JOB_CONTEXT).text().startsWith("Job Validation Context:"));
    assertSame(
        repo.get(PromptRepository.CROSS_VALIDATION_RUBRIC),
        repo.get(PromptRepository.CROSS_VALIDATION_RUBRIC));
    assertThrows(ConfigException.class, () -> repo.get("does-not-exist"));
  }
}

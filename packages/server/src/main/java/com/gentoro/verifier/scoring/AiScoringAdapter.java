package com.gentoro.verifier.scoring;

import com.gentoro.verifier.chain.ChainJobDetails;
import com.gentoro.verifier.exception.InferenceException;
import com.gentoro.verifier.inference.InferenceClient;
import com.gentoro.verifier.prompt.PromptRepository;
import org.apache.commons.lang3.StringUtils;

/** Turns inference replies into dispute verdicts and job quality scores. */
public class AiScoringAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(AiScoringAdapter.class);

  static final String DISPUTE_USER_PREFIX = "Please provide the dispute history:\n\n";

  private final InferenceClient inference;
  private final PromptRepository prompts;

  public AiScoringAdapter(InferenceClient inference, PromptRepository prompts) {
    this.inference = inference;
    this.prompts = prompts;
  }

  /** Free-text verdict on a dispute history. */
  public String resolveDispute(String disputeHistory) {
    String system = prompts.get(PromptRepository.DISPUTE_RESOLUTION).text();
    return inference.chat(system, DISPUTE_USER_PREFIX + disputeHistory);
  }

  /** Render the natural-language context the scoring rubric is applied to. */
  public String renderContext(ChainJobDetails details) {
    return prompts.get(PromptRepository.JOB_CONTEXT).render(details.promptValues());
  }

  /**
   * Score a rendered job context.
   *
   * @return score within [0, 100]
   * @throws InferenceException when the call fails or the reply has no digits
   */
  public int score(String context) {
    String system = prompts.get(PromptRepository.CROSS_VALIDATION_RUBRIC).text();
    String reply = inference.chat(system, context);
    log.debug("Scoring reply: {}", reply);
    return ScoreParser.parse(reply)
        .orElseThrow(() -> new InferenceException("Model reply contains no score: " + StringUtils.abbreviate(reply, 120)));
  }

  public String provider() {
    return inference.provider();
  }

  public String model() {
    return inference.model();
  }
}

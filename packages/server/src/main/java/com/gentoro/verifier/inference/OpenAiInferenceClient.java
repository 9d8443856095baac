package com.gentoro.verifier.inference;

import com.gentoro.verifier.exception.InferenceException;
import com.openai.client.OpenAIClient;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.time.Duration;

/** OpenAI compatible Chat Completions backend using the openai-java SDK. */
public class OpenAiInferenceClient extends AbstractInferenceClient {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(OpenAiInferenceClient.class);

  private final OpenAIClient openAIClient;

  public OpenAiInferenceClient(OpenAIClient openAIClient, String model, Duration timeout) {
    super(model, timeout);
    this.openAIClient = openAIClient;
  }

  @Override
  public String provider() {
    return "openai";
  }

  @Override
  protected String runInference(String systemInstruction, String userContent) {
    ChatCompletionCreateParams params =
        ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .addSystemMessage(systemInstruction)
            .addUserMessage(userContent)
            .build();

    ChatCompletion chatCompletion = openAIClient.chat().completions().create(params);
    if (chatCompletion.choices().isEmpty()) {
      throw new InferenceException("No candidates returned from OpenAI inference.");
    }
    chatCompletion
        .usage()
        .ifPresent(u -> log.debug("OpenAI usage: {} total tokens", u.totalTokens()));

    return chatCompletion.choices().stream()
        .filter(c -> c.message().content().isPresent())
        .map(c -> c.message().content().get())
        .findFirst()
        .orElseThrow(() -> new InferenceException("No content returned from OpenAI inference."));
  }
}

package com.gentoro.verifier.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.verifier.exception.InferenceException;
import com.gentoro.verifier.utility.JacksonUtility;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Ollama native chat API: {@code POST {endpoint}/api/chat} with streaming disabled. */
public class OllamaInferenceClient extends AbstractInferenceClient {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final String endpoint;

  public OllamaInferenceClient(
      OkHttpClient httpClient, String endpoint, String model, Duration timeout) {
    super(model, timeout);
    this.httpClient = httpClient;
    this.endpoint = endpoint;
  }

  @Override
  public String provider() {
    return "ollama";
  }

  @Override
  protected String runInference(String systemInstruction, String userContent) throws Exception {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", model);
    body.put("stream", false);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", systemInstruction);
    messages.addObject().put("role", "user").put("content", userContent);

    Request request =
        new Request.Builder()
            .url(endpoint + "/api/chat")
            .post(RequestBody.create(JacksonUtility.getJsonMapper().writeValueAsBytes(body), JSON))
            .build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new InferenceException(
            "Ollama returned HTTP %d: %s".formatted(response.code(), extractError(text)));
      }
      JsonNode content = JacksonUtility.getJsonMapper().readTree(text).path("message").path("content");
      if (!content.isTextual()) {
        throw new InferenceException("Ollama response has no message content");
      }
      return content.asText();
    }
  }

  private static String extractError(String text) {
    try {
      JsonNode error = JacksonUtility.getJsonMapper().readTree(text).path("error");
      if (error.isTextual()) return error.asText();
    } catch (Exception ignored) {
      // not JSON, report the raw body
    }
    return text.length() > 200 ? text.substring(0, 200) : text;
  }
}

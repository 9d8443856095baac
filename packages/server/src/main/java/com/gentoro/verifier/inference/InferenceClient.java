package com.gentoro.verifier.inference;

/**
 * Minimal chat completion capability: one system instruction, one user message, one free-text
 * reply.
 *
 * <p>Implementations bound each call by their configured timeout and report every failure
 * (transport, timeout, malformed response) as {@link
 * com.gentoro.verifier.exception.InferenceException}.
 */
public interface InferenceClient {

  String chat(String systemInstruction, String userContent);

  /** Name reported in service info and submission receipts, e.g. {@code ollama}. */
  String provider();

  String model();
}

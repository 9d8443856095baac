package com.gentoro.verifier.chain;

import java.util.List;

/**
 * One log entry emitted by a transaction.
 *
 * @param address emitting contract
 * @param topics 0x-prefixed 32-byte topics, the first being the event signature hash
 * @param data 0x-prefixed ABI-encoded non-indexed payload
 */
public record ChainLog(String address, List<String> topics, String data) {
  public ChainLog {
    topics = topics == null ? List.of() : List.copyOf(topics);
    data = data == null ? "0x" : data;
  }
}

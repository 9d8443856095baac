package com.gentoro.verifier.chain;

import java.math.BigInteger;
import java.util.List;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

/**
 * Low-level ledger capability. Implementations bound every remote call by their own timeout and
 * report failures as {@link com.gentoro.verifier.exception.ChainException}.
 */
public interface ChainClient extends AutoCloseable {

  /**
   * Execute a read-only contract call at the latest block.
   *
   * @return decoded outputs per the function's output descriptors; empty when the call returned no
   *     data
   */
  @SuppressWarnings("rawtypes")
  List<Type> call(String contractAddress, Function function);

  /**
   * Sign and submit a state-changing call, blocking until the transaction is mined.
   *
   * @return transaction hash, 0x-prefixed
   */
  String submit(String contractAddress, Function function, BigInteger gasLimit);

  /** Logs emitted by a mined transaction; empty if the transaction has no receipt. */
  List<ChainLog> logsForTransaction(String transactionHash);

  @Override
  default void close() {}
}

package com.gentoro.verifier.chain;

import com.gentoro.verifier.config.ChainSettings;
import com.gentoro.verifier.exception.ChainException;
import com.gentoro.verifier.exception.ConfigException;
import com.gentoro.verifier.exception.ExceptionUtil;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import okhttp3.OkHttpClient;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

/**
 * {@link ChainClient} over JSON-RPC using web3j. Transactions are signed locally with the operator
 * key for the configured chain id; confirmation is awaited by polling for the receipt.
 */
public class Web3jChainClient implements ChainClient {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(Web3jChainClient.class);

  private final Web3j web3j;
  private final Credentials credentials;
  private final TransactionManager transactionManager;
  private final TransactionReceiptProcessor receiptProcessor;

  public Web3jChainClient(ChainSettings settings, OkHttpClient httpClient) {
    this(Web3j.build(new HttpService(settings.rpcUrl(), httpClient)), settings);
  }

  Web3jChainClient(Web3j web3j, ChainSettings settings) {
    this.web3j = web3j;
    this.credentials = credentials(settings.privateKey());
    this.receiptProcessor =
        new PollingTransactionReceiptProcessor(
            web3j, settings.receiptPollInterval().toMillis(), settings.receiptAttempts());
    this.transactionManager =
        new RawTransactionManager(web3j, credentials, settings.chainId(), receiptProcessor);
    log.info("Chain client ready for {} as {}", settings.rpcUrl(), credentials.getAddress());
  }

  private static Credentials credentials(String privateKey) {
    try {
      return Credentials.create(privateKey);
    } catch (RuntimeException e) {
      // the message must not echo the key
      throw new ConfigException("chain.private-key is not a valid secp256k1 private key");
    }
  }

  @Override
  @SuppressWarnings("rawtypes")
  public List<Type> call(String contractAddress, Function function) {
    String data = FunctionEncoder.encode(function);
    EthCall response;
    try {
      response =
          web3j
              .ethCall(
                  Transaction.createEthCallTransaction(
                      credentials.getAddress(), contractAddress, data),
                  DefaultBlockParameterName.LATEST)
              .send();
    } catch (IOException e) {
      throw new ChainException(
          "Call to %s on %s failed".formatted(function.getName(), contractAddress), e);
    }
    if (response.isReverted()) {
      throw new ChainException(
          "Call to %s reverted: %s".formatted(function.getName(), response.getRevertReason()));
    }
    if (response.hasError()) {
      throw new ChainException(
          "Call to %s failed: %s".formatted(function.getName(), response.getError().getMessage()));
    }
    String value = response.getValue();
    if (value == null || value.isEmpty() || "0x".equals(value)) {
      return List.of();
    }
    try {
      return FunctionReturnDecoder.decode(value, function.getOutputParameters());
    } catch (RuntimeException e) {
      throw new ChainException("Could not decode result of " + function.getName(), e);
    }
  }

  @Override
  public String submit(String contractAddress, Function function, BigInteger gasLimit) {
    String data = FunctionEncoder.encode(function);
    try {
      BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
      EthSendTransaction sent =
          transactionManager.sendTransaction(
              gasPrice, gasLimit, contractAddress, data, BigInteger.ZERO);
      if (sent.hasError()) {
        throw new ChainException(
            "Transaction %s rejected: %s"
                .formatted(function.getName(), sent.getError().getMessage()));
      }
      log.debug("Submitted {} as {}", function.getName(), sent.getTransactionHash());
      TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
      if (!receipt.isStatusOK()) {
        throw new ChainException(
            "Transaction %s reverted with status %s"
                .formatted(receipt.getTransactionHash(), receipt.getStatus()));
      }
      return receipt.getTransactionHash();
    } catch (IOException | TransactionException e) {
      throw new ChainException(
          "Transaction %s failed: %s"
              .formatted(function.getName(), ExceptionUtil.extractErrorMessage(e)),
          e);
    }
  }

  @Override
  public List<ChainLog> logsForTransaction(String transactionHash) {
    Optional<TransactionReceipt> receipt;
    try {
      receipt = web3j.ethGetTransactionReceipt(transactionHash).send().getTransactionReceipt();
    } catch (IOException e) {
      throw new ChainException("Could not fetch receipt for " + transactionHash, e);
    }
    if (receipt.isEmpty()) {
      return List.of();
    }
    List<Log> logs = receipt.get().getLogs();
    if (logs == null) return List.of();
    return logs.stream().map(l -> new ChainLog(l.getAddress(), l.getTopics(), l.getData())).toList();
  }

  @Override
  public void close() {
    web3j.shutdown();
  }
}

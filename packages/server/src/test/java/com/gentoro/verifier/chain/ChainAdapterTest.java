package com.gentoro.verifier.chain;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.verifier.config.ChainSettings;
import com.gentoro.verifier.exception.ChainException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;

class ChainAdapterTest {
  private static final String JOBS = "0x1111111111111111111111111111111111111111";

  private final ChainSettings settings =
      new ChainSettings(
          "http://localhost:8545",
          "0x01",
          JOBS,
          ChainSettings.DEFAULT_REGISTRY_MODULE,
          296,
          BigInteger.valueOf(500_000),
          Duration.ofMillis(10),
          3);
  private final ChainClient client = mock(ChainClient.class);
  private final ChainAdapter adapter = new ChainAdapter(client, settings);

  static JobStruct struct(long agentId) {
    byte[] multihop = new byte[32];
    multihop[31] = 0x2a;
    return new JobStruct(
        new Address("0x00000000000000000000000000000000000000aa"),
        new Uint256(agentId),
        new Uint256(1_000),
        new Utf8String("Translate a document"),
        new Uint8(2),
        new Uint64(1_700_000_000L),
        new Uint64(1_700_003_600L),
        new Uint64(1_700_086_400L),
        new Bytes32(multihop),
        new Uint64(1));
  }

  @Test
  void readJobDecodesStruct() {
    when(client.call(eq(JOBS), any())).thenReturn(List.of(struct(7)));

    ChainJobDetails details = adapter.readJob(JobReference.parse("0x2a")).orElseThrow();

    assertEquals(BigInteger.valueOf(7), details.agentId());
    assertEquals("0x00000000000000000000000000000000000000aa", details.creator());
    assertEquals(2, details.state());
    assertEquals(BigInteger.valueOf(1_700_086_400L), details.completeDeadline());
    assertEquals("0x" + "0".repeat(62) + "2a", details.multihopId());
    assertEquals("Translate a document", details.description());
  }

  @Test
  void unsignedSixtyFourBitFieldsKeepFullRange() {
    BigInteger max = BigInteger.TWO.pow(64).subtract(BigInteger.ONE);
    JobStruct struct =
        new JobStruct(
            new Address("0x00000000000000000000000000000000000000aa"),
            new Uint256(7),
            new Uint256(1_000),
            new Utf8String("Open ended"),
            new Uint8(1),
            new Uint64(1_700_000_000L),
            new Uint64(max),
            new Uint64(max),
            new Bytes32(new byte[32]),
            new Uint64(max));

    ChainJobDetails details = struct.toDetails();

    assertEquals(new BigInteger("18446744073709551615"), details.acceptDeadline());
    assertEquals(max, details.completeDeadline());
    assertEquals(max, details.step());
    assertEquals("18446744073709551615", String.valueOf(details.promptValues().get("step")));
  }

  @Test
  void readJobEncodesReferenceAsBytes32() {
    when(client.call(eq(JOBS), any())).thenReturn(List.of());
    JobReference ref = JobReference.parse("0x2a");

    assertTrue(adapter.readJob(ref).isEmpty());

    ArgumentCaptor<Function> fn = ArgumentCaptor.forClass(Function.class);
    verify(client).call(eq(JOBS), fn.capture());
    assertEquals("getJob", fn.getValue().getName());
    String encoded = FunctionEncoder.encode(fn.getValue());
    assertTrue(encoded.endsWith(ref.hex()));
  }

  @Test
  void readJobPropagatesChainFailure() {
    when(client.call(eq(JOBS), any())).thenThrow(new ChainException("reverted"));
    assertThrows(ChainException.class, () -> adapter.readJob(JobReference.parse("0x2a")));
  }

  @Test
  void writeScoreTargetsRegistryWithGasLimit() {
    when(client.submit(any(), any(), any())).thenReturn("0xtx");

    assertEquals("0xtx", adapter.writeScore(BigInteger.valueOf(7), null, 85));

    ArgumentCaptor<Function> fn = ArgumentCaptor.forClass(Function.class);
    verify(client)
        .submit(
            eq(ChainSettings.DEFAULT_REGISTRY_MODULE), fn.capture(), eq(BigInteger.valueOf(500_000)));
    assertEquals("recordCrossValidationReputationScore", fn.getValue().getName());
    List<?> args = fn.getValue().getInputParameters();
    assertEquals(BigInteger.valueOf(7), ((Uint256) args.get(0)).getValue());
    assertEquals(BigInteger.ZERO, ((Uint256) args.get(1)).getValue());
    assertEquals(BigInteger.valueOf(85), ((Uint256) args.get(2)).getValue());
  }

  @Test
  void writeScoreRejectsOutOfRangeScore() {
    assertThrows(
        IllegalArgumentException.class, () -> adapter.writeScore(BigInteger.ONE, null, 101));
    assertThrows(
        IllegalArgumentException.class, () -> adapter.writeScore(BigInteger.ONE, null, -1));
    verifyNoInteractions(client);
  }

  @Test
  void eventTopicIsKeccakOfSignature() {
    assertEquals(
        org.web3j.crypto.Hash.sha3String("CrossValidationRequested(bytes32,uint256)"),
        ContractFunctions.CROSS_VALIDATION_REQUESTED_TOPIC);
  }
}

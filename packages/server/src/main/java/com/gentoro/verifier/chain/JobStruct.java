package com.gentoro.verifier.chain;

import java.math.BigInteger;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

/**
 * ABI shape of the tuple returned by {@code JobsModule.getJob(bytes32)}. The decoder instantiates
 * it through the constructor taking ABI types.
 */
public class JobStruct extends DynamicStruct {
  public final String creator;
  public final BigInteger agentId;
  public final BigInteger budget;
  public final String description;
  public final BigInteger state;
  public final BigInteger createdAt;
  public final BigInteger acceptDeadline;
  public final BigInteger completeDeadline;
  public final byte[] multihopId;
  public final BigInteger step;

  public JobStruct(
      Address creator,
      Uint256 agentId,
      Uint256 budget,
      Utf8String description,
      Uint8 state,
      Uint64 createdAt,
      Uint64 acceptDeadline,
      Uint64 completeDeadline,
      Bytes32 multihopId,
      Uint64 step) {
    super(
        creator,
        agentId,
        budget,
        description,
        state,
        createdAt,
        acceptDeadline,
        completeDeadline,
        multihopId,
        step);
    this.creator = creator.getValue();
    this.agentId = agentId.getValue();
    this.budget = budget.getValue();
    this.description = description.getValue();
    this.state = state.getValue();
    this.createdAt = createdAt.getValue();
    this.acceptDeadline = acceptDeadline.getValue();
    this.completeDeadline = completeDeadline.getValue();
    this.multihopId = multihopId.getValue();
    this.step = step.getValue();
  }

  public ChainJobDetails toDetails() {
    return new ChainJobDetails(
        creator,
        agentId,
        budget,
        description,
        state.intValue(),
        createdAt,
        acceptDeadline,
        completeDeadline,
        Numeric.toHexString(multihopId),
        step);
  }
}

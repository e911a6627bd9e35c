package com.custodyledger.api.dto;

import com.custodyledger.ledger.CapacityPolicy;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Configured limits and the capacity still available.
 */
@Value
@Builder
public class CapacityResponse {
    BigInteger capacityLimit;
    BigInteger remainingCapacity;
    BigInteger withdrawLimit;
    CapacityPolicy capacityPolicy;
}

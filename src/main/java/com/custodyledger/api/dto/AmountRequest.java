package com.custodyledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * DTO carrying the amount of a deposit, withdrawal or inbound transfer.
 * Zero passes here and is refused by the ledger itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    private BigInteger amount;
}

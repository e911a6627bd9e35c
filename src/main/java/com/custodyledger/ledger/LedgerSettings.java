package com.custodyledger.ledger;

import com.custodyledger.common.Amount;
import com.custodyledger.common.PrincipalId;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of a ledger instance, fixed at construction.
 */
@Value
public class LedgerSettings {

    Amount capacityLimit;
    Amount withdrawLimit;
    boolean strictWithdrawLimit;
    CapacityPolicy capacityPolicy;

    /**
     * Holder of the privileged read capability, or {@code null} if none.
     */
    String owner;

    @Builder
    private LedgerSettings(Amount capacityLimit, Amount withdrawLimit, Boolean strictWithdrawLimit,
                           CapacityPolicy capacityPolicy, String owner) {
        if (capacityLimit == null || !capacityLimit.isPositive()) {
            throw new IllegalArgumentException("Capacity limit must be positive: " + capacityLimit);
        }
        if (withdrawLimit == null || !withdrawLimit.isPositive()) {
            throw new IllegalArgumentException("Withdraw limit must be positive: " + withdrawLimit);
        }
        boolean strict = strictWithdrawLimit == null || strictWithdrawLimit;
        if (strict && !withdrawLimit.isLessThan(capacityLimit)) {
            throw new IllegalArgumentException(String.format(
                "Withdraw limit %s must be below capacity limit %s", withdrawLimit, capacityLimit));
        }
        if (owner != null && !owner.isEmpty()) {
            PrincipalId.validate(owner);
        }

        this.capacityLimit = capacityLimit;
        this.withdrawLimit = withdrawLimit;
        this.strictWithdrawLimit = strict;
        this.capacityPolicy = capacityPolicy != null ? capacityPolicy : CapacityPolicy.HELD_BALANCE;
        this.owner = owner == null || owner.isEmpty() ? null : owner;
    }

    public boolean isOwner(String principal) {
        return owner != null && owner.equals(principal);
    }
}

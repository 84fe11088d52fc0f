package com.flagship.collateral_engine.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Point-in-time copy of the ledger used to undo a failed operation.
 * Positions are immutable, so a shallow copy of the map is enough.
 */
@Getter(AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class LedgerSnapshot {
    private final Map<AccountId, AccountPosition> positions;
    private final int pendingEventCount;
}

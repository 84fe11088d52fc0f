package com.flagship.collateral_engine.engine.collaborator;

import com.flagship.collateral_engine.ledger.AccountId;

import java.math.BigInteger;

/**
 * The debt token the engine mints and burns. Supply bookkeeping lives behind this interface.
 *
 * Each call returns {@code false} (or throws) when the token refuses the request.
 */
public interface DebtTokenService {

    String tokenId();

    boolean mint(AccountId to, BigInteger amount);

    /**
     * Moves {@code amount} from the account into engine custody ahead of a burn.
     */
    boolean pullForBurn(AccountId from, BigInteger amount);

    /**
     * Destroys {@code amount} held in engine custody.
     */
    boolean burn(BigInteger amount);

    /**
     * Returns custody tokens to an account. Used only to compensate a pull whose operation failed.
     */
    boolean returnFromCustody(AccountId to, BigInteger amount);
}

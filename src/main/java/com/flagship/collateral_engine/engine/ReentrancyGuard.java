package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.InvariantViolationException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes mutating operations and rejects nested ones.
 *
 * Other threads block until the running operation finishes. The thread that
 * already holds the guard (a collaborator calling back into the engine) is
 * rejected instead of being let through.
 */
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public void enter(String operation) {
        if (lock.isHeldByCurrentThread()) {
            throw new InvariantViolationException(EngineError.REENTRANT_CALL,
                "Nested " + operation + " rejected: another engine operation is in progress on this thread");
        }
        lock.lock();
    }

    public void exit() {
        lock.unlock();
    }

    public boolean isEntered() {
        return lock.isLocked();
    }
}

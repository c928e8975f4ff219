package com.project.lockup.core;

import java.util.function.Supplier;

/**
 * Per-instance busy flag around lifecycle operations.
 *
 * A token callback fired while a transfer is in flight that tries to call back
 * into any guarded operation is rejected with {@code REENTRANT_CALL}. The flag is
 * cleared on every exit path.
 */
public class ReentrancyGuard {

    private boolean entered;

    public <T> T guard(String operation, Supplier<T> body) {
        if (entered) {
            throw new LockupException(LockupError.REENTRANT_CALL,
                    String.format("%s called while another lockup operation is in progress", operation));
        }
        entered = true;
        try {
            return body.get();
        } finally {
            entered = false;
        }
    }

    public boolean isEntered() {
        return entered;
    }
}

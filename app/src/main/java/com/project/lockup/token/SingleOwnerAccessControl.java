package com.project.lockup.token;

import com.project.lockup.core.LockupError;
import com.project.lockup.core.LockupException;
import com.project.lockup.core.LockupValidator;

/**
 * Ownable-style access control: one owner, set at construction, transferable by the owner.
 */
public class SingleOwnerAccessControl implements AccessControl {

    private String owner;

    public SingleOwnerAccessControl(String initialOwner) {
        if (!LockupValidator.isValidAddress(initialOwner) || LockupValidator.isZeroAddress(initialOwner)) {
            throw new LockupException(LockupError.INVALID_OWNER,
                    String.format("Initial owner must be a non-zero address: '%s'", initialOwner));
        }
        this.owner = LockupValidator.checksum(initialOwner);
    }

    @Override
    public synchronized String owner() {
        return owner;
    }

    @Override
    public synchronized boolean isOwner(String account) {
        return !LockupValidator.isZeroAddress(owner) && LockupValidator.sameAddress(owner, account);
    }

    @Override
    public void checkOwner(String caller) {
        if (!isOwner(caller)) {
            throw new LockupException(LockupError.UNAUTHORIZED,
                    String.format("Account %s is not the owner", caller));
        }
    }

    @Override
    public synchronized void transferOwnership(String caller, String newOwner) {
        checkOwner(caller);
        if (!LockupValidator.isValidAddress(newOwner) || LockupValidator.isZeroAddress(newOwner)) {
            throw new LockupException(LockupError.INVALID_OWNER,
                    String.format("New owner must be a non-zero address: '%s'", newOwner));
        }
        owner = LockupValidator.checksum(newOwner);
    }

    @Override
    public synchronized void renounceOwnership(String caller) {
        checkOwner(caller);
        owner = LockupValidator.ZERO_ADDRESS;
    }
}

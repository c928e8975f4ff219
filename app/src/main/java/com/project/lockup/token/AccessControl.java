package com.project.lockup.token;

/**
 * Single-owner role check.
 */
public interface AccessControl {

    String owner();

    boolean isOwner(String account);

    /**
     * @throws com.project.lockup.core.LockupException with {@code UNAUTHORIZED} if {@code caller} is not the owner
     */
    void checkOwner(String caller);

    void transferOwnership(String caller, String newOwner);

    /**
     * Leave the contract without an owner. Owner-only operations become unreachable.
     */
    void renounceOwnership(String caller);
}

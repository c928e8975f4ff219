package com.project.lockup.token;

/**
 * Tells whether an address hosts contract code.
 */
@FunctionalInterface
public interface CodeInspector {

    boolean hasCode(String address);
}

package com.flagship.account_ledger.runtime;

/**
 * Receives faults that must stop the process, such as an event that cannot be
 * applied to the state it was loaded onto.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatalError(String context, Throwable error);
}

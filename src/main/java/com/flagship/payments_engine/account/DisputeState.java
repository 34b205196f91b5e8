package com.flagship.payments_engine.account;

/**
 * Adjudication state of a disputed transaction.
 *
 * Transitions are forward only: DISPUTED is the single entry state,
 * RESOLVED and CHARGED_BACK are terminal.
 */
public enum DisputeState {
    /**
     * Funds of the referenced deposit are held.
     * Can transition to RESOLVED or CHARGED_BACK.
     */
    DISPUTED,

    /**
     * Held funds were released back to available.
     * Terminal state - the transaction can never be disputed again.
     */
    RESOLVED,

    /**
     * Held funds were removed from the account, which is now locked.
     * Terminal state.
     */
    CHARGED_BACK;

    public boolean isTerminal() {
        return this == RESOLVED || this == CHARGED_BACK;
    }

    /**
     * Checks if a transition from this state to the target state is allowed.
     */
    public boolean canTransitionTo(DisputeState target) {
        return switch (this) {
            case DISPUTED -> target == RESOLVED || target == CHARGED_BACK;
            case RESOLVED, CHARGED_BACK -> false;
        };
    }
}

package com.hostprobe.core.security;

/**
 * Outcome of {@link CommandAuthorizer#authorize}: exactly one of approval or rejection is set.
 */
public record Authorization(Approval approval, Rejection rejection) {

    public Authorization {
        if ((approval == null) == (rejection == null)) {
            throw new IllegalArgumentException("Exactly one of approval or rejection must be present");
        }
    }

    static Authorization approved(Approval approval) {
        return new Authorization(approval, null);
    }

    static Authorization rejected(Rejection rejection) {
        return new Authorization(null, rejection);
    }

    public boolean isApproved() {
        return approval != null;
    }
}

package com.goormthonuniv.citecheck.verify;

/** unverified → pending → {verified, unverified_exhausted} */
public enum VerificationStatus {
    UNVERIFIED,
    PENDING,
    VERIFIED,
    UNVERIFIED_EXHAUSTED;

    public boolean isTerminal() {
        return this == VERIFIED || this == UNVERIFIED_EXHAUSTED;
    }
}

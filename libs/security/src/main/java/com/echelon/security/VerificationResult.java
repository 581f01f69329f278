package com.echelon.security;

/**
 * Outcome of a verification token redemption.
 */
public enum VerificationResult {
    /** Token consumed; tenant is now verified. */
    VERIFIED,
    /** Token unknown, expired, already consumed or issued for another tenant. */
    INVALID_TOKEN
}

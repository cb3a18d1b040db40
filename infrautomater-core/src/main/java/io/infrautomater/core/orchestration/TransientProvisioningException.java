package io.infrautomater.core.orchestration;

/// Store or I/O fault during an attempt.
///
/// The request is left as last durably committed. {@link #isClaimHeld()}
/// tells the retry wrapper whether that state is `provisioning` owned by this
/// job, so the next attempt continues the claim rather than re-claiming.
///
/// The message is already scrubbed of secrets.
public class TransientProvisioningException extends RuntimeException {

    private final boolean claimHeld;

    public TransientProvisioningException(String message, Throwable cause, boolean claimHeld) {
        super(message, cause);
        this.claimHeld = claimHeld;
    }

    public boolean isClaimHeld() {
        return claimHeld;
    }
}

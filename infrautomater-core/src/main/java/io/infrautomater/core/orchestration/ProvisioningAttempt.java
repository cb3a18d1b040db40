package io.infrautomater.core.orchestration;

/// Position of one attempt within a retried provisioning job.
///
/// `claimHeld` is set when an earlier attempt of the same job already moved
/// the request to `provisioning` and still owns it; the attempt then expects
/// that status instead of claiming from `approved`.
///
/// @param number 1-based attempt number
/// @param maxAttempts attempt cap of the job, at least `number`
/// @param claimHeld whether the job already holds the `provisioning` claim
public record ProvisioningAttempt(int number, int maxAttempts, boolean claimHeld) {

    public ProvisioningAttempt {
        if (number < 1) {
            throw new IllegalArgumentException("number must be >= 1");
        }
        if (maxAttempts < number) {
            throw new IllegalArgumentException("maxAttempts must be >= number");
        }
    }

    /// First attempt of a job allowing `maxAttempts` attempts.
    public static ProvisioningAttempt first(int maxAttempts) {
        return new ProvisioningAttempt(1, maxAttempts, false);
    }

    /// A lone attempt with no retries.
    public static ProvisioningAttempt single() {
        return first(1);
    }

    public boolean isFinal() {
        return number >= maxAttempts;
    }

    /// Returns the following attempt.
    ///
    /// @param claimHeld whether the claim carries over
    /// @return next attempt, never null
    /// @throws IllegalStateException if this is the final attempt
    public ProvisioningAttempt next(boolean claimHeld) {
        if (isFinal()) {
            throw new IllegalStateException("No attempts left after " + number + "/" + maxAttempts);
        }
        return new ProvisioningAttempt(number + 1, maxAttempts, claimHeld);
    }

    @Override
    public String toString() {
        return number + "/" + maxAttempts;
    }
}

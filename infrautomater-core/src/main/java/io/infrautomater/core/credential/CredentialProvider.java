package io.infrautomater.core.credential;

import java.util.Optional;

/// Opaque credential lookup consumed by the provisioning core.
///
/// Implementations resolve team-scoped credentials first and fall back to a
/// global default. Storage and encryption are the implementation's concern.
@FunctionalInterface
public interface CredentialProvider {

    /// Resolves credentials for a team.
    ///
    /// @param teamId owning team, may be null for requests without a team
    /// @return credentials, or empty to let the tool use its ambient configuration
    Optional<CloudCredentials> lookup(Long teamId);

    /// Returns a provider that never supplies credentials.
    ///
    /// @return ambient-only provider, never null
    static CredentialProvider none() {
        return teamId -> Optional.empty();
    }
}

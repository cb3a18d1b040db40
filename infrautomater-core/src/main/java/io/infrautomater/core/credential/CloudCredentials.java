package io.infrautomater.core.credential;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Already-decrypted cloud credentials handed to the provisioning tool.
///
/// The core never persists these values. They reach the tool only as process
/// environment variables via {@link #toEnvironment()}, and {@link #toString()}
/// never prints the secret fields.
///
/// @param accessKeyId access key identifier, not null
/// @param secretAccessKey secret key, not null
/// @param sessionToken temporary session token, may be null
/// @param region default region, may be null
public record CloudCredentials(
        String accessKeyId, String secretAccessKey, String sessionToken, String region) {

    public CloudCredentials {
        Objects.requireNonNull(accessKeyId, "accessKeyId must not be null");
        Objects.requireNonNull(secretAccessKey, "secretAccessKey must not be null");
    }

    /// Builds the environment variables the tool's cloud provider reads.
    ///
    /// @return environment entries, never null
    public Map<String, String> toEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AWS_ACCESS_KEY_ID", accessKeyId);
        env.put("AWS_SECRET_ACCESS_KEY", secretAccessKey);
        if (sessionToken != null && !sessionToken.isBlank()) {
            env.put("AWS_SESSION_TOKEN", sessionToken);
        }
        if (region != null && !region.isBlank()) {
            env.put("AWS_REGION", region);
            env.put("AWS_DEFAULT_REGION", region);
        }
        return env;
    }

    /// Returns the values that must never appear in notes or logs.
    ///
    /// @return secret values, never null
    public List<String> secrets() {
        List<String> secrets = new ArrayList<>();
        secrets.add(secretAccessKey);
        if (sessionToken != null && !sessionToken.isBlank()) {
            secrets.add(sessionToken);
        }
        return secrets;
    }

    @Override
    public String toString() {
        return "CloudCredentials[accessKeyId=" + accessKeyId + ", region=" + region + "]";
    }
}

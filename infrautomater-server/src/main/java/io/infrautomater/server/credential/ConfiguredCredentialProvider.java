package io.infrautomater.server.credential;

import io.infrautomater.core.credential.CloudCredentials;
import io.infrautomater.core.credential.CredentialProvider;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// {@link CredentialProvider} backed by already-decrypted values from the
/// server configuration.
///
/// ### Property Layout
/// | Property | Description |
/// |----------|-------------|
/// | `infrautomater.credentials.default.access-key-id` | fallback access key |
/// | `infrautomater.credentials.default.secret-access-key` | fallback secret |
/// | `infrautomater.credentials.default.session-token` | optional |
/// | `infrautomater.credentials.default.region` | optional |
/// | `infrautomater.credentials.team.<teamId>.<field>` | same fields, per team |
///
/// Team entries win over the default. An entry without both an access key
/// and a secret is ignored. Only access key ids and region names are ever
/// logged.
///
/// @implNote Thread-safe. Immutable after construction.
public class ConfiguredCredentialProvider implements CredentialProvider {

    private static final Logger LOG = Logger.getLogger(ConfiguredCredentialProvider.class);

    public static final String PREFIX = "infrautomater.credentials.";

    private static final String DEFAULT_SCOPE = "default";
    private static final String TEAM_SCOPE = "team.";

    private final CloudCredentials defaultCredentials;
    private final Map<Long, CloudCredentials> teamCredentials;

    private ConfiguredCredentialProvider(
            CloudCredentials defaultCredentials, Map<Long, CloudCredentials> teamCredentials) {
        this.defaultCredentials = defaultCredentials;
        this.teamCredentials = Map.copyOf(teamCredentials);
    }

    /// Builds a provider from `infrautomater.credentials.*` properties.
    ///
    /// @param properties property names (with prefix) to values, not null
    /// @return provider, never null
    public static ConfiguredCredentialProvider fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties must not be null");

        Map<String, Map<String, String>> scopes = new HashMap<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String rest = key.substring(PREFIX.length());
            int dot = rest.lastIndexOf('.');
            if (dot <= 0) {
                continue;
            }
            scopes.computeIfAbsent(rest.substring(0, dot), s -> new HashMap<>())
                    .put(rest.substring(dot + 1), entry.getValue());
        }

        CloudCredentials fallback = null;
        Map<Long, CloudCredentials> teams = new HashMap<>();
        for (Map.Entry<String, Map<String, String>> scope : scopes.entrySet()) {
            Optional<CloudCredentials> credentials = toCredentials(scope.getKey(), scope.getValue());
            if (credentials.isEmpty()) {
                continue;
            }
            if (scope.getKey().equals(DEFAULT_SCOPE)) {
                fallback = credentials.get();
            } else if (scope.getKey().startsWith(TEAM_SCOPE)) {
                parseTeamId(scope.getKey().substring(TEAM_SCOPE.length()))
                        .ifPresent(teamId -> teams.put(teamId, credentials.get()));
            } else {
                LOG.warnv("Ignoring unknown credential scope: {0}", scope.getKey());
            }
        }

        LOG.infov(
                "Loaded cloud credentials: default={0}, teams={1}", fallback != null, teams.keySet());
        return new ConfiguredCredentialProvider(fallback, teams);
    }

    @Override
    public Optional<CloudCredentials> lookup(Long teamId) {
        if (teamId != null) {
            CloudCredentials team = teamCredentials.get(teamId);
            if (team != null) {
                return Optional.of(team);
            }
        }
        return Optional.ofNullable(defaultCredentials);
    }

    private static Optional<CloudCredentials> toCredentials(String scope, Map<String, String> fields) {
        String accessKeyId = blankToNull(fields.get("access-key-id"));
        String secret = blankToNull(fields.get("secret-access-key"));
        if (accessKeyId == null || secret == null) {
            LOG.warnv("Ignoring incomplete credentials for scope {0}", scope);
            return Optional.empty();
        }
        return Optional.of(
                new CloudCredentials(
                        accessKeyId,
                        secret,
                        blankToNull(fields.get("session-token")),
                        blankToNull(fields.get("region"))));
    }

    private static Optional<Long> parseTeamId(String raw) {
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            LOG.warnv("Ignoring credentials for non-numeric team id: {0}", raw);
            return Optional.empty();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}

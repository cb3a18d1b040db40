package io.infrautomater.core.orchestration;

import java.util.Locale;

/// Kind of job run by the {@link ProvisioningWorkerPool}.
public enum ProvisioningAction {
    PROVISION,
    DESTROY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}

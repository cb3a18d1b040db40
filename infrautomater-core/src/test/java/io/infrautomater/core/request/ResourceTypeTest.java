package io.infrautomater.core.request;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ResourceTypeTest {

    @Test
    void shouldResolveCanonicalValues() {
        assertThat(ResourceType.fromValue("database")).contains(ResourceType.DATABASE);
        assertThat(ResourceType.fromValue("object_storage")).contains(ResourceType.OBJECT_STORAGE);
        assertThat(ResourceType.fromValue("namespace")).contains(ResourceType.NAMESPACE);
    }

    @Test
    void shouldResolveLegacyAliases() {
        assertThat(ResourceType.fromValue("s3")).contains(ResourceType.OBJECT_STORAGE);
        assertThat(ResourceType.fromValue("K8S_NAMESPACE")).contains(ResourceType.NAMESPACE);
    }

    @Test
    void shouldReturnEmptyForUnknownType() {
        assertThat(ResourceType.fromValue("unknown_type")).isEmpty();
        assertThat(ResourceType.fromValue(null)).isEmpty();
    }

    @Test
    void shouldKeepUnknownRawTypeOnRequest() {
        ResourceRequest request =
                ResourceRequest.builder().id(1).name("x").resourceType("unknown_type").build();

        assertThat(request.resourceType()).isEqualTo("unknown_type");
        assertThat(request.type()).isEmpty();
    }
}

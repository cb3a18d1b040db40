package io.infrautomater.core.generator;

import static org.assertj.core.api.Assertions.assertThat;

import io.infrautomater.core.request.ResourceRequest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AbstractConfigGeneratorTest {

    private static ResourceRequest named(long id, String name) {
        return ResourceRequest.builder().id(id).name(name).resourceType("database").teamId(3L).build();
    }

    @Nested
    class ResourceNameTest {

        @Test
        void shouldLowerCaseAndSuffixWithId() {
            assertThat(AbstractConfigGenerator.resourceName(named(12, "Orders DB"))).isEqualTo("orders-db-12");
        }

        @Test
        void shouldReplaceUnsafeCharacters() {
            assertThat(AbstractConfigGenerator.resourceName(named(1, "a_b.c\"; rm -rf /")))
                    .isEqualTo("a-b-c-rm-rf-1");
        }

        @Test
        void shouldStartWithLetter() {
            assertThat(AbstractConfigGenerator.resourceName(named(4, "2024 data"))).isEqualTo("r-2024-data-4");
            assertThat(AbstractConfigGenerator.resourceName(named(5, "!!!"))).isEqualTo("resource-5");
        }

        @Test
        void shouldCapLengthAndKeepSuffix() {
            String name = AbstractConfigGenerator.resourceName(named(123456, "x".repeat(100)));

            assertThat(name).hasSize(AbstractConfigGenerator.MAX_NAME_LENGTH).endsWith("-123456");
            assertThat(name).matches("[a-z][a-z0-9-]*");
        }
    }

    @Test
    void shouldBuildStandardTags() {
        ResourceRequest request = named(8, "cache");

        assertThat(AbstractConfigGenerator.standardTags(request, "cache-8"))
                .containsEntry("Name", "cache-8")
                .containsEntry("RequestId", "8")
                .containsEntry("TeamId", "3")
                .containsEntry("ManagedBy", "infrautomater");
    }

    @Test
    void shouldTagMissingTeamAsNone() {
        ResourceRequest request = ResourceRequest.builder().id(2).name("x").resourceType("database").build();

        assertThat(AbstractConfigGenerator.standardTags(request, "x-2")).containsEntry("TeamId", "none");
    }
}

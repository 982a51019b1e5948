package club.ppmc.workspace.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;

class WebConfigTest {

    private static class InspectableCorsRegistry extends CorsRegistry {
        Map<String, CorsConfiguration> mappings() {
            return getCorsConfigurations();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "1", "true", "yes", "TRUE"})
    void addCorsMappings_registersApiMappingWheneverTheFlagIsSet(String value) {
        var registry = new InspectableCorsRegistry();

        new WebConfig(value).addCorsMappings(registry);

        assertThat(registry.mappings()).containsOnlyKeys("/api/**");
        assertThat(registry.mappings().get("/api/**").getAllowedOriginPatterns()).containsExactly("*");
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "FALSE", " false "})
    void addCorsMappings_skipsMappingWhenExplicitlyDisabled(String value) {
        var registry = new InspectableCorsRegistry();

        new WebConfig(value).addCorsMappings(registry);

        assertThat(registry.mappings()).isEmpty();
    }

    @Test
    void isPermissive_treatsUnsetAsDisabled() {
        assertThat(WebConfig.isPermissive(null)).isFalse();
    }
}

package tech.yump.logs.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogVariantTest {

    @Test
    @DisplayName("fromFileName: suffix decides the variant")
    void fromFileName_usesSuffix() {
        assertThat(LogVariant.fromFileName("app.log")).isEqualTo(LogVariant.ORIGINAL);
        assertThat(LogVariant.fromFileName("app.log.sanitized")).isEqualTo(LogVariant.SANITIZED);
        assertThat(LogVariant.fromFileName(null)).isEqualTo(LogVariant.ORIGINAL);
    }

    @Test
    @DisplayName("sanitizedNameOf/originalNameOf: map between the two names")
    void names_mapBothWays() {
        assertThat(LogVariant.sanitizedNameOf("app.log")).isEqualTo("app.log.sanitized");
        assertThat(LogVariant.originalNameOf("app.log.sanitized")).isEqualTo("app.log");
        assertThat(LogVariant.originalNameOf("app.log")).isEqualTo("app.log");
    }

    @Test
    @DisplayName("JSON: serialized as the lower-case label")
    void json_usesLabel() throws Exception {
        assertThat(new ObjectMapper().writeValueAsString(LogVariant.SANITIZED)).isEqualTo("\"sanitized\"");
    }
}

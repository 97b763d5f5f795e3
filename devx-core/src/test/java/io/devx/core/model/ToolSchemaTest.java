package io.devx.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ToolSchemaTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldIgnoreKeyOrderInFingerprint() throws Exception {
        ToolSchema a = new ToolSchema("read_file", "Read a file", mapper.readTree("""
            {"type":"object","properties":{"path":{"type":"string"}},"required":["path"]}
            """));
        ToolSchema b = new ToolSchema("read_file", "Read a file", mapper.readTree("""
            {"required":["path"],"properties":{"path":{"type":"string"}},"type":"object"}
            """));

        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
    }

    @Test
    void shouldChangeFingerprintWhenDescriptionChanges() {
        ToolSchema a = new ToolSchema("read_file", "Read a file", null);
        ToolSchema b = new ToolSchema("read_file", "Read a text file", null);

        assertThat(a.fingerprint()).isNotEqualTo(b.fingerprint());
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> new ToolSchema(" ", "x", null)).isInstanceOf(IllegalArgumentException.class);
    }
}

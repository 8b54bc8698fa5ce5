package io.github.drompincen.iterablemcp.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionConfigTest {

    @Test
    void parseEnablesOnlyExactTrue() {
        PermissionConfig config = PermissionConfig.parse("true", "TRUE", "1");

        assertThat(config.allowUserPii()).isTrue();
        assertThat(config.allowWrites()).isFalse();
        assertThat(config.allowSends()).isFalse();
    }

    @Test
    void parseTreatsMissingValuesAsFalse() {
        assertThat(PermissionConfig.parse(null, null, null)).isEqualTo(PermissionConfig.lockedDown());
    }

    @Test
    void parseAllTrue() {
        assertThat(PermissionConfig.parse("true", "true", "true")).isEqualTo(PermissionConfig.fullAccess());
    }

    @Test
    void parseRejectsPaddedValues() {
        PermissionConfig config = PermissionConfig.parse(" true", "true ", "yes");

        assertThat(config).isEqualTo(PermissionConfig.lockedDown());
    }
}

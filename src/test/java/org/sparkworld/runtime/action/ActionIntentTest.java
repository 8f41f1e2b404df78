package org.sparkworld.runtime.action;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
class ActionIntentTest {

    @ParameterizedTest
    @CsvSource({
        "bond-request, BOND_REQUEST",
        "BOND_ACCEPT, BOND_ACCEPT",
        "' Raid ', RAID",
        "request_grant, REQUEST_GRANT",
        "dance, IDLE",
        "'', IDLE"
    })
    void parsesExternalNamesLeniently(String raw, ActionIntent expected) {
        assertThat(ActionIntent.parse(raw)).isEqualTo(expected);
    }
}

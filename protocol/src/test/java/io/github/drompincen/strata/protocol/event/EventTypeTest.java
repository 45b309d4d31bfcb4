package io.github.drompincen.strata.protocol.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeTest {

    @Test
    void knownTagsMapToTheirType() {
        assertThat(EventType.fromWire("ready")).isEqualTo(EventType.READY);
        assertThat(EventType.fromWire("set_text")).isEqualTo(EventType.SET_TEXT);
        assertThat(EventType.fromWire("tool_activity")).isEqualTo(EventType.TOOL_ACTIVITY);
        assertThat(EventType.fromWire("tool_use_summary")).isEqualTo(EventType.TOOL_USE_SUMMARY);
    }

    @Test
    void unknownOrMissingTagsMapToUnknown() {
        assertThat(EventType.fromWire("hologram")).isEqualTo(EventType.UNKNOWN);
        assertThat(EventType.fromWire("")).isEqualTo(EventType.UNKNOWN);
        assertThat(EventType.fromWire(null)).isEqualTo(EventType.UNKNOWN);
    }
}

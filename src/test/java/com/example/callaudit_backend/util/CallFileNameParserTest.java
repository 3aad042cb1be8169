package com.example.callaudit_backend.util;

import com.example.callaudit_backend.model.CallMetadata;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CallFileNameParserTest {

    @Test
    void parsesFourPartNames() {
        CallMetadata metadata = CallFileNameParser.parse(Path.of("/calls/j.smith-2 _ 2024-05-01 10-15 _ 5551234 _ SALE.mp3"));

        assertThat(metadata.agent()).isEqualTo("jsmith2");
        assertThat(metadata.timestamp()).isEqualTo("2024-05-01 10-15");
        assertThat(metadata.phone()).isEqualTo("5551234");
        assertThat(metadata.disposition()).isEqualTo("SALE");
    }

    @Test
    void parsesAgentAndPhoneNames() {
        CallMetadata metadata = CallFileNameParser.parse(Path.of("maria _ 5559876.wav"));

        assertThat(metadata).isEqualTo(new CallMetadata("maria", null, "5559876", null));
    }

    @Test
    void unknownLayoutYieldsEmptyMetadata() {
        assertThat(CallFileNameParser.parse(Path.of("recording-001.mp3"))).isEqualTo(CallMetadata.UNKNOWN);
        assertThat(CallFileNameParser.parse(null)).isEqualTo(CallMetadata.UNKNOWN);
    }
}

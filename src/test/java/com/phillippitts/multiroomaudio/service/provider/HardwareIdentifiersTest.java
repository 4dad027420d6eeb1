package com.phillippitts.multiroomaudio.service.provider;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HardwareIdentifiersTest {

    @Test
    void macIsDerivedFromNameDigest() {
        assertThat(HardwareIdentifiers.generateMac("Kitchen")).isEqualTo("32:FA:00:A6:6F:2E");
        assertThat(HardwareIdentifiers.generateMac("Living Room")).isEqualTo("F6:5B:0E:6A:EC:16");
    }

    @Test
    void macIsStableAndLocallyAdministeredUnicast() {
        String mac = HardwareIdentifiers.generateMac("Office");

        assertThat(HardwareIdentifiers.generateMac("Office")).isEqualTo(mac);
        assertThat(HardwareIdentifiers.isValidMac(mac)).isTrue();
        int firstOctet = Integer.parseInt(mac.substring(0, 2), 16);
        assertThat(firstOctet & 0x02).isEqualTo(0x02);
        assertThat(firstOctet & 0x01).isZero();
    }

    @Test
    void clientIdCombinesSanitizedNameAndHash() {
        assertThat(HardwareIdentifiers.generateClientId("snapcast", "Living Room"))
                .isEqualTo("snapcast-living-room-f45b0e6a");
    }

    @Test
    void clientIdTruncatesLongNames() {
        String id = HardwareIdentifiers.generateClientId("sendspin", "The Very Long Upstairs Guest Bedroom");

        assertThat(id).startsWith("sendspin-the-very-long-upstai-");
        String namePart = id.substring("sendspin-".length(), id.lastIndexOf('-'));
        assertThat(namePart.length()).isLessThanOrEqualTo(20);
        assertThat(namePart).doesNotEndWith("-");
    }

    @Test
    void clientIdWithoutUsableCharactersKeepsOnlyHash() {
        assertThat(HardwareIdentifiers.generateClientId("sendspin", "'''")).matches("sendspin-[0-9a-f]{8}");
    }

    @Test
    void macValidationAcceptsColonAndDashSeparators() {
        assertThat(HardwareIdentifiers.isValidMac("aa:bb:cc:dd:ee:ff")).isTrue();
        assertThat(HardwareIdentifiers.isValidMac("AA-BB-CC-DD-EE-FF")).isTrue();
        assertThat(HardwareIdentifiers.isValidMac("AA:BB:CC:DD:EE")).isFalse();
        assertThat(HardwareIdentifiers.isValidMac("not-a-mac")).isFalse();
        assertThat(HardwareIdentifiers.isValidMac(null)).isFalse();
    }
}

package com.phillippitts.multiroomaudio.service.provider;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Deterministic identifiers derived from a player name, so a player keeps its identity on
 * the server across restarts and re-creation under the same name.
 */
public final class HardwareIdentifiers {

    private static final Pattern MAC = Pattern.compile("^([0-9A-Fa-f]{2}[:-]){5}[0-9A-Fa-f]{2}$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final int CLIENT_ID_NAME_CHARS = 20;
    private static final int CLIENT_ID_HASH_CHARS = 8;

    private HardwareIdentifiers() {
    }

    /**
     * Locally administered unicast MAC built from the first six bytes of the name's MD5,
     * e.g. {@code 1A:2B:3C:4D:5E:6F}.
     */
    public static String generateMac(String name) {
        byte[] digest = DigestUtils.md5Digest(name.getBytes(StandardCharsets.UTF_8));
        // set locally-administered, clear multicast
        digest[0] = (byte) ((digest[0] | 0x02) & 0xFE);
        StringJoiner mac = new StringJoiner(":");
        for (int i = 0; i < 6; i++) {
            mac.add(String.format("%02X", digest[i] & 0xFF));
        }
        return mac.toString();
    }

    /**
     * Client identifier of the form {@code <prefix>-<sanitized-name>-<8 hex chars>}.
     * The sanitized name is lower-case alphanumerics and dashes, at most 20 characters.
     */
    public static String generateClientId(String prefix, String name) {
        String sanitized = NON_ALNUM.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        sanitized = trimDashes(sanitized);
        if (sanitized.length() > CLIENT_ID_NAME_CHARS) {
            sanitized = trimDashes(sanitized.substring(0, CLIENT_ID_NAME_CHARS));
        }
        String hash = DigestUtils.md5DigestAsHex(name.getBytes(StandardCharsets.UTF_8))
                .substring(0, CLIENT_ID_HASH_CHARS);
        return sanitized.isEmpty() ? prefix + "-" + hash : prefix + "-" + sanitized + "-" + hash;
    }

    public static boolean isValidMac(String mac) {
        return mac != null && MAC.matcher(mac).matches();
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}

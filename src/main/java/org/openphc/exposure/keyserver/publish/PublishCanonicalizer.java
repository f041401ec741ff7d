package org.openphc.exposure.keyserver.publish;

import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.domain.model.ExposureKey;
import org.openphc.exposure.keyserver.domain.model.Publish;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the attestation nonce that binds a device attestation to the content of a publish request.
 * <p>
 * Cleartext layout, shared with the attestation verifiers:
 * <pre>
 *   appPackageName|key[,key...]|REGION[,REGION...]|verificationPayload
 * </pre>
 * Each key renders as {@code base64Key.intervalNumber.intervalCount.transmissionRisk}. Keys are ordered
 * by their base64 text, regions are upper-cased and then sorted. Absent fields render as the empty string.
 * The nonce is the standard padded base64 of the SHA-256 of the UTF-8 cleartext.
 */
@Slf4j
public final class PublishCanonicalizer {

    private static final String FIELD_SEPARATOR = "|";
    private static final String LIST_SEPARATOR = ",";
    private static final String KEY_PART_SEPARATOR = ".";

    /**
     * Orders strings by their UTF-8 bytes, compared unsigned.
     */
    static final Comparator<String> UTF8_ORDER = (a, b) -> {
        byte[] x = a.getBytes(StandardCharsets.UTF_8);
        byte[] y = b.getBytes(StandardCharsets.UTF_8);
        int n = Math.min(x.length, y.length);
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(x[i] & 0xff, y[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(x.length, y.length);
    };

    private PublishCanonicalizer() {
    }

    public static String cleartext(Publish publish) {
        List<ExposureKey> sortedKeys = new ArrayList<>(nullToEmpty(publish.getKeys()));
        sortedKeys.sort(Comparator.comparing((ExposureKey k) -> nullToEmpty(k.getKey()), UTF8_ORDER));

        List<String> sortedRegions = nullToEmpty(publish.getRegions()).stream()
                .map(Regions::upcase)
                .sorted(UTF8_ORDER)
                .collect(Collectors.toList());

        String keys = sortedKeys.stream()
                .map(PublishCanonicalizer::renderKey)
                .collect(Collectors.joining(LIST_SEPARATOR));

        return nullToEmpty(publish.getAppPackageName()) + FIELD_SEPARATOR
                + keys + FIELD_SEPARATOR
                + String.join(LIST_SEPARATOR, sortedRegions) + FIELD_SEPARATOR
                + nullToEmpty(publish.getVerificationPayload());
    }

    public static String nonce(Publish publish) {
        byte[] digest = sha256(cleartext(publish));
        String nonce = Base64.getEncoder().encodeToString(digest);
        log.debug("Derived attestation nonce for app={} over {} keys", publish.getAppPackageName(),
                nullToEmpty(publish.getKeys()).size());
        return nonce;
    }

    private static String renderKey(ExposureKey key) {
        return nullToEmpty(key.getKey()) + KEY_PART_SEPARATOR
                + key.getIntervalNumber() + KEY_PART_SEPARATOR
                + key.getIntervalCount() + KEY_PART_SEPARATOR
                + key.getTransmissionRisk();
    }

    private static byte[] sha256(String cleartext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(cleartext.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}

package org.openphc.exposure.keyserver.publish;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Region code normalization shared by the nonce, the stored records and the app allow-list.
 * Upper-casing maps one code point at a time, so the length never changes ({@code ß} stays {@code ß}).
 * A null region is the empty string.
 */
public final class Regions {

    private Regions() {
    }

    public static String upcase(String region) {
        if (region == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(region.length());
        region.codePoints().map(Character::toUpperCase).forEach(sb::appendCodePoint);
        return sb.toString();
    }

    /**
     * Upper-cases every entry, keeping order, duplicates and empty entries.
     */
    public static List<String> upcaseAll(List<String> regions) {
        if (regions == null) {
            return List.of();
        }
        List<String> upcased = new ArrayList<>(regions.size());
        for (String region : regions) {
            upcased.add(upcase(region));
        }
        return Collections.unmodifiableList(upcased);
    }
}

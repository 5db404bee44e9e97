package aforo.pricing.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reversible encoding of pricing versions used as map keys in stored documents.
 * Dots are not allowed in stored keys, so "1.0.0" is kept as "1_0_0".
 *
 * Known limitation: a version that already contains underscores ("1_0_0") and its dotted
 * twin ("1.0.0") map to the same key. Publishing both for one service is not supported.
 */
public final class VersionCodec {

    private VersionCodec() {
    }

    public static String escape(String version) {
        if (version == null) {
            return null;
        }
        return version.replace('.', '_');
    }

    public static String unescape(String escapedVersion) {
        if (escapedVersion == null) {
            return null;
        }
        return escapedVersion.replace('_', '.');
    }

    /**
     * Escapes the values of a service → version map, keeping insertion order and
     * lower-casing service names.
     */
    public static Map<String, String> escapeContractedServices(Map<String, String> contractedServices) {
        Map<String, String> escaped = new LinkedHashMap<>();
        if (contractedServices == null) {
            return escaped;
        }
        contractedServices.forEach((service, version) -> escaped.put(service.toLowerCase(Locale.ROOT), escape(version)));
        return escaped;
    }
}

package io.piddle.distribution.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Content-Type parsing following RFC 2045 token rules.
 *
 * <p>The type and subtype are case-insensitive and returned lower-cased; parameters after
 * {@code ;} are validated but play no part in manifest dispatch.
 */
public final class MediaTypes {
    private MediaTypes() {}

    private static final String TSPECIALS = "()<>@,;:\\\"/[]?=";

    /**
     * A parsed Content-Type value.
     *
     * @param mediaType  lower-cased {@code type/subtype} (or a bare type)
     * @param parameters lower-cased parameter names to their values, in header order
     */
    public record Parsed(String mediaType, Map<String, String> parameters) {
        public Parsed {
            parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }
    }

    /**
     * Returns the bare media type of a Content-Type header. A null or empty header yields the
     * empty string, which is the key of the default manifest schema.
     *
     * @throws DistributionException.MediaTypeParse if the header is malformed
     */
    public static String mediaTypeOf(String header) {
        if (header == null || header.isEmpty()) return "";
        return parse(header).mediaType();
    }

    /**
     * @throws DistributionException.MediaTypeParse if the header is malformed
     */
    public static Parsed parse(String header) {
        if (header == null) {
            throw new DistributionException.MediaTypeParse("", "no media type");
        }
        int semi = header.indexOf(';');
        String base = (semi >= 0 ? header.substring(0, semi) : header).trim().toLowerCase(Locale.ROOT);
        checkType(header, base);

        Map<String, String> params = new LinkedHashMap<>();
        String rest = semi >= 0 ? header.substring(semi) : "";
        while (!rest.isBlank()) {
            rest = rest.stripLeading();
            if (rest.charAt(0) != ';') {
                throw new DistributionException.MediaTypeParse(header, "invalid media parameter");
            }
            rest = rest.substring(1).stripLeading();
            if (rest.isEmpty()) break; // trailing semicolon

            int keyEnd = tokenEnd(rest, 0);
            if (keyEnd == 0 || keyEnd >= rest.length() || rest.charAt(keyEnd) != '=') {
                throw new DistributionException.MediaTypeParse(header, "invalid media parameter");
            }
            String key = rest.substring(0, keyEnd).toLowerCase(Locale.ROOT);
            int valueStart = keyEnd + 1;
            String value;
            int valueEnd;
            if (valueStart < rest.length() && rest.charAt(valueStart) == '"') {
                StringBuilder sb = new StringBuilder();
                int i = valueStart + 1;
                boolean closed = false;
                while (i < rest.length()) {
                    char c = rest.charAt(i);
                    if (c == '\\' && i + 1 < rest.length()) {
                        sb.append(rest.charAt(i + 1));
                        i += 2;
                    } else if (c == '"') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(c);
                        i++;
                    }
                }
                if (!closed) {
                    throw new DistributionException.MediaTypeParse(header, "unterminated quoted parameter value");
                }
                value = sb.toString();
                valueEnd = i;
            } else {
                valueEnd = tokenEnd(rest, valueStart);
                if (valueEnd == valueStart) {
                    throw new DistributionException.MediaTypeParse(header, "invalid media parameter");
                }
                value = rest.substring(valueStart, valueEnd);
            }
            if (params.putIfAbsent(key, value) != null) {
                throw new DistributionException.MediaTypeParse(header, "duplicate parameter name " + key);
            }
            rest = rest.substring(valueEnd);
        }
        return new Parsed(base, params);
    }

    private static void checkType(String header, String base) {
        int typeEnd = tokenEnd(base, 0);
        if (typeEnd == 0) {
            throw new DistributionException.MediaTypeParse(header, "no media type");
        }
        if (typeEnd == base.length()) return; // bare type, e.g. "form-data"
        if (base.charAt(typeEnd) != '/') {
            throw new DistributionException.MediaTypeParse(header, "expected slash after first token");
        }
        int subEnd = tokenEnd(base, typeEnd + 1);
        if (subEnd == typeEnd + 1) {
            throw new DistributionException.MediaTypeParse(header, "expected token after slash");
        }
        if (subEnd != base.length()) {
            throw new DistributionException.MediaTypeParse(header, "unexpected content after media subtype");
        }
    }

    private static int tokenEnd(String s, int from) {
        int i = from;
        while (i < s.length() && isTokenChar(s.charAt(i))) i++;
        return i;
    }

    private static boolean isTokenChar(char c) {
        return c > 0x20 && c < 0x7f && TSPECIALS.indexOf(c) < 0;
    }
}

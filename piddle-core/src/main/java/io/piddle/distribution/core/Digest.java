package io.piddle.distribution.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Content identifier of the form {@code <algorithm>:<hex>}.
 *
 * <p>Instances built from the wire are lenient: any non-empty string is accepted so that a
 * received document can always be decoded. Use {@link #parse(String)} or {@link #validate()}
 * where the format must hold.
 */
public final class Digest implements Comparable<Digest> {

    public static final String SHA256 = "sha256";
    public static final String SHA384 = "sha384";
    public static final String SHA512 = "sha512";

    // algorithm -> {JCA name, hex length}
    private static final Map<String, Algorithm> ALGORITHMS = Map.of(
            SHA256, new Algorithm("SHA-256", 64),
            SHA384, new Algorithm("SHA-384", 96),
            SHA512, new Algorithm("SHA-512", 128));

    private final String value;

    private Digest(String value) {
        this.value = value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Digest of(String value) {
        Objects.requireNonNull(value, "digest");
        if (value.isEmpty()) {
            throw new DistributionException.InvalidDigest(value, "empty");
        }
        return new Digest(value);
    }

    /**
     * Parses and validates a digest string.
     *
     * @throws DistributionException.InvalidDigest if the string is malformed
     */
    public static Digest parse(String value) {
        Digest d = of(value);
        d.validate();
        return d;
    }

    /**
     * Canonical ({@code sha256}) digest of the given bytes.
     */
    public static Digest fromBytes(byte[] content) {
        return fromBytes(SHA256, content);
    }

    public static Digest fromBytes(String algorithm, byte[] content) {
        Objects.requireNonNull(content, "content");
        Algorithm alg = ALGORITHMS.get(algorithm);
        if (alg == null) {
            throw new DistributionException.InvalidDigest(algorithm + ":", "unsupported algorithm");
        }
        return new Digest(algorithm + ":" + HexFormat.of().formatHex(alg.newDigest().digest(content)));
    }

    /**
     * Checks the {@code <algorithm>:<hex>} format against the supported algorithms.
     *
     * @throws DistributionException.InvalidDigest if the value is malformed
     */
    public void validate() {
        int colon = value.indexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new DistributionException.InvalidDigest(value, "expected <algorithm>:<hex>");
        }
        Algorithm alg = ALGORITHMS.get(value.substring(0, colon));
        if (alg == null) {
            throw new DistributionException.InvalidDigest(value, "unsupported algorithm");
        }
        String hex = value.substring(colon + 1);
        if (hex.length() != alg.hexLength) {
            throw new DistributionException.InvalidDigest(value, "expected " + alg.hexLength + " hex characters");
        }
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                throw new DistributionException.InvalidDigest(value, "invalid hex character '" + c + "'");
            }
        }
    }

    /**
     * Recomputes the digest of {@code content} with this digest's algorithm and compares.
     */
    public boolean verifies(byte[] content) {
        validate();
        return equals(fromBytes(algorithm(), content));
    }

    public String algorithm() {
        int colon = value.indexOf(':');
        return colon < 0 ? "" : value.substring(0, colon);
    }

    public String encoded() {
        int colon = value.indexOf(':');
        return colon < 0 ? value : value.substring(colon + 1);
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int compareTo(Digest o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Digest)) return false;
        return value.equals(((Digest) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

    private static final class Algorithm {
        private final String jcaName;
        private final int hexLength;

        private Algorithm(String jcaName, int hexLength) {
            this.jcaName = jcaName;
            this.hexLength = hexLength;
        }

        MessageDigest newDigest() {
            try {
                return MessageDigest.getInstance(jcaName);
            } catch (NoSuchAlgorithmException e) {
                // every JRE ships SHA-256/384/512
                throw new IllegalStateException(jcaName + " not available", e);
            }
        }
    }
}

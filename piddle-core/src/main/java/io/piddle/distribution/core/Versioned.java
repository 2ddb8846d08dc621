package io.piddle.distribution.core;

/**
 * Header shared by every manifest schema: schema version and declared media type.
 */
public record Versioned(int schemaVersion, String mediaType) {
}

package io.piddle.distribution.manifest.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.piddle.distribution.core.DistributionException;

import java.io.IOException;

/**
 * Jackson encoding of {@link ImageIndex}.
 *
 * <p>Encoding is deterministic: fixed property order, map keys sorted, three-space indentation.
 * Decoding ignores unknown fields and rejects trailing content.
 */
final class ImageIndexJson {
    private ImageIndexJson() {}

    private static final String INDENT = "   ";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private static final ObjectWriter WRITER = MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter(INDENT, "\n"))
            .withArrayIndenter(new DefaultIndenter(INDENT, "\n")));

    static byte[] encode(ImageIndex index) {
        try {
            return WRITER.writeValueAsBytes(index);
        } catch (JsonProcessingException e) {
            throw new DistributionException.ManifestInvalid("cannot encode image index: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws DistributionException.ManifestInvalid if the bytes are not an image index document
     */
    static ImageIndex decode(byte[] bytes) {
        try {
            ImageIndex index = MAPPER.readValue(bytes, ImageIndex.class);
            if (index == null) {
                throw new DistributionException.ManifestInvalid("image index must be a JSON object");
            }
            return index;
        } catch (JsonProcessingException e) {
            throw new DistributionException.ManifestInvalid("invalid image index: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DistributionException.ManifestInvalid("invalid image index: " + e.getMessage(), e);
        }
    }
}

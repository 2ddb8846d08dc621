package io.piddle.distribution.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaTypesTest {

    @Test
    void stripsParametersAndLowerCases() {
        assertThat(MediaTypes.mediaTypeOf("application/vnd.x+json; charset=utf-8"))
                .isEqualTo("application/vnd.x+json");
        assertThat(MediaTypes.mediaTypeOf("Application/VND.X+JSON"))
                .isEqualTo("application/vnd.x+json");
    }

    @Test
    void emptyHeaderMapsToDefaultKey() {
        assertThat(MediaTypes.mediaTypeOf(null)).isEmpty();
        assertThat(MediaTypes.mediaTypeOf("")).isEmpty();
    }

    @Test
    void parsesQuotedParameters() {
        MediaTypes.Parsed parsed = MediaTypes.parse("text/plain; Charset=\"utf-8\"; q=\"a\\\"b\"");

        assertThat(parsed.mediaType()).isEqualTo("text/plain");
        assertThat(parsed.parameters()).containsEntry("charset", "utf-8").containsEntry("q", "a\"b");
    }

    @Test
    void rejectsMalformedHeaders() {
        assertThatThrownBy(() -> MediaTypes.mediaTypeOf("   "))
                .isInstanceOf(DistributionException.MediaTypeParse.class)
                .hasMessageContaining("no media type");
        assertThatThrownBy(() -> MediaTypes.mediaTypeOf("application/"))
                .isInstanceOf(DistributionException.MediaTypeParse.class)
                .hasMessageContaining("expected token after slash");
        assertThatThrownBy(() -> MediaTypes.mediaTypeOf("application/json/extra"))
                .isInstanceOf(DistributionException.MediaTypeParse.class);
        assertThatThrownBy(() -> MediaTypes.mediaTypeOf("text/plain; charset"))
                .isInstanceOf(DistributionException.MediaTypeParse.class)
                .hasMessageContaining("invalid media parameter");
        assertThatThrownBy(() -> MediaTypes.mediaTypeOf("text/plain; a=1; A=2"))
                .isInstanceOf(DistributionException.MediaTypeParse.class)
                .hasMessageContaining("duplicate parameter");
    }

    @Test
    void acceptsBareTypeAndTrailingSemicolon() {
        assertThat(MediaTypes.mediaTypeOf("form-data")).isEqualTo("form-data");
        assertThat(MediaTypes.mediaTypeOf("text/plain;")).isEqualTo("text/plain");
    }
}

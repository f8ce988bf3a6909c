package com.example.requestgate.filter;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ClientKeyExtractorTest {

    private final ClientKeyExtractor extractor = new ClientKeyExtractor();

    @Test
    void connectionAddressWins() {
        RequestMetadata metadata = new RequestMetadata("203.0.113.7", "1.2.3.4", "9.9.9.9");

        assertThat(extractor.extractKey(metadata)).isEqualTo("203.0.113.7");
    }

    @Test
    void firstForwardedForEntryBeatsRealIp() {
        RequestMetadata metadata = new RequestMetadata(null, "1.2.3.4, 5.6.7.8", "9.9.9.9");

        assertThat(extractor.extractKey(metadata)).isEqualTo("1.2.3.4");
    }

    @Test
    void forwardedForEntryIsTrimmed() {
        RequestMetadata metadata = new RequestMetadata("", "  1.2.3.4  ,5.6.7.8", null);

        assertThat(extractor.extractKey(metadata)).isEqualTo("1.2.3.4");
    }

    @Test
    void realIpUsedWhenForwardedForMissingOrEmpty() {
        assertThat(extractor.extractKey(new RequestMetadata(null, null, "9.9.9.9"))).isEqualTo("9.9.9.9");
        assertThat(extractor.extractKey(new RequestMetadata(" ", " , 5.6.7.8", "9.9.9.9"))).isEqualTo("9.9.9.9");
    }

    @Test
    void unidentifiableClientsShareFallbackKey() {
        assertThat(extractor.extractKey(new RequestMetadata(null, null, null)))
                .isEqualTo(ClientKeyExtractor.UNKNOWN_CLIENT_KEY)
                .isEqualTo("127.0.0.1");
    }

    @Test
    void metadataIsReadFromServletRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/transfer");
        request.setRemoteAddr("10.0.0.1");
        request.addHeader("X-Forwarded-For", "1.2.3.4");
        request.addHeader("X-Real-IP", "9.9.9.9");

        RequestMetadata metadata = RequestMetadata.from(request);

        assertThat(metadata).isEqualTo(new RequestMetadata("10.0.0.1", "1.2.3.4", "9.9.9.9"));
    }
}

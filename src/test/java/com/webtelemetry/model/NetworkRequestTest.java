package com.webtelemetry.model;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Lifecycle and derived-field tests for NetworkRequest.
 */
public class NetworkRequestTest {

    private NetworkRequest pending(String url) {
        return new NetworkRequest("r1", url, "GET", null, 10.0, "xhr", null, null);
    }

    @Test
    public void extractDomain_keepsPortAndDropsUserInfo() {
        assertThat(NetworkRequest.extractDomain("https://example.com/a?b=c")).isEqualTo("example.com");
        assertThat(NetworkRequest.extractDomain("http://localhost:3000/api")).isEqualTo("localhost:3000");
        assertThat(NetworkRequest.extractDomain("https://user:pw@cdn.example.com/x.js")).isEqualTo("cdn.example.com");
    }

    @Test
    public void extractDomain_unknownForUnparseableOrAuthorityless() {
        assertThat(NetworkRequest.extractDomain(null)).isEqualTo(NetworkRequest.UNKNOWN_DOMAIN);
        assertThat(NetworkRequest.extractDomain("")).isEqualTo(NetworkRequest.UNKNOWN_DOMAIN);
        assertThat(NetworkRequest.extractDomain("about:blank")).isEqualTo(NetworkRequest.UNKNOWN_DOMAIN);
        assertThat(NetworkRequest.extractDomain("not a url at all")).isEqualTo(NetworkRequest.UNKNOWN_DOMAIN);
    }

    @Test
    public void pendingRequest_hasNoDuration() {
        NetworkRequest r = pending("https://a.com/");

        assertThat(r.getState()).isEqualTo(RequestState.PENDING);
        assertThat(r.getDurationMs()).isNull();
        assertThat(r.isSuccessful()).isFalse();
        assertThat(r.isError()).isFalse();
    }

    @Test
    public void complete_setsDurationInMilliseconds() {
        NetworkRequest r = pending("https://a.com/")
            .completed(204, null, 10.75, null, null, NetworkTiming.empty(), false, false);

        assertThat(r.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(r.getDurationMs()).isCloseTo(750.0, within(1e-9));
        assertThat(r.isSuccessful()).isTrue();
    }

    @Test
    public void redirectsAreSuccessfulAndClientErrorsAreErrors() {
        NetworkRequest redirect = pending("https://a.com/").completed(302, null, 11, null, null, null, false, false);
        NetworkRequest notFound = pending("https://a.com/").completed(404, null, 11, null, null, null, false, false);

        assertThat(redirect.isSuccessful()).isTrue();
        assertThat(notFound.isSuccessful()).isFalse();
        assertThat(notFound.isError()).isTrue();
    }

    @Test
    public void secondTransition_isRejected() {
        NetworkRequest r = pending("https://a.com/").failed("net::ERR_FAILED", null, 11);

        assertThat(r.getState()).isEqualTo(RequestState.FAILED);
        assertThat(r.getDurationMs()).as("failed requests are untimed").isNull();
        assertThatThrownBy(() -> r.completed(200, null, 12, null, null, null, false, false))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void transitions_leaveThePendingRequestUntouched() {
        NetworkRequest r = pending("https://a.com/");
        NetworkRequest done = r.completed(200, null, 10.5, 10L, null, null, false, false);

        assertThat(done).isNotSameAs(r);
        assertThat(done.getRequestId()).isEqualTo("r1");
        assertThat(done.getDomain()).isEqualTo("a.com");
        assertThat(r.getState()).isEqualTo(RequestState.PENDING);
        assertThat(r.getResponseStatus()).isNull();
        assertThat(r.failed("late", null, 12).getState()).isEqualTo(RequestState.FAILED);
    }

    @Test
    public void missingFields_getDefaults() {
        NetworkRequest r = new NetworkRequest("r1", null, null, null, 0, null, null, null);

        assertThat(r.getUrl()).isEmpty();
        assertThat(r.getMethod()).isEqualTo("GET");
        assertThat(r.getResourceType()).isEqualTo("other");
        assertThat(r.getDomain()).isEqualTo(NetworkRequest.UNKNOWN_DOMAIN);
    }

    @Test
    public void responseCacheIndicator_acceptsFlagsAndHeaderText() {
        assertThat(ResponseEventData.of(200).isCacheHit()).isFalse();
        assertThat(ResponseEventData.of(200).withDiskCache(true).isCacheHit()).isTrue();
        assertThat(new ResponseEventData(200, null, null, null, "true", null, null, null, null, null)
            .isCacheHit()).isTrue();
        assertThat(new ResponseEventData(200, null, null, null, "served from-cache", null, null, null, null, null)
            .isCacheHit()).isTrue();
        assertThat(new ResponseEventData(200, null, null, null, null, null, true, null, null, null)
            .isCacheHit()).isTrue();
    }
}

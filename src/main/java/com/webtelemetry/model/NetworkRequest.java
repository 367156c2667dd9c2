package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One HTTP exchange observed in the browser.
 *
 * Created PENDING by {@link com.webtelemetry.network.NetworkMonitor#addRequest}. Instances never
 * change: {@link #completed} and {@link #failed} return a new terminal request and leave this
 * one untouched, and only a PENDING request can make either transition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NetworkRequest {

    public static final String UNKNOWN_DOMAIN = "unknown";

    // ── Request ───────────────────────────────────────────────────────────────
    private final String requestId;
    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final double requestTimestamp;
    private final String resourceType;
    private final Map<String, Object> initiator;
    private final String postData;
    private final String domain;

    private final RequestState state;

    // ── Response ──────────────────────────────────────────────────────────────
    private Integer responseStatus;
    private Map<String, String> responseHeaders;
    private Double responseTimestamp;
    private Long size;
    private Long compressedSize;
    private NetworkTiming timing;
    private boolean cacheHit;
    private boolean fromServiceWorker;

    // ── Failure ───────────────────────────────────────────────────────────────
    private String error;
    private String blockedReason;
    private Double failureTimestamp;

    public NetworkRequest(String requestId, String url, String method, Map<String, String> headers,
                          double requestTimestamp, String resourceType,
                          Map<String, Object> initiator, String postData) {
        this.requestId        = requestId;
        this.url              = url != null ? url : "";
        this.method           = method != null ? method : "GET";
        this.headers          = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        this.requestTimestamp = requestTimestamp;
        this.resourceType     = resourceType != null && !resourceType.isBlank() ? resourceType : "other";
        this.initiator        = initiator;
        this.postData         = postData;
        this.domain           = extractDomain(this.url);
        this.state            = RequestState.PENDING;
    }

    private NetworkRequest(NetworkRequest pendingRequest, RequestState state) {
        this.requestId        = pendingRequest.requestId;
        this.url              = pendingRequest.url;
        this.method           = pendingRequest.method;
        this.headers          = pendingRequest.headers;
        this.requestTimestamp = pendingRequest.requestTimestamp;
        this.resourceType     = pendingRequest.resourceType;
        this.initiator        = pendingRequest.initiator;
        this.postData         = pendingRequest.postData;
        this.domain           = pendingRequest.domain;
        this.state            = state;
    }

    // ── Transitions ───────────────────────────────────────────────────────────

    /** @return a COMPLETED copy of this request carrying the response */
    public NetworkRequest completed(int status, Map<String, String> responseHeaders, double responseTimestamp,
                                    Long size, Long compressedSize, NetworkTiming timing,
                                    boolean cacheHit, boolean fromServiceWorker) {
        requirePending();
        NetworkRequest done = new NetworkRequest(this, RequestState.COMPLETED);
        done.responseStatus    = status;
        done.responseHeaders   = responseHeaders != null ? new LinkedHashMap<>(responseHeaders) : new LinkedHashMap<>();
        done.responseTimestamp = responseTimestamp;
        done.size              = size;
        done.compressedSize    = compressedSize;
        done.timing            = timing;
        done.cacheHit          = cacheHit;
        done.fromServiceWorker = fromServiceWorker;
        return done;
    }

    /** @return a FAILED copy of this request */
    public NetworkRequest failed(String error, String blockedReason, double failureTimestamp) {
        requirePending();
        NetworkRequest done = new NetworkRequest(this, RequestState.FAILED);
        done.error            = error != null ? error : "unknown error";
        done.blockedReason    = blockedReason;
        done.failureTimestamp = failureTimestamp;
        return done;
    }

    private void requirePending() {
        if (state != RequestState.PENDING) {
            throw new IllegalStateException("Request " + requestId + " already " + state);
        }
    }

    // ── Derived ───────────────────────────────────────────────────────────────

    /** Response latency in milliseconds; null while pending and for failed requests. */
    public Double getDurationMs() {
        if (responseTimestamp == null) return null;
        return Math.max(0.0, (responseTimestamp - requestTimestamp) * 1000.0);
    }

    @JsonIgnore
    public boolean hasDuration() { return responseTimestamp != null; }

    public boolean isSuccessful() {
        return responseStatus != null && responseStatus >= 200 && responseStatus < 400;
    }

    public boolean isError() {
        return error != null || (responseStatus != null && responseStatus >= 400);
    }

    public boolean isBlocked() {
        return blockedReason != null && !blockedReason.isBlank();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getRequestId()                { return requestId; }
    public String getUrl()                      { return url; }
    public String getMethod()                   { return method; }
    public Map<String, String> getHeaders()     { return Collections.unmodifiableMap(headers); }
    public double getRequestTimestamp()         { return requestTimestamp; }
    public String getResourceType()             { return resourceType; }
    public Map<String, Object> getInitiator()   { return initiator != null ? Collections.unmodifiableMap(initiator) : null; }
    public String getPostData()                 { return postData; }
    public String getDomain()                   { return domain; }
    public RequestState getState()              { return state; }
    public Integer getResponseStatus()          { return responseStatus; }
    public Map<String, String> getResponseHeaders() {
        return responseHeaders != null ? Collections.unmodifiableMap(responseHeaders) : null;
    }
    public Double getResponseTimestamp()        { return responseTimestamp; }
    public Long getSize()                       { return size; }
    public Long getCompressedSize()             { return compressedSize; }
    public NetworkTiming getTiming()            { return timing; }
    public boolean isCacheHit()                 { return cacheHit; }
    public boolean isFromServiceWorker()        { return fromServiceWorker; }
    public String getError()                    { return error; }
    public String getBlockedReason()            { return blockedReason; }
    public Double getFailureTimestamp()         { return failureTimestamp; }

    @Override
    public String toString() {
        return String.format("NetworkRequest{id=%s, %s %s, state=%s, status=%s}",
            requestId, method, url, state, responseStatus);
    }

    /**
     * host[:port] of the URL, without user info. Returns "unknown" for URLs that
     * do not parse or carry no authority (data:, about:blank).
     */
    public static String extractDomain(String url) {
        if (url == null || url.isBlank()) return UNKNOWN_DOMAIN;
        try {
            URI uri = new URI(url.trim());
            String host = uri.getHost();
            if (host == null) {
                String authority = uri.getRawAuthority();
                if (authority == null || authority.isBlank()) return UNKNOWN_DOMAIN;
                int at = authority.lastIndexOf('@');
                return at >= 0 ? authority.substring(at + 1) : authority;
            }
            return uri.getPort() >= 0 ? host + ":" + uri.getPort() : host;
        } catch (Exception e) {
            return UNKNOWN_DOMAIN;
        }
    }
}

package com.phantom.gateway.hook;

import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.Map;

/**
 * Request part of a {@link HookObject}: inbound headers, headers to set on the
 * upstream request, and the override used to answer the client directly.
 */
public class HookRequest {

    private final Map<String, String> headers = new LinkedCaseInsensitiveMap<>();
    private final Map<String, String> setHeaders = new LinkedCaseInsensitiveMap<>();
    private ReturnOverrides returnOverrides;

    /**
     * Inbound header value, matched case-insensitively
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() { return headers; }
    public Map<String, String> getSetHeaders() { return setHeaders; }
    public ReturnOverrides getReturnOverrides() { return returnOverrides; }
    public void setReturnOverrides(ReturnOverrides returnOverrides) { this.returnOverrides = returnOverrides; }
}

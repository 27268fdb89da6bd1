package com.phantom.gateway.hook;

import java.util.HashMap;
import java.util.Map;

/**
 * Short-circuit response. A positive {@code responseCode} means the gateway
 * answers the client with this response instead of calling upstream.
 */
public class ReturnOverrides {

    private int responseCode;
    private String responseBody;
    private String responseError;
    private boolean overrideError;
    private Map<String, String> headers = new HashMap<>();

    public int getResponseCode() { return responseCode; }
    public void setResponseCode(int responseCode) { this.responseCode = responseCode; }
    public String getResponseBody() { return responseBody; }
    public void setResponseBody(String responseBody) { this.responseBody = responseBody; }
    public String getResponseError() { return responseError; }
    public void setResponseError(String responseError) { this.responseError = responseError; }
    public boolean isOverrideError() { return overrideError; }
    public void setOverrideError(boolean overrideError) { this.overrideError = overrideError; }
    public Map<String, String> getHeaders() { return headers; }
    public void setHeaders(Map<String, String> headers) { this.headers = headers; }
}

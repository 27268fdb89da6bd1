package com.phantom.gateway.hook;

import java.util.HashMap;
import java.util.Map;

/**
 * Hook Object
 *
 * <p>Per-request record passed through the phantom token hooks. The
 * dispatcher reads the inbound request headers and writes metadata, session
 * state, upstream headers or a short-circuit override.
 */
public class HookObject {

    private String hookName;
    private HookRequest request = new HookRequest();
    private Map<String, String> metadata = new HashMap<>();
    private SessionState session;

    public HookObject() {
    }

    public HookObject(String hookName, HookRequest request) {
        this.hookName = hookName;
        this.request = request;
    }

    /**
     * True once a hook has short-circuited this request
     */
    public boolean isShortCircuited() {
        return request != null && request.getReturnOverrides() != null
            && request.getReturnOverrides().getResponseCode() > 0;
    }

    public String getHookName() { return hookName; }
    public void setHookName(String hookName) { this.hookName = hookName; }
    public HookRequest getRequest() { return request; }
    public void setRequest(HookRequest request) { this.request = request; }
    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
    public SessionState getSession() { return session; }
    public void setSession(SessionState session) { this.session = session; }
}

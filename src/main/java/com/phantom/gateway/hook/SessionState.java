package com.phantom.gateway.hook;

/**
 * Session rate and quota fields of a {@link HookObject}.
 */
public class SessionState {

    /** Quota value meaning "unlimited" */
    public static final long UNLIMITED = -1;

    private double rate;
    private double per;
    private long quotaMax;
    private long quotaRemaining;
    private long quotaRenewalRate;
    private String lastUpdated;
    private long idExtractorDeadline;

    /**
     * Disable gateway-side rate limiting and quotas for this session.
     */
    public void resetToUnlimited() {
        rate = 0;
        per = 0;
        quotaMax = UNLIMITED;
        quotaRemaining = UNLIMITED;
        quotaRenewalRate = 0;
        lastUpdated = "";
        idExtractorDeadline = 0;
    }

    public double getRate() { return rate; }
    public void setRate(double rate) { this.rate = rate; }
    public double getPer() { return per; }
    public void setPer(double per) { this.per = per; }
    public long getQuotaMax() { return quotaMax; }
    public void setQuotaMax(long quotaMax) { this.quotaMax = quotaMax; }
    public long getQuotaRemaining() { return quotaRemaining; }
    public void setQuotaRemaining(long quotaRemaining) { this.quotaRemaining = quotaRemaining; }
    public long getQuotaRenewalRate() { return quotaRenewalRate; }
    public void setQuotaRenewalRate(long quotaRenewalRate) { this.quotaRenewalRate = quotaRenewalRate; }
    public String getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(String lastUpdated) { this.lastUpdated = lastUpdated; }
    public long getIdExtractorDeadline() { return idExtractorDeadline; }
    public void setIdExtractorDeadline(long idExtractorDeadline) { this.idExtractorDeadline = idExtractorDeadline; }
}

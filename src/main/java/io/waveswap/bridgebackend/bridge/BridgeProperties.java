package io.waveswap.bridgebackend.bridge;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.bridge")
public class BridgeProperties {
  private boolean enabled = true;
  private boolean metricsEnabled = true;

  /** Chain name (e.g. {@code SOLANA}) to address regex; overrides the built-in table. */
  private Map<String, String> addressPatterns = new LinkedHashMap<>();

  private Quote quote = new Quote();
  private Monitor monitor = new Monitor();
  private NearIntents nearIntents = new NearIntents();
  private StarkGate starkgate = new StarkGate();
  private Defuse defuse = new Defuse();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public Map<String, String> getAddressPatterns() {
    return addressPatterns;
  }

  public void setAddressPatterns(Map<String, String> addressPatterns) {
    this.addressPatterns = addressPatterns == null ? new LinkedHashMap<>() : addressPatterns;
  }

  public Quote getQuote() {
    return quote;
  }

  public void setQuote(Quote quote) {
    this.quote = quote;
  }

  public Monitor getMonitor() {
    return monitor;
  }

  public void setMonitor(Monitor monitor) {
    this.monitor = monitor;
  }

  public NearIntents getNearIntents() {
    return nearIntents;
  }

  public void setNearIntents(NearIntents nearIntents) {
    this.nearIntents = nearIntents;
  }

  public StarkGate getStarkgate() {
    return starkgate;
  }

  public void setStarkgate(StarkGate starkgate) {
    this.starkgate = starkgate;
  }

  public Defuse getDefuse() {
    return defuse;
  }

  public void setDefuse(Defuse defuse) {
    this.defuse = defuse;
  }

  public static class Quote {
    private int defaultSlippageBps = 50;
    private int defaultDeadlineSeconds = 1200;
    private int maxRetries = 2;
    private long retryBackoffMs = 300;
    private long storeTtlPaddingSeconds = 60;

    public int getDefaultSlippageBps() {
      return defaultSlippageBps;
    }

    public void setDefaultSlippageBps(int defaultSlippageBps) {
      this.defaultSlippageBps = defaultSlippageBps;
    }

    public int getDefaultDeadlineSeconds() {
      return defaultDeadlineSeconds;
    }

    public void setDefaultDeadlineSeconds(int defaultDeadlineSeconds) {
      this.defaultDeadlineSeconds = defaultDeadlineSeconds;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMs() {
      return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
      this.retryBackoffMs = retryBackoffMs;
    }

    public long getStoreTtlPaddingSeconds() {
      return storeTtlPaddingSeconds;
    }

    public void setStoreTtlPaddingSeconds(long storeTtlPaddingSeconds) {
      this.storeTtlPaddingSeconds = storeTtlPaddingSeconds;
    }
  }

  public static class Monitor {
    private long pollIntervalMs = 3000;
    private int maxAttempts = 40;

    public long getPollIntervalMs() {
      return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }
  }

  public static class NearIntents {
    private String apiBaseUrl = "https://1click.chaindefuser.com/v0";
    private String jwt = "";
    private long timeoutMs = 12000;

    public String getApiBaseUrl() {
      return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
      this.apiBaseUrl = apiBaseUrl;
    }

    public String getJwt() {
      return jwt;
    }

    public void setJwt(String jwt) {
      this.jwt = jwt;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class StarkGate {
    private String apiBaseUrl = "https://starkgate-api.starknet.io";
    private long timeoutMs = 12000;

    public String getApiBaseUrl() {
      return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
      this.apiBaseUrl = apiBaseUrl;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class Defuse {
    private String solverRelayUrl = "https://solver-relay-v2.chaindefuser.com/rpc";
    private String verifierContract = "intents.near";
    private int feeBps = 10;
    private long timeoutMs = 12000;

    public String getSolverRelayUrl() {
      return solverRelayUrl;
    }

    public void setSolverRelayUrl(String solverRelayUrl) {
      this.solverRelayUrl = solverRelayUrl;
    }

    public String getVerifierContract() {
      return verifierContract;
    }

    public void setVerifierContract(String verifierContract) {
      this.verifierContract = verifierContract;
    }

    public int getFeeBps() {
      return feeBps;
    }

    public void setFeeBps(int feeBps) {
      this.feeBps = feeBps;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }
}

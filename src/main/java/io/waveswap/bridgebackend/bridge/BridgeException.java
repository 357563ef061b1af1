package io.waveswap.bridgebackend.bridge;

import java.util.LinkedHashMap;
import java.util.Map;

public class BridgeException extends RuntimeException {
  private final BridgeErrorCode code;
  private final Map<String, Object> details;

  public BridgeException(BridgeErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public BridgeException(BridgeErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public BridgeException(
      BridgeErrorCode code, String message, Map<String, Object> details, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.details = details == null ? Map.of() : Map.copyOf(details);
  }

  /** Returns a copy carrying one more context entry (quote id, provider, step). */
  public BridgeException with(String key, Object value) {
    if (key == null || value == null) return this;
    Map<String, Object> merged = new LinkedHashMap<>(details);
    merged.put(key, value);
    BridgeException copy = new BridgeException(code, getMessage(), merged, getCause());
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  public BridgeErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return code.httpStatus();
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}

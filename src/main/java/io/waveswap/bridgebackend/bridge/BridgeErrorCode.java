package io.waveswap.bridgebackend.bridge;

public enum BridgeErrorCode {
  INVALID_ROUTE(400),
  INVALID_AMOUNT(400),
  INVALID_QUOTE(400),
  INVALID_ADDRESS_FORMAT(400),
  TOKEN_NOT_SUPPORTED(400),
  NO_PROVIDER_FOR_ROUTE(422),
  QUOTE_PROVIDER_UNAVAILABLE(502),
  QUOTE_REJECTED(422),
  INSUFFICIENT_LIQUIDITY(422),
  QUOTE_EXPIRED(410),
  QUOTE_NOT_FOUND(404),
  DEPOSIT_FAILED(502),
  SETTLEMENT_FAILED(502),
  BRIDGE_MONITORING_TIMEOUT(504),
  MONITORING_CANCELLED(499),
  BRIDGE_DISABLED(503);

  private final int httpStatus;

  BridgeErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}

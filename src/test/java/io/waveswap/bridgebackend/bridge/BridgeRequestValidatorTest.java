package io.waveswap.bridgebackend.bridge;

import static io.waveswap.bridgebackend.bridge.BridgeFixtures.NEAR_ADDRESS;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.SOLANA_ADDRESS;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.SOL_SOLANA;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.STARKNET_ADDRESS;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.USDC_NEAR;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.USDC_SOLANA;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.ZEC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeSupport;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BridgeRequestValidatorTest {
  private final BridgeRequestValidator validator =
      new BridgeRequestValidator(
          new CapabilityRegistry(List.of(SOL_SOLANA, USDC_SOLANA, USDC_NEAR, ZEC)), new AddressFormatTable(Map.of()));

  @Test
  void acceptsWellFormedRequest() {
    BridgeRequestValidator.ValidatedRequest request =
        validator.validate(SOL_SOLANA, USDC_NEAR, "1.5", new BridgeOptions(100, 600, NEAR_ADDRESS, SOLANA_ADDRESS));

    assertEquals(new BigInteger("1500000000"), request.amountBaseUnits());
    assertEquals(ChainId.NEAR, request.route().destinationChain());
  }

  @Test
  void verdictsAreIdempotent() {
    BridgeOptions good = new BridgeOptions(null, null, NEAR_ADDRESS, SOLANA_ADDRESS);
    BridgeOptions badRecipient = new BridgeOptions(null, null, SOLANA_ADDRESS, null);
    for (int i = 0; i < 3; i++) {
      assertEquals(
          validator.validate(SOL_SOLANA, USDC_NEAR, "2", good), validator.validate(SOL_SOLANA, USDC_NEAR, "2", good));
      BridgeException e =
          assertThrows(BridgeException.class, () -> validator.validate(SOL_SOLANA, USDC_NEAR, "2", badRecipient));
      assertEquals(BridgeErrorCode.INVALID_ADDRESS_FORMAT, e.getCode());
      assertTrue(validator.isValidAddress(ChainId.STARKNET, STARKNET_ADDRESS));
      assertFalse(validator.isValidAddress(ChainId.STARKNET, "0x1234"));
    }
  }

  @Test
  void recipientIsCheckedAgainstDestinationAndRefundAgainstOrigin() {
    BridgeException e =
        assertThrows(
            BridgeException.class,
            () -> validator.validate(SOL_SOLANA, USDC_NEAR, "1", new BridgeOptions(null, null, NEAR_ADDRESS, NEAR_ADDRESS)));
    assertEquals(BridgeErrorCode.INVALID_ADDRESS_FORMAT, e.getCode());
    assertTrue(e.getMessage().contains("refundAddress"));
  }

  @Test
  void rejectsSameChainEmptyAddressAndUnsupportedPair() {
    assertEquals(
        BridgeErrorCode.INVALID_ROUTE,
        assertThrows(BridgeException.class, () -> validator.validateRoute(SOL_SOLANA, USDC_SOLANA)).getCode());

    CrossChainToken blank = new CrossChainToken("X", "X", " ", 6, ChainId.NEAR, null, BridgeSupport.none());
    assertEquals(
        BridgeErrorCode.TOKEN_NOT_SUPPORTED,
        assertThrows(BridgeException.class, () -> validator.validateRoute(SOL_SOLANA, blank)).getCode());
    assertEquals(
        BridgeErrorCode.TOKEN_NOT_SUPPORTED,
        assertThrows(BridgeException.class, () -> validator.validateRoute(null, USDC_NEAR)).getCode());

    CrossChainToken bare = new CrossChainToken("B", "Bare", "bare.near", 6, ChainId.NEAR, null, BridgeSupport.none());
    assertEquals(
        BridgeErrorCode.NO_PROVIDER_FOR_ROUTE,
        assertThrows(BridgeException.class, () -> validator.validateRoute(ZEC, bare)).getCode());
  }

  @Test
  void amountPrecisionFollowsOriginToken() {
    assertEquals(
        BridgeErrorCode.INVALID_AMOUNT,
        assertThrows(BridgeException.class, () -> validator.validate(USDC_NEAR, SOL_SOLANA, "0.0000001", null)).getCode());
    assertEquals(
        BridgeErrorCode.INVALID_AMOUNT,
        assertThrows(BridgeException.class, () -> validator.validate(SOL_SOLANA, USDC_NEAR, "0", null)).getCode());
    assertEquals(
        BridgeErrorCode.INVALID_AMOUNT,
        assertThrows(BridgeException.class, () -> validator.validate(SOL_SOLANA, USDC_NEAR, "1e999999999", null))
            .getCode());
  }

  @Test
  void addressTableDefaultsAndOverrides() {
    AddressFormatTable defaults = new AddressFormatTable(Map.of());
    assertTrue(defaults.isValid(ChainId.SOLANA, SOLANA_ADDRESS));
    assertTrue(defaults.isValid(ChainId.NEAR, "bob.near"));
    assertTrue(defaults.isValid(ChainId.NEAR, "a".repeat(64)));
    assertTrue(defaults.isValid(ChainId.ZCASH, "t1Zz3aBcDeFgH2jKLmNpQrStUvWxYz1a2b3"));
    assertFalse(defaults.isValid(ChainId.SOLANA, "0OIl" + "1".repeat(40)));
    assertFalse(defaults.isValid(ChainId.NEAR, "bob.testnet"));
    assertFalse(defaults.isValid(ChainId.SOLANA, null));

    AddressFormatTable overridden = new AddressFormatTable(Map.of("near", "^[a-z]+\\.testnet$"));
    assertTrue(overridden.isValid(ChainId.NEAR, "bob.testnet"));
    assertFalse(overridden.isValid(ChainId.NEAR, "bob.near"));
    assertThrows(IllegalStateException.class, () -> new AddressFormatTable(Map.of("dogecoin", ".*")));
  }
}

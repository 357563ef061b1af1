package io.waveswap.bridgebackend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.waveswap.bridgebackend.bridge.CapabilityRegistry;
import io.waveswap.bridgebackend.model.bridge.BridgeSupport;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import java.util.HashSet;
import org.junit.jupiter.api.Test;

class BridgeTokenCatalogTest {

  @Test
  void tokenIdentityIsUniquePerChain() {
    assertEquals(BridgeTokenCatalog.TOKENS.size(), new HashSet<>(BridgeTokenCatalog.TOKENS).size());
  }

  @Test
  void knownAssetIdWins() {
    CrossChainToken sol = BridgeTokenCatalog.TOKENS.get(0);
    assertEquals("nep141:sol.omft.near", BridgeTokenCatalog.assetIdFor(sol));
  }

  @Test
  void derivesAssetIdFromChainAndAddress() {
    CrossChainToken spl = new CrossChainToken("X", "X", "Mint111", 6, ChainId.SOLANA, null, BridgeSupport.none());
    CrossChainToken stark = new CrossChainToken("Y", "Y", "0xabc", 18, ChainId.STARKNET, " ", BridgeSupport.none());
    assertEquals("1cs_v1:solana:spl:Mint111", BridgeTokenCatalog.assetIdFor(spl));
    assertEquals("1cs_v1:starknet:token:0xabc", BridgeTokenCatalog.assetIdFor(stark));
  }

  @Test
  void nativeBridgeFlagFollowsTheChain() {
    CapabilityRegistry registry = new CapabilityRegistry();
    for (CrossChainToken token : BridgeTokenCatalog.TOKENS) {
      assertEquals(token.chain().hasNativeBridge(), token.supports(ProviderId.STARKGATE), token.toString());
      assertEquals(token.supports(ProviderId.STARKGATE), registry.isSupported(token, ProviderId.STARKGATE), token.toString());
    }
  }
}

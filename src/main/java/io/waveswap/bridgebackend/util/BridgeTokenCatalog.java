package io.waveswap.bridgebackend.util;

import io.waveswap.bridgebackend.model.bridge.BridgeSupport;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import java.util.List;

public final class BridgeTokenCatalog {
  private BridgeTokenCatalog() {}

  // Default table served by the capability registry (extend as needed).
  public static final List<CrossChainToken> TOKENS =
      List.of(
          token("SOL", "Solana", "So11111111111111111111111111111111111111112", 9, ChainId.SOLANA,
              "nep141:sol.omft.near", true, true),
          token("USDC", "USD Coin", "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", 6, ChainId.SOLANA,
              "nep141:sol-5ce3bf3a31af18be40ba30f721101b4341690186.omft.near", true, true),
          token("USDT", "Tether USD", "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB", 6, ChainId.SOLANA,
              "nep141:sol-c800a4bd850783ccb82c2b2c7e84175443606352.omft.near", true, true),
          token("wNEAR", "Wrapped NEAR", "wrap.near", 24, ChainId.NEAR, "nep141:wrap.near", true, true),
          token("USDC", "USD Coin", "17208628f84f5d6ad33f0da3bbbeb27ffcb398eac501a31bd6ad2011e36133a1", 6,
              ChainId.NEAR, "nep141:17208628f84f5d6ad33f0da3bbbeb27ffcb398eac501a31bd6ad2011e36133a1", true, true),
          token("USDT", "Tether USD", "usdt.tether-token.near", 6, ChainId.NEAR,
              "nep141:usdt.tether-token.near", true, true),
          token("ETH", "Ethereum", "aurora", 18, ChainId.NEAR, "nep141:aurora", false, true),
          token("ZEC", "Zcash", "zec", 8, ChainId.ZCASH, "nep141:zec.omft.near", true, false),
          token("ETH", "Ethereum", "0x049d36570d4e46f48e99674bd3fcc84644ddd6b96f7c741b1562b82f9e004dc7", 18,
              ChainId.STARKNET, null, false, false),
          token("USDC", "USD Coin", "0x053c91253bc9682c04929ca02ed00b3e423f6710d2ee7e0d5ebb06f3ecf368a8", 6,
              ChainId.STARKNET, null, false, false),
          token("USDT", "Tether USD", "0x068f5c6a61780768455de69077e07e89787839bf8166decfbf92b645209c0fb8", 6,
              ChainId.STARKNET, null, false, false));

  /** The starkgate flag is not listed per token: it follows the chain, as the registry routes by chain pair. */
  private static CrossChainToken token(
      String symbol,
      String name,
      String address,
      int decimals,
      ChainId chain,
      String assetId,
      boolean nearIntents,
      boolean defuse) {
    return new CrossChainToken(
        symbol, name, address, decimals, chain, assetId, new BridgeSupport(nearIntents, chain.hasNativeBridge(), defuse));
  }

  /** Provider-facing asset identifier; derived from chain and address when the token has none. */
  public static String assetIdFor(CrossChainToken token) {
    if (token.assetId() != null && !token.assetId().isBlank()) return token.assetId();
    return switch (token.chain()) {
      case SOLANA -> "1cs_v1:solana:spl:" + token.address();
      case NEAR -> "1cs_v1:near:nep141:" + token.address();
      default -> "1cs_v1:" + token.chain().key() + ":token:" + token.address();
    };
  }
}

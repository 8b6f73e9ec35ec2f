package com.dollarstore.exchangeapi.config;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exchange")
public class ExchangeProperties {
  private String custodyAccount = "exchange-custody";
  private String founderAccount = "founder";
  private boolean faucetEnabled = true;
  private TokenSpec syntheticToken = new TokenSpec("DLRS", 18);
  private TokenSpec rewardToken = new TokenSpec("CENTS", 6);
  private List<AssetSpec> assets =
      new ArrayList<>(List.of(new AssetSpec("USDC", 6, true), new AssetSpec("USDT", 6, true)));
  private Staking staking = new Staking();
  private Emission emission = new Emission();

  public String getCustodyAccount() {
    return custodyAccount;
  }

  public void setCustodyAccount(String custodyAccount) {
    this.custodyAccount = custodyAccount;
  }

  public String getFounderAccount() {
    return founderAccount;
  }

  public void setFounderAccount(String founderAccount) {
    this.founderAccount = founderAccount;
  }

  public boolean isFaucetEnabled() {
    return faucetEnabled;
  }

  public void setFaucetEnabled(boolean faucetEnabled) {
    this.faucetEnabled = faucetEnabled;
  }

  public TokenSpec getSyntheticToken() {
    return syntheticToken;
  }

  public void setSyntheticToken(TokenSpec syntheticToken) {
    this.syntheticToken = syntheticToken;
  }

  public TokenSpec getRewardToken() {
    return rewardToken;
  }

  public void setRewardToken(TokenSpec rewardToken) {
    this.rewardToken = rewardToken;
  }

  public List<AssetSpec> getAssets() {
    return assets;
  }

  public void setAssets(List<AssetSpec> assets) {
    this.assets = assets;
  }

  public Staking getStaking() {
    return staking;
  }

  public void setStaking(Staking staking) {
    this.staking = staking;
  }

  public Emission getEmission() {
    return emission;
  }

  public void setEmission(Emission emission) {
    this.emission = emission;
  }

  public static class TokenSpec {
    private String symbol;
    private int decimals;

    public TokenSpec() {}

    public TokenSpec(String symbol, int decimals) {
      this.symbol = symbol;
      this.decimals = decimals;
    }

    public String getSymbol() {
      return symbol;
    }

    public void setSymbol(String symbol) {
      this.symbol = symbol;
    }

    public int getDecimals() {
      return decimals;
    }

    public void setDecimals(int decimals) {
      this.decimals = decimals;
    }
  }

  public static class AssetSpec extends TokenSpec {
    private boolean supported = true;

    public AssetSpec() {}

    public AssetSpec(String symbol, int decimals, boolean supported) {
      super(symbol, decimals);
      this.supported = supported;
    }

    public boolean isSupported() {
      return supported;
    }

    public void setSupported(boolean supported) {
      this.supported = supported;
    }
  }

  public static class Staking {
    private Duration fullPowerDuration = Duration.ofDays(30);
    private Duration unstakeCooldown = Duration.ofDays(7);
    private int feeFreeCapMultiplierBps = 10_000;

    public Duration getFullPowerDuration() {
      return fullPowerDuration;
    }

    public void setFullPowerDuration(Duration fullPowerDuration) {
      this.fullPowerDuration = fullPowerDuration;
    }

    public Duration getUnstakeCooldown() {
      return unstakeCooldown;
    }

    public void setUnstakeCooldown(Duration unstakeCooldown) {
      this.unstakeCooldown = unstakeCooldown;
    }

    public int getFeeFreeCapMultiplierBps() {
      return feeFreeCapMultiplierBps;
    }

    public void setFeeFreeCapMultiplierBps(int feeFreeCapMultiplierBps) {
      this.feeFreeCapMultiplierBps = feeFreeCapMultiplierBps;
    }
  }

  /** Caps are in reward token base units. */
  public static class Emission {
    private BigInteger makerCap = BigInteger.valueOf(600_000_000L).multiply(BigInteger.TEN.pow(6));
    private BigInteger takerCap = BigInteger.valueOf(200_000_000L).multiply(BigInteger.TEN.pow(6));
    private BigInteger founderCap =
        BigInteger.valueOf(200_000_000L).multiply(BigInteger.TEN.pow(6));
    private int makerAprBps = 800;
    private int takerFeeBps = 1;
    private BigInteger rewardUnitsPerDollar = BigInteger.valueOf(100_000_000L);
    private int founderShareDivisor = 4;

    public BigInteger getMakerCap() {
      return makerCap;
    }

    public void setMakerCap(BigInteger makerCap) {
      this.makerCap = makerCap;
    }

    public BigInteger getTakerCap() {
      return takerCap;
    }

    public void setTakerCap(BigInteger takerCap) {
      this.takerCap = takerCap;
    }

    public BigInteger getFounderCap() {
      return founderCap;
    }

    public void setFounderCap(BigInteger founderCap) {
      this.founderCap = founderCap;
    }

    public int getMakerAprBps() {
      return makerAprBps;
    }

    public void setMakerAprBps(int makerAprBps) {
      this.makerAprBps = makerAprBps;
    }

    public int getTakerFeeBps() {
      return takerFeeBps;
    }

    public void setTakerFeeBps(int takerFeeBps) {
      this.takerFeeBps = takerFeeBps;
    }

    public BigInteger getRewardUnitsPerDollar() {
      return rewardUnitsPerDollar;
    }

    public void setRewardUnitsPerDollar(BigInteger rewardUnitsPerDollar) {
      this.rewardUnitsPerDollar = rewardUnitsPerDollar;
    }

    public int getFounderShareDivisor() {
      return founderShareDivisor;
    }

    public void setFounderShareDivisor(int founderShareDivisor) {
      this.founderShareDivisor = founderShareDivisor;
    }
  }
}

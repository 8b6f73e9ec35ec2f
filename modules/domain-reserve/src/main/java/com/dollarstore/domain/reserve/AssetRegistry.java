package com.dollarstore.domain.reserve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Reserve assets known to the exchange, in registration order. Assets are never removed. */
public final class AssetRegistry {
  private final Map<String, Asset> assets = new LinkedHashMap<>();

  public AssetRegistry(Collection<Asset> initialAssets) {
    initialAssets.forEach(this::register);
  }

  public void register(Asset asset) {
    Objects.requireNonNull(asset, "asset must not be null");
    if (assets.putIfAbsent(asset.symbol(), asset) != null) {
      throw new IllegalArgumentException("Asset already registered: " + asset.symbol());
    }
  }

  public Asset require(String symbol) {
    Asset asset = assets.get(Asset.normalizeSymbol(symbol));
    if (asset == null || !asset.supported()) {
      throw new UnsupportedAssetException(symbol);
    }
    return asset;
  }

  public Optional<Asset> find(String symbol) {
    return Optional.ofNullable(assets.get(Asset.normalizeSymbol(symbol)));
  }

  public boolean isSupported(String symbol) {
    return find(symbol).map(Asset::supported).orElse(false);
  }

  public List<Asset> all() {
    return List.copyOf(assets.values());
  }

  public List<Asset> supported() {
    List<Asset> supported = new ArrayList<>();
    for (Asset asset : assets.values()) {
      if (asset.supported()) {
        supported.add(asset);
      }
    }
    return supported;
  }
}

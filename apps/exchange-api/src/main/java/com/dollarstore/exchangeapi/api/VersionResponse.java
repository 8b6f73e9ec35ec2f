package com.dollarstore.exchangeapi.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}

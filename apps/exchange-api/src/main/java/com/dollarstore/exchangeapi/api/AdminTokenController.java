package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.token.TokenBalance;
import com.dollarstore.exchangeapi.token.TokenService;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/tokens")
@PreAuthorize("hasRole('ADMIN')")
@ConditionalOnProperty(
    prefix = "exchange",
    name = "faucet-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AdminTokenController {
  private final TokenService tokenService;

  public AdminTokenController(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @PostMapping("/{symbol}/mint")
  public ResponseEntity<TokenBalance> mint(
      @PathVariable("symbol") String symbol, @Valid @RequestBody TokenAmountRequest request) {
    return ResponseEntity.ok(tokenService.mint(symbol, request.account(), request.amount()));
  }
}

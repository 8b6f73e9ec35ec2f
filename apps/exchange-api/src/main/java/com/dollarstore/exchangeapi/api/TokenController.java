package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.token.TokenBalance;
import com.dollarstore.exchangeapi.token.TokenService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tokens")
public class TokenController {
  private final TokenService tokenService;

  public TokenController(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @GetMapping("/{symbol}/balances/{account}")
  public ResponseEntity<TokenBalance> balance(
      @PathVariable("symbol") String symbol, @PathVariable("account") String account) {
    return ResponseEntity.ok(tokenService.balance(symbol, account));
  }

  /** Allows the exchange to pull up to {@code amount} from the caller's wallet. */
  @PostMapping("/{symbol}/approvals")
  public ResponseEntity<TokenBalance> approve(
      @PathVariable("symbol") String symbol,
      @Valid @RequestBody AmountRequest request,
      Authentication authentication) {
    return ResponseEntity.ok(
        tokenService.approve(symbol, authentication.getName(), request.amount()));
  }
}

package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.query.ExchangeQueryService;
import com.dollarstore.exchangeapi.query.ReserveSummary;
import com.dollarstore.exchangeapi.query.ReserveView;
import com.dollarstore.exchangeapi.swap.DepositCommand;
import com.dollarstore.exchangeapi.swap.DepositResult;
import com.dollarstore.exchangeapi.swap.SwapOrchestrator;
import com.dollarstore.exchangeapi.swap.WithdrawCommand;
import com.dollarstore.exchangeapi.swap.WithdrawResult;
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
@RequestMapping("/v1/reserves")
public class ReserveController {
  private final SwapOrchestrator swapOrchestrator;
  private final ExchangeQueryService queryService;

  public ReserveController(SwapOrchestrator swapOrchestrator, ExchangeQueryService queryService) {
    this.swapOrchestrator = swapOrchestrator;
    this.queryService = queryService;
  }

  @GetMapping
  public ResponseEntity<ReserveSummary> reserves() {
    return ResponseEntity.ok(queryService.reserves());
  }

  @GetMapping("/{asset}")
  public ResponseEntity<ReserveView> reserve(@PathVariable("asset") String asset) {
    return ResponseEntity.ok(queryService.reserve(asset));
  }

  @PostMapping("/deposits")
  public ResponseEntity<DepositResponse> deposit(
      @Valid @RequestBody AssetAmountRequest request, Authentication authentication) {
    DepositResult result =
        swapOrchestrator.deposit(
            new DepositCommand(authentication.getName(), request.asset(), request.amount()));
    return ResponseEntity.ok(DepositResponse.from(request.asset(), result));
  }

  @PostMapping("/withdrawals")
  public ResponseEntity<WithdrawResponse> withdraw(
      @Valid @RequestBody AssetAmountRequest request, Authentication authentication) {
    WithdrawResult result =
        swapOrchestrator.withdraw(
            new WithdrawCommand(authentication.getName(), request.asset(), request.amount()));
    return ResponseEntity.ok(
        new WithdrawResponse(request.asset(), result.burned(), result.received()));
  }
}

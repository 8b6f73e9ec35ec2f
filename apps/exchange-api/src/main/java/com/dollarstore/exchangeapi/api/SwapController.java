package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.swap.SwapCommand;
import com.dollarstore.exchangeapi.swap.SwapOrchestrator;
import com.dollarstore.exchangeapi.swap.SwapResult;
import com.dollarstore.exchangeapi.swap.SyntheticSwapCommand;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/swaps")
public class SwapController {
  private final SwapOrchestrator swapOrchestrator;

  public SwapController(SwapOrchestrator swapOrchestrator) {
    this.swapOrchestrator = swapOrchestrator;
  }

  @PostMapping
  public ResponseEntity<SwapResponse> swap(
      @Valid @RequestBody SwapRequest request, Authentication authentication) {
    SwapResult result =
        swapOrchestrator.swap(
            new SwapCommand(
                authentication.getName(),
                request.fromAsset(),
                request.toAsset(),
                request.amount(),
                request.queueIfUnavailable()));
    return ResponseEntity.ok(SwapResponse.from(request.toAsset(), result));
  }

  @PostMapping("/from-synthetic")
  public ResponseEntity<SwapResponse> swapFromSynthetic(
      @Valid @RequestBody SyntheticSwapRequest request, Authentication authentication) {
    SwapResult result =
        swapOrchestrator.swapFromSynthetic(
            new SyntheticSwapCommand(
                authentication.getName(),
                request.toAsset(),
                request.amount(),
                request.queueIfUnavailable()));
    return ResponseEntity.ok(SwapResponse.from(request.toAsset(), result));
  }
}

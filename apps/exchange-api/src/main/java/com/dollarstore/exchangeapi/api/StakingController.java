package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.staking.StakingInfo;
import com.dollarstore.exchangeapi.staking.StakingService;
import jakarta.validation.Valid;
import java.math.BigInteger;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Staking transitions act on the caller's own stake account. */
@RestController
@RequestMapping("/v1/staking")
public class StakingController {
  private final StakingService stakingService;

  public StakingController(StakingService stakingService) {
    this.stakingService = stakingService;
  }

  @PostMapping("/stake")
  public ResponseEntity<StakingInfo> stake(
      @Valid @RequestBody AmountRequest request, Authentication authentication) {
    String owner = authentication.getName();
    stakingService.stake(owner, request.amount());
    return ResponseEntity.ok(stakingService.stakingInfo(owner));
  }

  @PostMapping("/unstake")
  public ResponseEntity<StakingInfo> unstake(Authentication authentication) {
    String owner = authentication.getName();
    stakingService.unstake(owner);
    return ResponseEntity.ok(stakingService.stakingInfo(owner));
  }

  @PostMapping("/complete-unstake")
  public ResponseEntity<CompleteUnstakeResponse> completeUnstake(Authentication authentication) {
    String owner = authentication.getName();
    BigInteger released = stakingService.completeUnstake(owner);
    return ResponseEntity.ok(new CompleteUnstakeResponse(owner, released));
  }

  @PostMapping("/cancel-unstake")
  public ResponseEntity<StakingInfo> cancelUnstake(Authentication authentication) {
    String owner = authentication.getName();
    stakingService.cancelUnstake(owner);
    return ResponseEntity.ok(stakingService.stakingInfo(owner));
  }

  @GetMapping("/{owner}")
  public ResponseEntity<StakingInfo> stakingInfo(@PathVariable("owner") String owner) {
    return ResponseEntity.ok(stakingService.stakingInfo(owner));
  }
}

package com.dollarstore.exchangeapi.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dollarstore.domain.staking.CooldownNotCompleteException;
import com.dollarstore.domain.staking.StakeStatus;
import com.dollarstore.exchangeapi.config.SecurityConfig;
import com.dollarstore.exchangeapi.staking.StakingInfo;
import com.dollarstore.exchangeapi.staking.StakingService;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StakingController.class)
@Import(SecurityConfig.class)
class StakingControllerTest {
  private static final Instant STARTED = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;
  @MockBean private StakingService stakingService;

  @Test
  void shouldStakeAndReturnAccount() throws Exception {
    when(stakingService.stakingInfo("alice")).thenReturn(staked(BigInteger.valueOf(400)));

    mockMvc
        .perform(
            post("/v1/staking/stake")
                .with(jwt().jwt(token -> token.subject("alice")))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 400}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("STAKED"))
        .andExpect(jsonPath("$.stakedAmount").value(400));

    verify(stakingService).stake("alice", BigInteger.valueOf(400));
  }

  @Test
  void shouldReturnReleasedAmountOnCompleteUnstake() throws Exception {
    when(stakingService.completeUnstake("alice")).thenReturn(BigInteger.valueOf(400));

    mockMvc
        .perform(
            post("/v1/staking/complete-unstake")
                .with(jwt().jwt(token -> token.subject("alice"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.released").value(400));
  }

  @Test
  void shouldMapCooldownToConflict() throws Exception {
    when(stakingService.completeUnstake("alice"))
        .thenThrow(new CooldownNotCompleteException("alice", STARTED.plus(Duration.ofDays(7))));

    mockMvc
        .perform(
            post("/v1/staking/complete-unstake")
                .with(jwt().jwt(token -> token.subject("alice"))))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("COOLDOWN_NOT_COMPLETE"));
  }

  @Test
  void shouldReturnStakingInfo() throws Exception {
    when(stakingService.stakingInfo("bob")).thenReturn(staked(BigInteger.TEN));

    mockMvc
        .perform(get("/v1/staking/bob").with(jwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dailyFeeFreeCap").value(0));
  }

  @Test
  void shouldRejectUnstakeWithoutToken() throws Exception {
    mockMvc.perform(post("/v1/staking/unstake")).andExpect(status().isUnauthorized());

    verifyNoInteractions(stakingService);
  }

  private static StakingInfo staked(BigInteger amount) {
    return new StakingInfo(
        "alice",
        StakeStatus.STAKED,
        amount,
        BigInteger.ZERO,
        STARTED,
        null,
        null,
        Duration.ofDays(30),
        BigInteger.ZERO,
        BigInteger.ZERO);
  }
}

package com.dollarstore.exchangeapi.api;

import com.dollarstore.domain.queue.QueuePosition;
import com.dollarstore.exchangeapi.query.ExchangeQueryService;
import com.dollarstore.exchangeapi.query.PositionView;
import com.dollarstore.exchangeapi.swap.CancelQueueCommand;
import com.dollarstore.exchangeapi.swap.JoinQueueCommand;
import com.dollarstore.exchangeapi.swap.SwapOrchestrator;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/queue")
public class QueueController {
  private final SwapOrchestrator swapOrchestrator;
  private final ExchangeQueryService queryService;

  public QueueController(SwapOrchestrator swapOrchestrator, ExchangeQueryService queryService) {
    this.swapOrchestrator = swapOrchestrator;
    this.queryService = queryService;
  }

  @PostMapping("/positions")
  public ResponseEntity<PositionView> joinQueue(
      @Valid @RequestBody JoinQueueRequest request, Authentication authentication) {
    QueuePosition position =
        swapOrchestrator.joinQueue(
            new JoinQueueCommand(authentication.getName(), request.asset(), request.amount()));
    return ResponseEntity.status(HttpStatus.CREATED).body(queryService.position(position.id()));
  }

  @PostMapping("/positions/{id}/cancel")
  public ResponseEntity<CancelQueueResponse> cancel(
      @PathVariable("id") long id, Authentication authentication) {
    QueuePosition cancelled =
        swapOrchestrator.cancelQueue(new CancelQueueCommand(authentication.getName(), id));
    return ResponseEntity.ok(
        new CancelQueueResponse(
            cancelled.id(), cancelled.status().name(), cancelled.remainingAmount()));
  }

  @GetMapping("/positions/{id}")
  public ResponseEntity<PositionView> position(@PathVariable("id") long id) {
    return ResponseEntity.ok(queryService.position(id));
  }

  /** Positions of {@code owner}, or of the caller when no owner is given. */
  @GetMapping("/positions")
  public ResponseEntity<List<PositionView>> positions(
      @RequestParam(name = "owner", required = false) String owner,
      Authentication authentication) {
    String account = owner == null || owner.isBlank() ? authentication.getName() : owner;
    return ResponseEntity.ok(queryService.positionsOf(account));
  }

  @GetMapping("/{asset}/depth")
  public ResponseEntity<QueueDepthResponse> depth(@PathVariable("asset") String asset) {
    return ResponseEntity.ok(new QueueDepthResponse(asset, queryService.queueDepth(asset)));
  }
}

package com.dollarstore.exchangeapi.api;

import com.dollarstore.exchangeapi.query.EmissionStats;
import com.dollarstore.exchangeapi.query.ExchangeQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/emissions")
public class EmissionController {
  private final ExchangeQueryService queryService;

  public EmissionController(ExchangeQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping
  public ResponseEntity<EmissionStats> emissions() {
    return ResponseEntity.ok(queryService.emissionStats());
  }
}

package com.geobot.paper.web;

import com.geobot.paper.runner.ManualCloseResult;
import com.geobot.paper.runner.PaperTradingRunner;
import com.geobot.paper.runner.PortfolioReport;
import com.geobot.paper.runner.RunSummary;
import com.geobot.paper.strategy.StrategyCatalog;
import com.geobot.paper.strategy.UnknownStrategyException;
import com.geobot.paper.strategy.model.Strategy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/paper")
@RequiredArgsConstructor
@Slf4j
public class PaperTradingController {

  private final @NonNull StrategyCatalog catalog;
  private final @NonNull PaperTradingRunner runner;

  @GetMapping("/strategies")
  public ResponseEntity<List<StrategyResponse>> strategies() {
    return ResponseEntity.ok(catalog.strategies().stream().map(StrategyResponse::of).toList());
  }

  @GetMapping("/groups")
  public ResponseEntity<Map<String, List<String>>> groups() {
    return ResponseEntity.ok(catalog.groups());
  }

  @GetMapping("/portfolios/{strategyId}")
  public ResponseEntity<PortfolioReport> portfolio(@PathVariable String strategyId) {
    return ResponseEntity.ok(runner.report(strategyId));
  }

  @PostMapping("/run")
  public ResponseEntity<RunSummary> run(@RequestParam(required=false) String target) {
    return ResponseEntity.ok(runner.run(target));
  }

  @PostMapping("/portfolios/{strategyId}/close")
  public ResponseEntity<ManualCloseResult> close(@PathVariable String strategyId, @RequestParam String query) {
    return ResponseEntity.ok(runner.closeManually(strategyId, query));
  }

  @PostMapping("/close")
  public ResponseEntity<List<ManualCloseResult>> closeEverywhere(@RequestParam String query) {
    return ResponseEntity.ok(runner.closeManually(query));
  }

  @ExceptionHandler(UnknownStrategyException.class)
  public ResponseEntity<ErrorResponse> unknown(UnknownStrategyException e) {
    log.debug("Unknown target {}", e.getTarget());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
  }

  public record StrategyResponse(
      String id,
      String name,
      String description,
      String betSide,
      String zones,
      String sizing,
      BigDecimal betSize,
      String priority,
      double deadlineMinDays,
      Double deadlineMaxDays,
      int eventCap,
      boolean excludeSeries,
      BigDecimal bankroll,
      List<String> clusterFilter
  ) {
    static StrategyResponse of(Strategy s) {
      return new StrategyResponse(
          s.id(),
          s.name(),
          s.description(),
          s.betSide().name(),
          s.zones().describe(),
          s.sizing().name(),
          s.betSize(),
          s.priority().getId(),
          s.deadlineMinDays(),
          s.deadlineMaxDays(),
          s.eventCap(),
          s.excludeSeries(),
          s.bankroll(),
          s.clusterFilter().stream().sorted().toList()
      );
    }
  }

  public record ErrorResponse(String error) {
  }
}

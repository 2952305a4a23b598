package com.valuebet.infrastructure.rest;

import com.valuebet.application.usecase.EvaluateBetUseCase;
import com.valuebet.application.usecase.InterpretBetUseCase;
import com.valuebet.domain.model.ParsedBet;
import com.valuebet.domain.model.SavedBet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for bet interpretation and evaluation.
 */
@RestController
@RequestMapping("/bets")
public class BetController {

    private static final Logger logger = LoggerFactory.getLogger(BetController.class);

    private final InterpretBetUseCase interpretBetUseCase;
    private final EvaluateBetUseCase evaluateBetUseCase;

    public BetController(InterpretBetUseCase interpretBetUseCase, EvaluateBetUseCase evaluateBetUseCase) {
        this.interpretBetUseCase = interpretBetUseCase;
        this.evaluateBetUseCase = evaluateBetUseCase;
    }

    public record ParseRequest(String text) {}

    public record EvaluateRequest(String line, Double odds, Boolean save) {}

    /**
     * POST /bets/parse {"text": "man utd v chelsea match odds"}
     */
    @PostMapping("/parse")
    public ResponseEntity<ParsedBet> parse(@RequestBody ParseRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        logger.info("Received request to parse '{}'", request.text());

        try {
            return ResponseEntity.ok(interpretBetUseCase.execute(request.text()));
        } catch (Exception e) {
            logger.error("Error parsing bet", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * POST /bets/evaluate {"line": "bet365 - football - chelsea - 2.1", "save": true}
     *
     * @return parsed bet, evaluation and the saved line (null when nothing was saved)
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluateBetUseCase.EvaluationReport> evaluate(@RequestBody EvaluateRequest request) {
        if (request == null || request.line() == null || request.line().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        logger.info("Received request to evaluate '{}'", request.line());

        try {
            EvaluateBetUseCase.EvaluationReport report = evaluateBetUseCase.execute(request.line(), request.odds(),
                Boolean.TRUE.equals(request.save()));
            logger.info("Evaluation completed. Status: {}", report.evaluation().status());
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected bet line '{}': {}", request.line(), e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            logger.error("Error evaluating bet", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /bets/saved?limit=20
     */
    @GetMapping("/saved")
    public ResponseEntity<List<SavedBet>> saved(@RequestParam(defaultValue = "20") int limit) {
        try {
            return ResponseEntity.ok(evaluateBetUseCase.recentSavedBets(limit));
        } catch (Exception e) {
            logger.error("Error loading saved bets", e);
            return ResponseEntity.internalServerError().build();
        }
    }
}

package org.nowstart.spxsignal.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.nowstart.spxsignal.backtest.BacktestResult;
import org.nowstart.spxsignal.data.dto.BacktestRequest;
import org.nowstart.spxsignal.data.dto.ModelTrainRequest;
import org.nowstart.spxsignal.data.dto.RecommendationDto;
import org.nowstart.spxsignal.service.BacktestService;
import org.nowstart.spxsignal.service.LearnedModelService;
import org.nowstart.spxsignal.service.RecommendationService;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/signals")
@Tag(name = "Signals", description = "Live recommendation, learned-model training and backtest API")
public class SignalController {

    private final RecommendationService recommendationService;
    private final LearnedModelService learnedModelService;
    private final BacktestService backtestService;

    public SignalController(
            RecommendationService recommendationService,
            LearnedModelService learnedModelService,
            BacktestService backtestService
    ) {
        this.recommendationService = recommendationService;
        this.learnedModelService = learnedModelService;
        this.backtestService = backtestService;
    }

    @GetMapping("/recommendation")
    @Operation(summary = "Current recommendation", description = "Combined signal for the latest bar with the per-strategy breakdown.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recommendation computed"),
            @ApiResponse(responseCode = "409", description = "Learned strategy is weighted but not trained"),
            @ApiResponse(responseCode = "422", description = "Market data is missing or malformed")
    })
    public RecommendationDto getRecommendation() {
        return recommendationService.currentRecommendation();
    }

    @PostMapping("/model/train")
    @Operation(summary = "Train learned strategy", description = "Fits a new learned model on the given range and installs it for live queries.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Model trained and installed"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "422", description = "Not enough labelled history")
    })
    public TrainingReport trainModel(@RequestBody @Valid ModelTrainRequest request) {
        return learnedModelService.train(request.from(), request.to());
    }

    @GetMapping("/model/importances")
    @Operation(summary = "Feature importances", description = "Normalized importances of the installed learned model, most important first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Importances returned"),
            @ApiResponse(responseCode = "409", description = "No model installed")
    })
    public Map<String, Double> getFeatureImportances() {
        return learnedModelService.featureImportances();
    }

    @PostMapping("/backtests")
    @Operation(summary = "Run backtest", description = "Walk-forward backtest over the given range with the configured strategy settings.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Backtest completed"),
            @ApiResponse(responseCode = "400", description = "Request validation failed"),
            @ApiResponse(responseCode = "422", description = "Market data is missing or malformed")
    })
    public BacktestResult runBacktest(@RequestBody @Valid BacktestRequest request) {
        return backtestService.run(request.from(), request.to(), request.trainingRatio());
    }
}

package com.acme.reconcile.controller;

import com.acme.reconcile.domain.TrainingReport;
import com.acme.reconcile.domain.TrainingRequest;
import com.acme.reconcile.service.TrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Training entry point for the mismatch classifier.
 */
@RestController
@RequestMapping("/api/v1/model")
@Tag(name = "Model", description = "Mismatch classifier training")
@Slf4j
public class ModelTrainingController {

    private final TrainingService trainingService;

    public ModelTrainingController(TrainingService trainingService) {
        this.trainingService = trainingService;
    }

    @PostMapping("/train")
    @Operation(
            summary = "Train the matcher model",
            description = "Builds the labelled feature table, fits the classifier and writes the feature table, " +
                         "metrics report and model artifact to the output directory"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Model trained",
                    content = @Content(schema = @Schema(implementation = TrainingReport.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Dataset missing or outputs not writable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<TrainingReport> train(@RequestBody(required = false) TrainingRequest request) {
        TrainingRequest effective = request != null ? request : new TrainingRequest(null, null, null);
        log.info("Received training request: {}", effective);
        return ResponseEntity.ok(trainingService.train(effective));
    }
}

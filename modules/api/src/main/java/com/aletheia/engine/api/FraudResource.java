package com.aletheia.engine.api;

import com.aletheia.engine.core.error.ValidationException;
import com.aletheia.engine.core.fraud.FraudDetectionResult;
import com.aletheia.engine.core.fraud.FraudRiskScorer;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/api/fraud")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FraudResource {

    @Inject
    FraudRiskScorer scorer;

    @POST
    @Path("/assessments")
    public FraudDetectionResult assess(FraudAssessmentRequest request) {
        if (request == null || request.activity() == null) {
            throw new ValidationException("Missing required field: activity");
        }
        return scorer.assessRisk(request.activity(), request.metrics());
    }
}

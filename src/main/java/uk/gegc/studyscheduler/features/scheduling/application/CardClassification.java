package uk.gegc.studyscheduler.features.scheduling.application;

import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;

public record CardClassification(CardMaturity maturity, double estimatedRetention) {
}

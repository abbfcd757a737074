package com.hrkey.rvl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.*;
import com.hrkey.rvl.dto.ValidationFlag.FlagType;
import com.hrkey.rvl.dto.ValidationFlag.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StructuredOutputGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String TEXT = "Maria led our payments team for three years and shipped on time.";

    private final StructuredOutputGenerator generator = new StructuredOutputGenerator(
            ValidationThresholds.DEFAULT, Clock.fixed(NOW, ZoneOffset.UTC));

    private static Map<String, Double> ratings() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("communication", 4.5);
        m.put("teamwork", 3.0);
        m.put("leadership", 2.0);
        return m;
    }

    private static FraudAssessment fraud(int score) {
        return new FraudAssessment(score, Map.of(), ValidationThresholds.DEFAULT.riskLevel(score));
    }

    private OutputInput.OutputInputBuilder base() {
        return OutputInput.builder()
                .standardizedText(TEXT)
                .kpiRatings(ratings())
                .consistencyScore(1.0)
                .fraud(fraud(5));
    }

    @Nested
    @DisplayName("generate()")
    class Generate {

        @Test
        @DisplayName("drops null and non-finite ratings instead of failing")
        void nullRatings() {
            Map<String, Double> ratings = ratings();
            ratings.put("punctuality", null);
            ratings.put("attitude", Double.NaN);
            ratings.put("ownership", Double.POSITIVE_INFINITY);

            ValidatedReferenceRecord r = generator.generate(base().kpiRatings(ratings).build());

            assertThat(r.structuredDimensions()).containsOnlyKeys("communication", "teamwork", "leadership");
            assertThat(r.metadata().kpiCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("builds dimensions in input order with extremity confidence")
        void dimensions() {
            ValidatedReferenceRecord r = generator.generate(base().build());

            assertThat(r.structuredDimensions()).containsOnlyKeys("communication", "teamwork", "leadership");
            assertThat(r.structuredDimensions().keySet()).containsExactly("communication", "teamwork", "leadership");
            assertThat(r.structuredDimensions().get("communication").confidence()).isEqualTo(0.95);
            assertThat(r.structuredDimensions().get("teamwork").confidence()).isEqualTo(0.60);
            assertThat(r.structuredDimensions().get("leadership").confidence()).isEqualTo(0.85);
            assertThat(r.structuredDimensions().get("communication").normalized()).isEqualTo(0.9);
        }

        @Test
        @DisplayName("lowers confidence for flagged KPIs and raises it when feedback exists")
        void dimensionAdjustments() {
            ValidatedReferenceRecord r = generator.generate(base()
                    .flags(List.of(ValidationFlag.warning(FlagType.KPI_DEVIATION, "deviates", "communication")))
                    .detailedFeedback(Map.of("strengths", "Great teamwork across squads."))
                    .build());

            assertThat(r.structuredDimensions().get("communication").confidence()).isEqualTo(0.76);
            assertThat(r.structuredDimensions().get("teamwork").confidence()).isEqualTo(0.65);
            assertThat(r.structuredDimensions().get("teamwork").feedback()).isEqualTo("Great teamwork across squads.");
            assertThat(r.structuredDimensions().get("leadership").feedback()).isNull();
        }

        @Test
        @DisplayName("computes overall confidence from consistency, fraud, KPI count and length")
        void overallConfidence() {
            ValidatedReferenceRecord r = generator.generate(base().build());

            // 1.0 x (1 - 5/200) x 1.0 (3 KPIs) x 0.9 (short text)
            assertThat(r.confidence()).isCloseTo(0.8775, within(1e-9));
        }

        @Test
        @DisplayName("discounts confidence when the embedding provider was unavailable")
        void unavailableEmbedding() {
            double generated = generator.generate(base().build()).confidence();
            ValidatedReferenceRecord r = generator.generate(base().embeddingStatus(EmbeddingStatus.UNAVAILABLE).build());

            assertThat(r.confidence()).isLessThan(generated);
            assertThat(r.embeddingVector()).isNull();
            assertThat(r.metadata().embeddingStatus()).isEqualTo(EmbeddingStatus.UNAVAILABLE);
        }

        @Test
        @DisplayName("fills metadata from the clock and inputs")
        void metadata() {
            ValidatedReferenceRecord r = generator.generate(base()
                    .embeddingVector(new double[]{0.1, 0.2})
                    .keyPhrases(List.of("team player"))
                    .build());

            assertThat(r.metadata().validatedAt()).isEqualTo(NOW);
            assertThat(r.metadata().validationVersion()).isEqualTo("1.0.0");
            assertThat(r.metadata().kpiCount()).isEqualTo(3);
            assertThat(r.metadata().textLength()).isEqualTo(TEXT.length());
            assertThat(r.metadata().hasEmbedding()).isTrue();
            assertThat(r.metadata().embeddingStatus()).isEqualTo(EmbeddingStatus.GENERATED);
            assertThat(r.metadata().keyPhrases()).containsExactly("team player");
            assertThat(r.embeddingVector()).containsExactly(0.1, 0.2);
        }
    }

    @Nested
    @DisplayName("deriveStatus()")
    class DeriveStatus {

        @Test
        @DisplayName("fraud 75 rejects regardless of consistency")
        void highFraud() {
            assertThat(generator.deriveStatus(75, List.of(), 1.0, List.of()))
                    .isEqualTo(ValidationStatus.REJECTED_HIGH_FRAUD_RISK);
            assertThat(generator.generate(base().fraud(fraud(75)).build()).validationStatus())
                    .isEqualTo(ValidationStatus.REJECTED_HIGH_FRAUD_RISK);
        }

        @Test
        @DisplayName("quality issues reject as critical")
        void qualityIssues() {
            assertThat(generator.deriveStatus(10, List.of("Text contains potential gibberish"), 1.0, List.of()))
                    .isEqualTo(ValidationStatus.REJECTED_CRITICAL_ISSUES);
        }

        @Test
        @DisplayName("very low consistency or a critical consistency flag rejects as inconsistent")
        void inconsistent() {
            assertThat(generator.deriveStatus(10, List.of(), 0.3, List.of()))
                    .isEqualTo(ValidationStatus.REJECTED_INCONSISTENT);
            ValidationFlag critical = new ValidationFlag(FlagType.POTENTIAL_CONTRADICTION, Severity.CRITICAL, "x", null);
            assertThat(generator.deriveStatus(10, List.of(), 1.0, List.of(critical)))
                    .isEqualTo(ValidationStatus.REJECTED_INCONSISTENT);
        }

        @Test
        @DisplayName("medium fraud, warnings or middling consistency approve with warnings")
        void warnings() {
            assertThat(generator.deriveStatus(30, List.of(), 1.0, List.of()))
                    .isEqualTo(ValidationStatus.APPROVED_WITH_WARNINGS);
            assertThat(generator.deriveStatus(0, List.of(), 0.5, List.of()))
                    .isEqualTo(ValidationStatus.APPROVED_WITH_WARNINGS);
            assertThat(generator.deriveStatus(0, List.of(), 1.0,
                    List.of(ValidationFlag.warning(FlagType.POTENTIAL_CONTRADICTION, "x"))))
                    .isEqualTo(ValidationStatus.APPROVED_WITH_WARNINGS);
        }

        @Test
        @DisplayName("info flags do not downgrade approval")
        void info() {
            ValidationFlag info = new ValidationFlag(FlagType.SEMANTIC_DIVERGENCE, Severity.INFO, "x", null);
            assertThat(generator.deriveStatus(29, List.of(), 0.6, List.of(info)))
                    .isEqualTo(ValidationStatus.APPROVED);
        }
    }

    @Nested
    @DisplayName("adapters")
    class Adapters {

        private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

        @Test
        @DisplayName("forScoringEngine keeps ratings, narrative and pass/fail")
        void scoringEngine() {
            ValidatedReferenceRecord r = generator.generate(base().build());

            ScoringEngineView view = generator.forScoringEngine(r);

            assertThat(view.kpiRatings()).containsEntry("communication", 4.5).hasSize(3);
            assertThat(view.narrative()).isEqualTo(TEXT);
            assertThat(view.confidenceScore()).isEqualTo(r.confidence());
            assertThat(view.validationPassed()).isTrue();
        }

        @Test
        @DisplayName("forScoringEngine marks rejected records as not passed")
        void scoringEngineRejected() {
            ValidatedReferenceRecord r = generator.generate(base().fraud(fraud(90)).build());
            assertThat(generator.forScoringEngine(r).validationPassed()).isFalse();
        }

        @Test
        @DisplayName("forPublicApi never serializes the embedding vector")
        void publicApiHidesVector() throws Exception {
            ValidatedReferenceRecord r = generator.generate(base().embeddingVector(new double[]{0.42, -0.42}).build());

            String json = mapper.writeValueAsString(generator.forPublicApi(r, true));
            String jsonDefault = mapper.writeValueAsString(generator.forPublicApi(r, false));

            assertThat(json).doesNotContain("embeddingVector").doesNotContain("0.42");
            assertThat(json).contains("\"embeddingAvailable\":true").contains("\"internal\"");
            assertThat(jsonDefault).doesNotContain("embedding").doesNotContain("internal");
        }

        @Test
        @DisplayName("forPublicApi exposes flags without KPI detail")
        void publicApiFlags() {
            ValidatedReferenceRecord r = generator.generate(base()
                    .flags(List.of(ValidationFlag.warning(FlagType.KPI_DEVIATION, "deviates", "communication")))
                    .build());

            PublicReferenceView view = generator.forPublicApi(r, false);

            assertThat(view.status()).isEqualTo(ValidationStatus.APPROVED_WITH_WARNINGS);
            assertThat(view.flags()).containsExactly(
                    new PublicReferenceView.FlagView(FlagType.KPI_DEVIATION, Severity.WARNING, "deviates"));
            assertThat(view.metadata().validatedAt()).isEqualTo(NOW);
            assertThat(view.metadata().version()).isEqualTo("1.0.0");
        }

        @Test
        @DisplayName("forPersistence flags high fraud and rejected status with the storage reasons")
        void persistenceFlagged() {
            ValidatedReferenceRecord r = generator.generate(base().fraud(fraud(80)).build());

            PersistedValidation p = generator.forPersistence(r);

            assertThat(p.flagged()).isTrue();
            assertThat(p.flagReason()).isEqualTo(
                    "Automatic flag: High fraud score (80); Automatic flag: REJECTED_HIGH_FRAUD_RISK");
            assertThat(p.validatedAt()).isEqualTo(NOW);
            assertThat(p.validatedData()).isSameAs(r);
        }

        @Test
        @DisplayName("forPersistence leaves approved records unflagged")
        void persistenceClean() {
            PersistedValidation p = generator.forPersistence(generator.generate(base().build()));

            assertThat(p.flagged()).isFalse();
            assertThat(p.flagReason()).isNull();
            assertThat(p.validationStatus()).isEqualTo(ValidationStatus.APPROVED);
        }

        @Test
        @DisplayName("forPersistence uses the storage column names")
        void persistenceJson() throws Exception {
            String json = mapper.writeValueAsString(generator.forPersistence(generator.generate(base().build())));
            assertThat(json).contains("\"validation_status\"", "\"fraud_score\"", "\"is_flagged\"", "\"validated_data\"");
        }
    }
}

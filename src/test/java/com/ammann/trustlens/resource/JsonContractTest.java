/* (C)2026 */
package com.ammann.trustlens.resource;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trustlens.dto.AlertRecordDTO;
import com.ammann.trustlens.dto.AlertTriggerResponseDTO;
import com.ammann.trustlens.dto.MetricsCheckResponseDTO;
import com.ammann.trustlens.dto.MetricsResultDTO;
import com.ammann.trustlens.enumeration.AlertSeverity;
import com.ammann.trustlens.model.DeliveryOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the JSON field names and shapes produced by the application's object mapper.
 */
@QuarkusTest
class JsonContractTest {

    @Inject ObjectMapper objectMapper;

    @Test
    void metricsSerializeAbsentValuesAsNull() {
        JsonNode json = objectMapper.valueToTree(MetricsCheckResponseDTO.of("csv", new MetricsResultDTO(0.5, null)));

        assertThat(json.get("source").asText()).isEqualTo("csv");
        assertThat(json.get("metrics").get("null_rate").asDouble()).isEqualTo(0.5);
        assertThat(json.get("metrics").has("minutes_since_last_update")).isTrue();
        assertThat(json.get("metrics").get("minutes_since_last_update").isNull()).isTrue();
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void noDataResultHasOnlyError() {
        JsonNode json = objectMapper.valueToTree(MetricsCheckResponseDTO.noData("foo"));

        assertThat(json.size()).isEqualTo(1);
        assertThat(json.get("error").asText()).isEqualTo("No data loaded for source 'foo'");
    }

    @Test
    void triggerShapes() {
        JsonNode raised = objectMapper.valueToTree(
                AlertTriggerResponseDTO.raised("csv", List.of("High null rate: 33.3%"), DeliveryOutcome.notConfigured()));
        JsonNode allGood = objectMapper.valueToTree(AlertTriggerResponseDTO.allGood("csv"));

        assertThat(raised.get("slack").asText()).isEqualTo("not_configured");
        assertThat(raised.get("alerts").get(0).asText()).isEqualTo("High null rate: 33.3%");
        assertThat(allGood.get("alerts").isArray()).isTrue();
        assertThat(allGood.get("alerts").size()).isZero();
        assertThat(allGood.get("status").asText()).isEqualTo("all good");
        assertThat(allGood.has("slack")).isFalse();
    }

    @Test
    void alertRecordUsesSnakeCaseTimestampAndLowercaseSeverity() {
        JsonNode json = objectMapper.valueToTree(
                new AlertRecordDTO(1, AlertSeverity.HIGH, "x", Instant.parse("2025-09-10T12:00:00Z")));

        assertThat(json.get("severity").asText()).isEqualTo("high");
        assertThat(json.get("created_at").asText()).isEqualTo("2025-09-10T12:00:00Z");
    }
}

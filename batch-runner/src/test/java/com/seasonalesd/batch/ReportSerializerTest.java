package com.seasonalesd.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seasonalesd.core.model.Anomaly;
import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.ExpectedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportSerializer}.
 */
class ReportSerializerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Should write instants as ISO-8601 and omit absent fields")
    void shouldSerializeResult() throws Exception {
        AnomalyReport report = AnomalyReport.builder()
                .detectorName("vec")
                .period(24)
                .anomalies(List.of(new Anomaly(201L, null, 105.0, null)))
                .expected(List.of(new ExpectedValue(201L, null, 100.0)))
                .build();
        BatchResult result = new BatchResult(Instant.parse("2024-03-01T12:00:00Z"), "-", 336,
                List.of(report), List.of(new DetectorFailure("broken", "boom")));

        JsonNode json = MAPPER.readTree(new ReportSerializer(false).serialize(result));

        assertThat(json.get("generatedAt").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(json.get("observations").asInt()).isEqualTo(336);
        assertThat(json.get("successful").asBoolean()).isFalse();
        JsonNode reportNode = json.get("reports").get(0);
        assertThat(reportNode.get("detectorName").asText()).isEqualTo("vec");
        assertThat(reportNode.has("granularity")).isFalse();
        JsonNode anomaly = reportNode.get("anomalies").get(0);
        assertThat(anomaly.get("timestamp").asLong()).isEqualTo(201L);
        assertThat(anomaly.get("value").asDouble()).isEqualTo(105.0);
        assertThat(anomaly.has("label")).isFalse();
        assertThat(anomaly.has("expectedValue")).isFalse();
        assertThat(json.get("failures").get(0).get("message").asText()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should indent output only when pretty printing")
    void shouldHonourPrettyPrint() {
        BatchResult result = new BatchResult(Instant.EPOCH, "-", 0, List.of(), List.of());

        assertThat(new ReportSerializer(false).serialize(result)).doesNotContain("\n");
        assertThat(new ReportSerializer(true).serialize(result)).contains("\n");
    }
}

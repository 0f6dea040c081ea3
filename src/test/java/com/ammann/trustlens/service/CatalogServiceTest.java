/* (C)2026 */
package com.ammann.trustlens.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.trustlens.dto.AlertRecordDTO;
import com.ammann.trustlens.dto.TrendPointDTO;
import com.ammann.trustlens.enumeration.AlertSeverity;
import com.ammann.trustlens.enumeration.SourceStatus;
import com.ammann.trustlens.exception.ValidationException;
import com.ammann.trustlens.support.TimeTestUtils;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CatalogServiceTest {

    private final CatalogService service =
            new CatalogService(TimeTestUtils.fixedClock(Instant.parse("2025-09-10T12:34:56Z")));

    @Test
    void listsFourDataSources() {
        assertThat(service.listDataSources())
                .extracting(s -> s.name() + "/" + s.type() + "/" + s.status())
                .containsExactly(
                        "Orders DB/postgres/HEALTHY",
                        "Users API/api/WARNING",
                        "Inventory S3/s3/FAILING",
                        "Billing Warehouse/postgres/HEALTHY");
        assertThat(service.listDataSources())
                .allSatisfy(s -> assertThat(s.lastRun()).isEqualTo("2025-09-10T12:34:56Z"));
    }

    @Test
    void listAlertsHonoursLimit() {
        List<AlertRecordDTO> all = service.listAlerts(20);

        assertThat(all).extracting(AlertRecordDTO::severity)
                .containsExactly(AlertSeverity.HIGH, AlertSeverity.MEDIUM, AlertSeverity.LOW);
        assertThat(service.listAlerts(2)).extracting(AlertRecordDTO::id).containsExactly(1, 2);
        assertThat(service.listAlerts(0)).isEmpty();
    }

    @Test
    void listAlertsRejectsNegativeLimit() {
        assertThatThrownBy(() -> service.listAlerts(-1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void trendHasOnePointPerMinuteEndingNow() {
        List<TrendPointDTO> trend = service.nullRateTrend("30min");

        assertThat(trend).hasSize(30);
        assertThat(trend.get(0).t()).isEqualTo("12:05");
        assertThat(trend.get(29).t()).isEqualTo("12:34");
    }

    @Test
    void trendValuesAreDeterministic() {
        List<TrendPointDTO> trend = service.nullRateTrend(null);

        assertThat(trend.get(0).nullRate()).isEqualTo(0.0);
        assertThat(trend.get(0).freshnessMin()).isEqualTo(5);
        assertThat(trend.get(1).nullRate()).isEqualTo(7.3);
        assertThat(trend.get(2).nullRate()).isEqualTo(14.6);
        assertThat(trend.get(3).nullRate()).isEqualTo(0.0);
        assertThat(trend.get(29).freshnessMin()).isEqualTo(121);
        assertThat(trend).isEqualTo(service.nullRateTrend("30min"));
    }

    @ParameterizedTest
    @CsvSource({"30min, 30", "5m, 5", "2h, 120", "1 hour, 60", "48h, 1440"})
    void parsesWindow(String window, int expected) {
        assertThat(CatalogService.parseWindowMinutes(window)).isEqualTo(expected);
    }

    @Test
    void rejectsMalformedWindow() {
        assertThatThrownBy(() -> service.nullRateTrend("soon"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("window");
        assertThatThrownBy(() -> service.nullRateTrend("0min"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void statusesUseWireNames() {
        assertThat(SourceStatus.FAILING.wireName()).isEqualTo("failing");
        assertThat(AlertSeverity.MEDIUM.wireName()).isEqualTo("medium");
    }
}

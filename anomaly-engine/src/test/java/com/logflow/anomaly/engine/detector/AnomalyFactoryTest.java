package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.TestSeries;
import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.Metrics;
import com.logflow.anomaly.engine.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyFactoryTest {

    private final AnomalyFactory factory = TestSeries.anomalyFactory();

    @Nested
    @DisplayName("deviationPercent")
    class DeviationPercent {

        @Test
        void isRelativeToTheExpectation() {
            assertThat(AnomalyFactory.deviationPercent(150, 100)).isCloseTo(50.0, within(1e-9));
            assertThat(AnomalyFactory.deviationPercent(25, 100)).isCloseTo(-75.0, within(1e-9));
        }

        @Test
        void usesMagnitudeOfNegativeExpectation() {
            assertThat(AnomalyFactory.deviationPercent(-5, -10)).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("zero expectation reports the signed sentinel")
        void zeroExpectation() {
            assertThat(AnomalyFactory.deviationPercent(5, 0)).isEqualTo(10_000.0);
            assertThat(AnomalyFactory.deviationPercent(-5, 0)).isEqualTo(-10_000.0);
            assertThat(AnomalyFactory.deviationPercent(0, 0)).isZero();
        }
    }

    @Test
    void createCarriesBucketAndClassification() {
        Anomaly anomaly = factory.create(TestSeries.of(Metrics.ERROR_RATE, "auth-service", 0, 0, 12.5), 2,
                AnomalyType.SPIKE, 3.2, 0, DetectorKind.TREND);

        assertThat(anomaly.getDetectedAt()).isEqualTo(TestSeries.at(2));
        assertThat(anomaly.getService()).isEqualTo("auth-service");
        assertThat(anomaly.getActualValue()).isEqualTo(12.5);
        assertThat(anomaly.getDeviationPercent()).isEqualTo(AnomalyFactory.DEVIATION_SENTINEL);
        // the deviation alone is past the critical breakpoint
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getDescription()).isEqualTo("error_rate spike (Moving Average): 12.50 (expected ~0.00)");
    }
}

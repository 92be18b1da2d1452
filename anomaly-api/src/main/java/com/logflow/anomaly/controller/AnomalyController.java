package com.logflow.anomaly.controller;

import com.logflow.anomaly.dto.AnomalyDto;
import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.dto.BaselineStatsDto;
import com.logflow.anomaly.engine.model.Metrics;
import com.logflow.anomaly.services.AnomalyQueryService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class AnomalyController {
    private final AnomalyQueryService anomalyQueryService;

    @GetMapping("/detect/log-volume")
    public List<AnomalyDto> detectLogVolume(
            @Parameter(description = "Service to analyze, all services when absent", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes (10-1440)", example = "60")
            @RequestParam(name = "window_minutes", required = false) Integer windowMinutes,
            @Parameter(description = "Bucket resolution in minutes", example = "1")
            @RequestParam(name = "bucket_minutes", required = false) Integer bucketMinutes,
            @Parameter(description = "Z-score threshold for this request", example = "1.0")
            @RequestParam(name = "sensitivity", required = false) Double sensitivity) {
        return anomalyQueryService.detect(Metrics.LOG_VOLUME, service, windowMinutes, bucketMinutes, sensitivity);
    }

    @GetMapping("/detect/error-rate")
    public List<AnomalyDto> detectErrorRate(
            @Parameter(description = "Service to analyze, all services when absent", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes (10-1440)", example = "60")
            @RequestParam(name = "window_minutes", required = false) Integer windowMinutes,
            @Parameter(description = "Bucket resolution in minutes", example = "1")
            @RequestParam(name = "bucket_minutes", required = false) Integer bucketMinutes,
            @Parameter(description = "Z-score threshold for this request", example = "1.0")
            @RequestParam(name = "sensitivity", required = false) Double sensitivity) {
        return anomalyQueryService.detect(Metrics.ERROR_RATE, service, windowMinutes, bucketMinutes, sensitivity);
    }

    @GetMapping("/report")
    public AnomalyReportDto report(
            @Parameter(description = "Service to analyze, all services when absent", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes (10-1440)", example = "60")
            @RequestParam(name = "window_minutes", required = false) Integer windowMinutes,
            @Parameter(description = "Bucket resolution in minutes", example = "1")
            @RequestParam(name = "bucket_minutes", required = false) Integer bucketMinutes,
            @Parameter(description = "Z-score threshold for this request", example = "1.0")
            @RequestParam(name = "sensitivity", required = false) Double sensitivity) {
        return anomalyQueryService.report(service, windowMinutes, bucketMinutes, sensitivity);
    }

    @GetMapping("/baseline")
    public BaselineStatsDto baseline(
            @Parameter(description = "Metric name", required = true, example = "log_volume")
            @RequestParam(name = "metric") String metric,
            @Parameter(description = "Service to analyze, all services when absent", example = "payment-service")
            @RequestParam(name = "service", required = false) String service,
            @Parameter(description = "Time window in minutes (10-1440)", example = "60")
            @RequestParam(name = "window_minutes", required = false) Integer windowMinutes,
            @Parameter(description = "Bucket resolution in minutes", example = "1")
            @RequestParam(name = "bucket_minutes", required = false) Integer bucketMinutes) {
        return anomalyQueryService.baseline(metric, service, windowMinutes, bucketMinutes);
    }
}

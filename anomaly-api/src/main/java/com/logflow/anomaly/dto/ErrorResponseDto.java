package com.logflow.anomaly.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorResponseDto {
    private String error;
    private String message;
    private String field;
}

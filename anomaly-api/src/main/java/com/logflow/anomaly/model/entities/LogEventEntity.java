package com.logflow.anomaly.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * A processed log line as written by the log processor. Read-only from this service.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(name = "t_log_event", schema = "public")
public class LogEventEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "ts_utc", nullable = false)
    private Instant tsUtc;

    @Column(name = "service", nullable = false, length = 128)
    private String service;

    @Column(name = "level", nullable = false, length = 16)
    private String level;

    @Column(name = "message")
    private String message;

}

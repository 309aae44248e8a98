package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import io.github.shiftlog.workforce.domain.model.BreakKind;

import java.io.Serializable;
import java.time.Instant;

public class BreakInterval implements Serializable {
    private Long id;
    private Long shiftId;
    private Instant startAt;
    private Instant endAt; // null while open
    private BreakKind kind;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getShiftId() { return shiftId; }
    public void setShiftId(Long shiftId) { this.shiftId = shiftId; }
    public Instant getStartAt() { return startAt; }
    public void setStartAt(Instant startAt) { this.startAt = startAt; }
    public Instant getEndAt() { return endAt; }
    public void setEndAt(Instant endAt) { this.endAt = endAt; }
    public BreakKind getKind() { return kind; }
    public void setKind(BreakKind kind) { this.kind = kind; }

    public boolean isOpen() { return endAt == null; }
}

package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import io.github.shiftlog.workforce.domain.model.ShiftStatus;

import java.io.Serializable;
import java.time.Instant;

/**
 * Scheduled block of work for one employee.
 * Status only changes through the lifecycle transitions in ShiftLifecycleService.
 */
public class Shift implements Serializable {
    private Long id;
    private Long employeeId;
    private Instant plannedStartAt;
    private Instant plannedEndAt;
    private Instant actualStartAt;
    private Instant actualEndAt;
    private ShiftStatus status;
    private Instant createdAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEmployeeId() { return employeeId; }
    public void setEmployeeId(Long employeeId) { this.employeeId = employeeId; }
    public Instant getPlannedStartAt() { return plannedStartAt; }
    public void setPlannedStartAt(Instant plannedStartAt) { this.plannedStartAt = plannedStartAt; }
    public Instant getPlannedEndAt() { return plannedEndAt; }
    public void setPlannedEndAt(Instant plannedEndAt) { this.plannedEndAt = plannedEndAt; }
    public Instant getActualStartAt() { return actualStartAt; }
    public void setActualStartAt(Instant actualStartAt) { this.actualStartAt = actualStartAt; }
    public Instant getActualEndAt() { return actualEndAt; }
    public void setActualEndAt(Instant actualEndAt) { this.actualEndAt = actualEndAt; }
    public ShiftStatus getStatus() { return status; }
    public void setStatus(ShiftStatus status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}

package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import io.github.shiftlog.workforce.domain.model.RatingSource;
import io.github.shiftlog.workforce.domain.model.RatingStatus;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One row per (employee, period). Written only by RatingService.
 */
public class EmployeeRating implements Serializable {
    private Long id;
    private Long employeeId;
    private Long companyId;
    private LocalDate periodStart;
    private LocalDate periodEnd; // exclusive
    private BigDecimal rating;
    private BigDecimal manualAdjustment;
    private RatingSource source;
    private RatingStatus status;
    private Instant updatedAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEmployeeId() { return employeeId; }
    public void setEmployeeId(Long employeeId) { this.employeeId = employeeId; }
    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }
    public LocalDate getPeriodStart() { return periodStart; }
    public void setPeriodStart(LocalDate periodStart) { this.periodStart = periodStart; }
    public LocalDate getPeriodEnd() { return periodEnd; }
    public void setPeriodEnd(LocalDate periodEnd) { this.periodEnd = periodEnd; }
    public BigDecimal getRating() { return rating; }
    public void setRating(BigDecimal rating) { this.rating = rating; }
    public BigDecimal getManualAdjustment() { return manualAdjustment; }
    public void setManualAdjustment(BigDecimal manualAdjustment) { this.manualAdjustment = manualAdjustment; }
    public RatingSource getSource() { return source; }
    public void setSource(RatingSource source) { this.source = source; }
    public RatingStatus getStatus() { return status; }
    public void setStatus(RatingStatus status) { this.status = status; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}

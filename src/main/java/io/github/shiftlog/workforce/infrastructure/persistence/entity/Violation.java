package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import io.github.shiftlog.workforce.domain.model.ViolationSource;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only violation fact. {@code penalty} is copied from the rule at creation time.
 */
public class Violation implements Serializable {
    private Long id;
    private Long employeeId;
    private Long companyId;
    private Long ruleId;
    private Long shiftId; // set for auto-detected violations
    private ViolationSource source;
    private BigDecimal penalty;
    private String reason;
    private String createdBy;
    private Instant createdAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEmployeeId() { return employeeId; }
    public void setEmployeeId(Long employeeId) { this.employeeId = employeeId; }
    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }
    public Long getRuleId() { return ruleId; }
    public void setRuleId(Long ruleId) { this.ruleId = ruleId; }
    public Long getShiftId() { return shiftId; }
    public void setShiftId(Long shiftId) { this.shiftId = shiftId; }
    public ViolationSource getSource() { return source; }
    public void setSource(ViolationSource source) { this.source = source; }
    public BigDecimal getPenalty() { return penalty; }
    public void setPenalty(BigDecimal penalty) { this.penalty = penalty; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}

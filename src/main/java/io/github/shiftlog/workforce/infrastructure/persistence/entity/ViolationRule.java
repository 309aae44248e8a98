package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Company-scoped violation rule. Deactivated instead of deleted while violations reference it.
 */
public class ViolationRule implements Serializable {
    private Long id;
    private Long companyId;
    private String code;
    private String name;
    private BigDecimal penaltyPercent;
    private boolean autoDetectable;
    private boolean active;
    private Instant createdAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code == null ? null : code.trim(); }
    public String getName() { return name; }
    public void setName(String name) { this.name = name == null ? null : name.trim(); }
    public BigDecimal getPenaltyPercent() { return penaltyPercent; }
    public void setPenaltyPercent(BigDecimal penaltyPercent) { this.penaltyPercent = penaltyPercent; }
    public boolean isAutoDetectable() { return autoDetectable; }
    public void setAutoDetectable(boolean autoDetectable) { this.autoDetectable = autoDetectable; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}

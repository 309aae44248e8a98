package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.Instant;

public class EmployeeInvite implements Serializable {
    private Long id;
    private Long companyId;
    private String code;
    private String fullName;
    private String position;
    private Instant createdAt;
    private Instant expiresAt;
    private Long usedByEmployee;
    private Instant usedAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName == null ? null : fullName.trim(); }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position == null ? null : position.trim(); }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public Long getUsedByEmployee() { return usedByEmployee; }
    public void setUsedByEmployee(Long usedByEmployee) { this.usedByEmployee = usedByEmployee; }
    public Instant getUsedAt() { return usedAt; }
    public void setUsedAt(Instant usedAt) { this.usedAt = usedAt; }

    public boolean isUsed() { return usedAt != null || usedByEmployee != null; }
}

package io.github.shiftlog.workforce.infrastructure.persistence.entity;

import io.github.shiftlog.workforce.domain.model.EmployeeStatus;

import java.io.Serializable;
import java.time.Instant;

public class Employee implements Serializable {
    private Long id;
    private Long companyId;
    private String fullName;
    private String position;
    private EmployeeStatus status;
    private String telegramUserId; // external identity, unique when present
    private String timezone;
    private Instant createdAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getCompanyId() { return companyId; }
    public void setCompanyId(Long companyId) { this.companyId = companyId; }
    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName == null ? null : fullName.trim(); }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position == null ? null : position.trim(); }
    public EmployeeStatus getStatus() { return status; }
    public void setStatus(EmployeeStatus status) { this.status = status; }
    public String getTelegramUserId() { return telegramUserId; }
    public void setTelegramUserId(String telegramUserId) { this.telegramUserId = telegramUserId; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}

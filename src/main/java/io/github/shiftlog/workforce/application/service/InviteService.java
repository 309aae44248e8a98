package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.cache.CompanyChangeNotifier;
import io.github.shiftlog.workforce.application.dto.InviteRedemption;
import io.github.shiftlog.workforce.application.repository.EmployeeInviteRepository;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import io.github.shiftlog.workforce.domain.exception.AlreadyUsedException;
import io.github.shiftlog.workforce.domain.exception.ConflictException;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.ScopeMismatchException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.EmployeeStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeInvite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Single-use onboarding codes.
 * <p>
 * Redemption is claim-first: the conditional update on the unused invite decides the one winner,
 * and the employee binding happens in the same transaction afterwards.
 */
@Service
@Slf4j
public class InviteService {

    private static final int MAX_CODE_ATTEMPTS = 3;

    private final EmployeeInviteRepository inviteRepository;
    private final EmployeeRepository employeeRepository;
    private final CompanyChangeNotifier changeNotifier;
    private final WorkforceProperties properties;
    private final Clock clock;
    private final SecureRandom random;

    @Autowired
    public InviteService(EmployeeInviteRepository inviteRepository,
                         EmployeeRepository employeeRepository,
                         CompanyChangeNotifier changeNotifier,
                         WorkforceProperties properties,
                         Clock clock) {
        this(inviteRepository, employeeRepository, changeNotifier, properties, clock, new SecureRandom());
    }

    InviteService(EmployeeInviteRepository inviteRepository,
                  EmployeeRepository employeeRepository,
                  CompanyChangeNotifier changeNotifier,
                  WorkforceProperties properties,
                  Clock clock,
                  SecureRandom random) {
        this.inviteRepository = inviteRepository;
        this.employeeRepository = employeeRepository;
        this.changeNotifier = changeNotifier;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    public EmployeeInvite issueInvite(Long companyId, String fullName, String position, Instant expiresAt) {
        if (companyId == null) {
            throw new ValidationException("companyId is required");
        }
        Instant now = clock.instant();
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new ValidationException("expiresAt must be in the future");
        }
        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            EmployeeInvite invite = new EmployeeInvite();
            invite.setCompanyId(companyId);
            invite.setCode(newCode());
            invite.setFullName(fullName);
            invite.setPosition(position);
            invite.setCreatedAt(now);
            invite.setExpiresAt(expiresAt);
            try {
                inviteRepository.save(invite);
                log.info("Invite issued: inviteId={}, companyId={}, expiresAt={}", invite.getId(), companyId, expiresAt);
                return invite;
            } catch (DuplicateKeyException e) {
                log.warn("Invite code collision on attempt {}", attempt);
            }
        }
        throw new ConflictException("could not generate a unique invite code");
    }

    /**
     * Redeems {@code code} for an existing employee of the same company, or for an external identity
     * whose employee record is created or re-linked to the invite's company.
     */
    @Transactional
    public Employee redeemInvite(String code, InviteRedemption redeemer) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("code is required");
        }
        if (redeemer == null || (redeemer.employeeId() == null && isBlank(redeemer.telegramUserId()))) {
            throw new ValidationException("employeeId or telegramUserId is required");
        }
        EmployeeInvite invite = getByCode(code);
        if (invite.isUsed()) {
            throw new AlreadyUsedException(code);
        }
        Instant now = clock.instant();
        if (invite.getExpiresAt() != null && !invite.getExpiresAt().isAfter(now)) {
            throw new ValidationException("invite expired at " + invite.getExpiresAt());
        }
        if (inviteRepository.claim(code, now) == 0) {
            throw new AlreadyUsedException(code);
        }

        Employee employee = redeemer.byEmployee()
                ? bindExisting(invite, redeemer.employeeId())
                : bindExternal(invite, redeemer.telegramUserId().trim(), now);
        inviteRepository.assignEmployee(invite.getId(), employee.getId());
        invite.setUsedAt(now);
        invite.setUsedByEmployee(employee.getId());

        log.info("Invite redeemed: inviteId={}, companyId={}, employeeId={}",
                invite.getId(), invite.getCompanyId(), employee.getId());
        changeNotifier.companyChanged(invite.getCompanyId());
        return employee;
    }

    public EmployeeInvite getByCode(String code) {
        EmployeeInvite invite = inviteRepository.findByCode(code);
        if (invite == null) {
            throw new NotFoundException("Invite", code);
        }
        return invite;
    }

    public List<EmployeeInvite> listInvites(Long companyId) {
        return inviteRepository.listByCompany(companyId);
    }

    /** Deletes unused invites past their expiry or older than the retention window. */
    @Transactional
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = inviteRepository.deleteExpiredUnused(now, now.minus(properties.getInvite().getRetention()));
        if (removed > 0) {
            log.info("Removed {} expired invites", removed);
        }
        return removed;
    }

    private Employee bindExisting(EmployeeInvite invite, Long employeeId) {
        Employee employee = employeeRepository.findById(employeeId);
        if (employee == null) {
            throw new NotFoundException("Employee", employeeId);
        }
        if (!employee.getCompanyId().equals(invite.getCompanyId())) {
            throw new ScopeMismatchException("Employee", employeeId, invite.getCompanyId());
        }
        applyPrefill(employee, invite);
        employeeRepository.update(employee);
        return employee;
    }

    private Employee bindExternal(EmployeeInvite invite, String telegramUserId, Instant now) {
        Employee employee = employeeRepository.findByTelegramUserId(telegramUserId);
        if (employee == null) {
            employee = new Employee();
            employee.setCompanyId(invite.getCompanyId());
            employee.setTelegramUserId(telegramUserId);
            employee.setFullName(invite.getFullName() != null ? invite.getFullName() : telegramUserId);
            employee.setPosition(invite.getPosition());
            employee.setStatus(EmployeeStatus.ACTIVE);
            employee.setCreatedAt(now);
            employeeRepository.save(employee);
            log.info("Employee created from invite: employeeId={}, companyId={}", employee.getId(), invite.getCompanyId());
            return employee;
        }
        if (!employee.getCompanyId().equals(invite.getCompanyId())) {
            log.info("Employee {} moves from company {} to {} via invite",
                    employee.getId(), employee.getCompanyId(), invite.getCompanyId());
            employee.setCompanyId(invite.getCompanyId());
        }
        applyPrefill(employee, invite);
        employee.setStatus(EmployeeStatus.ACTIVE);
        employeeRepository.update(employee);
        return employee;
    }

    private static void applyPrefill(Employee employee, EmployeeInvite invite) {
        if (invite.getFullName() != null) {
            employee.setFullName(invite.getFullName());
        }
        if (invite.getPosition() != null) {
            employee.setPosition(invite.getPosition());
        }
    }

    private String newCode() {
        byte[] bytes = new byte[properties.getInvite().getCodeBytes()];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

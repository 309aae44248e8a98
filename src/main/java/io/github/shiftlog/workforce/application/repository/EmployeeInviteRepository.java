package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeInvite;

import java.time.Instant;
import java.util.List;

public interface EmployeeInviteRepository {
    void save(EmployeeInvite invite);

    EmployeeInvite findByCode(String code);

    List<EmployeeInvite> listByCompany(Long companyId);

    /**
     * Marks the invite used only if nobody has used it yet.
     *
     * @return 1 for the single winning caller, 0 for everyone else
     */
    int claim(String code, Instant usedAt);

    int assignEmployee(Long inviteId, Long employeeId);

    /** Deletes unused invites that expired before {@code now} or were created before {@code createdBefore}. */
    int deleteExpiredUnused(Instant now, Instant createdBefore);
}

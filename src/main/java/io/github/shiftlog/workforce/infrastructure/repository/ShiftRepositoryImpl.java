package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.mapper.ShiftMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class ShiftRepositoryImpl implements ShiftRepository {

    private final ShiftMapper mapper;

    public ShiftRepositoryImpl(ShiftMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Shift findById(Long id) {
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    public void save(Shift shift) {
        mapper.insert(shift);
    }

    @Override
    public int updateStatus(Long id, ShiftStatus expected, ShiftStatus next, Instant actualStartAt, Instant actualEndAt) {
        return mapper.updateStatusIfCurrent(id, expected, next, actualStartAt, actualEndAt);
    }

    @Override
    public List<Shift> listActiveByCompany(Long companyId) {
        return mapper.selectActiveByCompany(companyId);
    }

    @Override
    public List<Shift> listScheduledStartingBefore(Instant cutoff) {
        return mapper.selectScheduledStartingBefore(cutoff);
    }

    @Override
    public List<Shift> listStartedSince(Instant since) {
        return mapper.selectStartedSince(since);
    }
}

package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.BreakIntervalRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.BreakIntervalMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class BreakIntervalRepositoryImpl implements BreakIntervalRepository {

    private final BreakIntervalMapper mapper;

    public BreakIntervalRepositoryImpl(BreakIntervalMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public int insertIfNoneOpen(BreakInterval interval) {
        return mapper.insertIfNoneOpen(interval);
    }

    @Override
    public int closeOpen(Long shiftId, Instant endAt) {
        return mapper.closeOpen(shiftId, endAt);
    }

    @Override
    public BreakInterval findOpen(Long shiftId) {
        return mapper.selectOpen(shiftId);
    }

    @Override
    public List<BreakInterval> listByShift(Long shiftId) {
        return mapper.selectByShift(shiftId);
    }
}

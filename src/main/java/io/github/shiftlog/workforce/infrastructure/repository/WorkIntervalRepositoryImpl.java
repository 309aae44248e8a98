package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.WorkIntervalRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.WorkIntervalMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.WorkInterval;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class WorkIntervalRepositoryImpl implements WorkIntervalRepository {

    private final WorkIntervalMapper mapper;

    public WorkIntervalRepositoryImpl(WorkIntervalMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public int insertIfNoneOpen(WorkInterval interval) {
        return mapper.insertIfNoneOpen(interval);
    }

    @Override
    public int closeOpen(Long shiftId, Instant endAt) {
        return mapper.closeOpen(shiftId, endAt);
    }

    @Override
    public WorkInterval findOpen(Long shiftId) {
        return mapper.selectOpen(shiftId);
    }

    @Override
    public List<WorkInterval> listByShift(Long shiftId) {
        return mapper.selectByShift(shiftId);
    }
}

package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.EmployeeMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class EmployeeRepositoryImpl implements EmployeeRepository {

    private final EmployeeMapper mapper;

    public EmployeeRepositoryImpl(EmployeeMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Employee findById(Long id) {
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    public Employee findByTelegramUserId(String telegramUserId) {
        return mapper.selectByTelegramUserId(telegramUserId);
    }

    @Override
    public void save(Employee employee) {
        mapper.insert(employee);
    }

    @Override
    public void update(Employee employee) {
        mapper.updateByPrimaryKey(employee);
    }

    @Override
    public List<Employee> listByCompany(Long companyId) {
        return mapper.selectByCompany(companyId);
    }
}

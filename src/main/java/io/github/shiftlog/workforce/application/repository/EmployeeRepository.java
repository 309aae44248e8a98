package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;

import java.util.List;

public interface EmployeeRepository {
    Employee findById(Long id);

    Employee findByTelegramUserId(String telegramUserId);

    void save(Employee employee);

    void update(Employee employee);

    List<Employee> listByCompany(Long companyId);
}

package io.github.shiftlog.workforce.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@ConditionalOnProperty(prefix = "workforce.schema", name = "init", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS employee (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "company_id BIGINT NOT NULL, " +
                    "full_name TEXT NOT NULL, " +
                    "position TEXT, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'ACTIVE' CHECK (status IN ('ACTIVE','INACTIVE','ON_LEAVE')), " +
                    "telegram_user_id TEXT UNIQUE, " +
                    "timezone TEXT, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_employee_company ON employee (company_id)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS shift (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "employee_id BIGINT NOT NULL REFERENCES employee(id) ON DELETE CASCADE, " +
                    "planned_start_at TIMESTAMPTZ NOT NULL, " +
                    "planned_end_at TIMESTAMPTZ NOT NULL, " +
                    "actual_start_at TIMESTAMPTZ, " +
                    "actual_end_at TIMESTAMPTZ, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'SCHEDULED' " +
                    "CHECK (status IN ('SCHEDULED','ACTIVE','PAUSED','COMPLETED','CANCELLED')), " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "CONSTRAINT chk_shift_planned CHECK (planned_end_at > planned_start_at)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_shift_employee ON shift (employee_id)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_shift_status ON shift (status)");

            // Intervals: the partial unique indexes back the "one open interval per kind" rule
            jdbc.execute("CREATE TABLE IF NOT EXISTS work_interval (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "shift_id BIGINT NOT NULL REFERENCES shift(id) ON DELETE CASCADE, " +
                    "start_at TIMESTAMPTZ NOT NULL, " +
                    "end_at TIMESTAMPTZ, " +
                    "CONSTRAINT chk_work_interval_order CHECK (end_at IS NULL OR end_at >= start_at)" +
                    ")");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_work_interval_open ON work_interval (shift_id) WHERE end_at IS NULL");
            jdbc.execute("CREATE TABLE IF NOT EXISTS break_interval (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "shift_id BIGINT NOT NULL REFERENCES shift(id) ON DELETE CASCADE, " +
                    "start_at TIMESTAMPTZ NOT NULL, " +
                    "end_at TIMESTAMPTZ, " +
                    "kind VARCHAR(8) NOT NULL DEFAULT 'BREAK' CHECK (kind IN ('LUNCH','BREAK','OTHER')), " +
                    "CONSTRAINT chk_break_interval_order CHECK (end_at IS NULL OR end_at >= start_at)" +
                    ")");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_break_interval_open ON break_interval (shift_id) WHERE end_at IS NULL");

            jdbc.execute("CREATE TABLE IF NOT EXISTS violation_rule (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "company_id BIGINT NOT NULL, " +
                    "code VARCHAR(64) NOT NULL, " +
                    "name TEXT NOT NULL, " +
                    "penalty_percent NUMERIC(5,2) NOT NULL CHECK (penalty_percent >= 0), " +
                    "auto_detectable BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "UNIQUE (company_id, code)" +
                    ")");

            jdbc.execute("CREATE TABLE IF NOT EXISTS violation (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "employee_id BIGINT NOT NULL REFERENCES employee(id) ON DELETE CASCADE, " +
                    "company_id BIGINT NOT NULL, " +
                    "rule_id BIGINT NOT NULL REFERENCES violation_rule(id), " +
                    "shift_id BIGINT REFERENCES shift(id) ON DELETE SET NULL, " +
                    "source VARCHAR(8) NOT NULL CHECK (source IN ('MANUAL','AUTO')), " +
                    "penalty NUMERIC(5,2) NOT NULL, " +
                    "reason TEXT, " +
                    "created_by TEXT, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_violation_employee_created ON violation (employee_id, created_at)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_violation_company_created ON violation (company_id, created_at)");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_violation_auto_shift_rule ON violation (shift_id, rule_id) WHERE source = 'AUTO' AND shift_id IS NOT NULL");

            jdbc.execute("CREATE TABLE IF NOT EXISTS employee_rating (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "employee_id BIGINT NOT NULL REFERENCES employee(id) ON DELETE CASCADE, " +
                    "company_id BIGINT NOT NULL, " +
                    "period_start DATE NOT NULL, " +
                    "period_end DATE NOT NULL, " +
                    "rating NUMERIC(5,2) NOT NULL CHECK (rating BETWEEN 0 AND 100), " +
                    "manual_adjustment NUMERIC(6,2) NOT NULL DEFAULT 0, " +
                    "source VARCHAR(20) NOT NULL DEFAULT 'COMPUTED' CHECK (source IN ('COMPUTED','MANUALLY_ADJUSTED')), " +
                    "status VARCHAR(16) NOT NULL CHECK (status IN ('ACTIVE','WARNING','TERMINATED')), " +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "UNIQUE (employee_id, period_start, period_end), " +
                    "CONSTRAINT chk_rating_period CHECK (period_end > period_start)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_employee_rating_company_period ON employee_rating (company_id, period_start, period_end)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS employee_invite (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "company_id BIGINT NOT NULL, " +
                    "code VARCHAR(64) NOT NULL UNIQUE, " +
                    "full_name TEXT, " +
                    "position TEXT, " +
                    "created_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                    "expires_at TIMESTAMPTZ, " +
                    "used_by_employee BIGINT REFERENCES employee(id), " +
                    "used_at TIMESTAMPTZ" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_employee_invite_unused ON employee_invite (created_at) WHERE used_at IS NULL");

            log.info("Schema checked/initialized: shift, interval, violation, rating and invite tables ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage(), e);
        }
    }
}

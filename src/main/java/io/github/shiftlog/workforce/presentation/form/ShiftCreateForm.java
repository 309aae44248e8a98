package io.github.shiftlog.workforce.presentation.form;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class ShiftCreateForm {
    @NotNull(message = "employeeId is required")
    private Long employeeId;

    @NotNull(message = "plannedStartAt is required")
    private Instant plannedStartAt;

    @NotNull(message = "plannedEndAt is required")
    private Instant plannedEndAt;
}

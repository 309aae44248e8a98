package io.github.shiftlog.workforce.presentation.form;

import io.github.shiftlog.workforce.domain.model.ViolationSource;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ViolationCreateForm {
    @NotNull(message = "employeeId is required")
    private Long employeeId;

    @NotNull(message = "ruleId is required")
    private Long ruleId;

    private ViolationSource source = ViolationSource.MANUAL;

    @Size(max = 1000, message = "reason must be at most 1000 characters")
    private String reason;

    @Size(max = 200)
    private String createdBy;
}

package io.github.shiftlog.workforce.presentation.form;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ViolationRuleForm {
    @NotBlank(message = "code is required")
    @Size(max = 64)
    private String code;

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "penaltyPercent is required")
    @DecimalMin(value = "0", message = "penaltyPercent must be at least 0")
    @DecimalMax(value = "100", message = "penaltyPercent must be at most 100")
    private BigDecimal penaltyPercent;

    private boolean autoDetectable;
}

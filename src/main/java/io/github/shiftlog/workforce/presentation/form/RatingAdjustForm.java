package io.github.shiftlog.workforce.presentation.form;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class RatingAdjustForm {
    @NotNull(message = "delta is required")
    @DecimalMin(value = "-100", message = "delta must be between -100 and 100")
    @DecimalMax(value = "100", message = "delta must be between -100 and 100")
    private BigDecimal delta;

    @NotNull(message = "periodStart is required")
    private LocalDate periodStart;

    @NotNull(message = "periodEnd is required")
    private LocalDate periodEnd;
}

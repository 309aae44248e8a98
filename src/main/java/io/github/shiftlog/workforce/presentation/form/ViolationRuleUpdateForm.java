package io.github.shiftlog.workforce.presentation.form;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

/** Every field is optional; absent fields keep their stored value. */
@Data
public class ViolationRuleUpdateForm {
    private String name;

    @DecimalMin(value = "0", message = "penaltyPercent must be at least 0")
    @DecimalMax(value = "100", message = "penaltyPercent must be at most 100")
    private BigDecimal penaltyPercent;

    private Boolean autoDetectable;
    private Boolean active;
}

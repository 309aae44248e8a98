package io.github.shiftlog.workforce.presentation.form;

import io.github.shiftlog.workforce.domain.model.BreakKind;
import lombok.Data;

@Data
public class ShiftPauseForm {
    private BreakKind kind; // defaults to BREAK
}

package com.spantagger.interfaces.api.dto;

import com.spantagger.domain.tagging.model.Repair;
import com.spantagger.domain.tagging.model.ValidationResult;

import java.util.List;

public record ValidationResponse(boolean valid, List<Repair> repairs) {

    public static ValidationResponse from(ValidationResult result) {
        return new ValidationResponse(result.valid(), result.repairs());
    }
}

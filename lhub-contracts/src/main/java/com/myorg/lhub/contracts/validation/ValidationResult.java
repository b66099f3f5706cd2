package com.myorg.lhub.contracts.validation;

import com.myorg.lhub.contracts.core.envelope.HubEvent;

public record ValidationResult(HubEvent event, ValidationError error) {

    public static ValidationResult ok(HubEvent event) {
        return new ValidationResult(event, null);
    }

    public static ValidationResult rejected(ValidationError error) {
        return new ValidationResult(null, error);
    }

    public boolean isValid() {
        return error == null;
    }
}

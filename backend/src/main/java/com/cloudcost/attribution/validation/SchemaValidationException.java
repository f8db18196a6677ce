package com.cloudcost.attribution.validation;

import com.cloudcost.attribution.domain.model.CostField;
import lombok.Getter;

import java.util.Set;

@Getter
public class SchemaValidationException extends AttributionValidationException {

    private final Set<CostField> missingFields;

    public SchemaValidationException(Set<CostField> missingFields) {
        super("Missing required columns: " + missingFields.stream()
                .map(CostField::getColumnName)
                .sorted()
                .toList());
        this.missingFields = Set.copyOf(missingFields);
    }
}

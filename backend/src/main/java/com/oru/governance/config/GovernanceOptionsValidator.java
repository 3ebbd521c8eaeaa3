package com.oru.governance.config;

import com.oru.governance.domain.exception.InvalidConfigurationException;
import com.oru.governance.domain.model.GovernanceOptions;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks {@link GovernanceOptions} against its bean constraints and the
 * cross-field rules bean validation cannot express.
 */
@Component
@RequiredArgsConstructor
public class GovernanceOptionsValidator {

    private final Validator validator;

    /**
     * @throws InvalidConfigurationException listing every violation, sorted by field
     */
    public void validate(GovernanceOptions options) {
        if (options == null) {
            throw new InvalidConfigurationException("governance options must be set");
        }
        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<GovernanceOptions> violation : validator.validate(options)) {
            violations.add(violation.getPropertyPath() + " " + violation.getMessage()
                    + " (was " + violation.getInvalidValue() + ")");
        }
        violations.sort(String::compareTo);

        if (options.getOvercommitWarning() >= options.getOvercommitCritical()) {
            violations.add("overcommitWarning must be below overcommitCritical");
        }
        if (options.getOverProvisionedRatio() >= options.getUnderProvisionedRatio()) {
            violations.add("overProvisionedRatio must be below underProvisionedRatio");
        }
        if (options.getTargetSamplesPerSeries() >= options.getMaxSamplesPerSeries()) {
            violations.add("targetSamplesPerSeries must be below maxSamplesPerSeries");
        }
        if (options.getMinimumStep() != null && options.getBatchDeadline() != null
                && options.getMinimumStep().compareTo(options.getBatchDeadline()) > 0) {
            violations.add("minimumStep must not exceed batchDeadline");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }
}

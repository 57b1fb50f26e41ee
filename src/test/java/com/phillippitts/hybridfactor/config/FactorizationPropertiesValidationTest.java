package com.phillippitts.hybridfactor.config;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FactorizationPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new FactorizationProperties())).isEmpty();
    }

    @Test
    void failsOnNonPositiveTrialLimit() {
        FactorizationProperties p = new FactorizationProperties();
        p.setTrialLimit(0);

        assertThat(paths(validator.validate(p))).containsExactly("trialLimit");
    }

    @Test
    void failsOnZeroTimeout() {
        FactorizationProperties p = new FactorizationProperties();
        p.setTimeout(Duration.ZERO);

        assertThat(paths(validator.validate(p))).containsExactly("durationsValid");
    }

    @Test
    void failsWhenDefaultWorkerCountExceedsMax() {
        FactorizationProperties p = new FactorizationProperties();
        p.setWorkerCount(8);
        p.setMaxWorkerCount(4);

        assertThat(paths(validator.validate(p))).containsExactly("workerCountWithinMax");
    }

    @Test
    void cascadesIntoNestedGroups() {
        FactorizationProperties p = new FactorizationProperties();
        p.getPMinusOne().setBatchSize(0);
        p.getRho().setMaxIterations(0);

        assertThat(paths(validator.validate(p)))
                .containsExactlyInAnyOrder("pMinusOne.batchSize", "rho.maxIterations");
    }

    private static Set<String> paths(Set<ConstraintViolation<FactorizationProperties>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath().toString())
                .collect(java.util.stream.Collectors.toSet());
    }
}

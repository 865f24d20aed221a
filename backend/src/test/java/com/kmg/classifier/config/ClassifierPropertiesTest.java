package com.kmg.classifier.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierPropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("the shipped defaults are valid")
    void defaultsAreValid() {
        assertThat(validator.validate(validProperties())).isEmpty();
    }

    @Test
    @DisplayName("a stale threshold shorter than a worst-case call is rejected")
    void staleAfterShorterThanCallTimeouts() {
        ClassifierProperties properties = validProperties();
        properties.getRecovery().setStaleAfter(Duration.ofSeconds(5));
        properties.getWorker().setClassifyTimeout(Duration.ofMinutes(10));

        Set<ConstraintViolation<ClassifierProperties>> violations = validator.validate(properties);

        assertThat(violations)
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("staleAfterBeyondCallTimeouts");
    }

    @Test
    @DisplayName("a stale threshold equal to payload plus classify timeout is still too short")
    void staleAfterEqualToCallTimeouts() {
        ClassifierProperties properties = validProperties();
        properties.getWorker().setPayloadTimeout(Duration.ofSeconds(10));
        properties.getWorker().setClassifyTimeout(Duration.ofSeconds(50));
        properties.getRecovery().setStaleAfter(Duration.ofMinutes(1));

        assertThat(validator.validate(properties)).hasSize(1);

        properties.getRecovery().setStaleAfter(Duration.ofSeconds(61));
        assertThat(validator.validate(properties)).isEmpty();
    }

    private static ClassifierProperties validProperties() {
        ClassifierProperties properties = new ClassifierProperties();
        properties.setBaseDir("/tmp/classifier");
        properties.getState().setDbPath("/tmp/classifier/state/classifier.db");
        properties.getPayload().setRootDir("/tmp/classifier/uploads");
        return properties;
    }
}

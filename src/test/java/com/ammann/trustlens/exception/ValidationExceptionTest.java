package com.ammann.trustlens.exception;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationExceptionTest
{

    @ParameterizedTest
    @CsvSource({
            "limit,-1,non-negative integer",
            "window,forever,duration such as 30min or 2h"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
    }

    @Test
    void isAnApiException()
    {
        assertThat(new ValidationException("bad")).isInstanceOf(ApiException.class);
    }
}

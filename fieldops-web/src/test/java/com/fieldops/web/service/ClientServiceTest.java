package com.fieldops.web.service;

import com.fieldops.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientServiceTest {

    @Test
    void normalizeDocument_shouldKeepDigitsOfCpfAndCnpj() {
        assertThat(ClientService.normalizeDocument("123.456.789-01")).isEqualTo("12345678901");
        assertThat(ClientService.normalizeDocument("12.345.678/0001-95")).isEqualTo("12345678000195");
    }

    @Test
    void normalizeDocument_blank_shouldReturnNull() {
        assertThat(ClientService.normalizeDocument(null)).isNull();
        assertThat(ClientService.normalizeDocument(" - ")).isNull();
    }

    @Test
    void normalizeDocument_wrongLength_shouldFail() {
        assertThatThrownBy(() -> ClientService.normalizeDocument("1234"))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo("INVALID_DOCUMENT");
    }
}

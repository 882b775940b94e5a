package com.fieldops.web.bulk;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueNormalizersTest {

    @Test
    void normalizeHeader_shouldFoldAccentsCaseAndSeparators() {
        assertThat(ValueNormalizers.normalizeHeader("Client Document")).isEqualTo("client_document");
        assertThat(ValueNormalizers.normalizeHeader("client-document")).isEqualTo("client_document");
        assertThat(ValueNormalizers.normalizeHeader(" Descrição* ")).isEqualTo("descricao");
        assertThat(ValueNormalizers.normalizeHeader("")).isEmpty();
    }

    @Test
    void bool_shouldAcceptEnglishAndPortugueseValues() {
        assertThat(ValueNormalizers.bool("Yes")).isEqualTo(Boolean.TRUE);
        assertThat(ValueNormalizers.bool("sim")).isEqualTo(Boolean.TRUE);
        assertThat(ValueNormalizers.bool("0")).isEqualTo(Boolean.FALSE);
        assertThat(ValueNormalizers.bool("não")).isEqualTo(Boolean.FALSE);
        assertThatThrownBy(() -> ValueNormalizers.bool("maybe")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void digits_shouldStripFormatting() {
        assertThat(ValueNormalizers.digits("123.456.789-01")).isEqualTo("12345678901");
    }

    @Test
    void email_shouldLowercaseAndTrim() {
        assertThat(ValueNormalizers.email("  Ana@Example.COM ")).isEqualTo("ana@example.com");
        assertThat(ValueNormalizers.isValidEmail("ana@example.com")).isTrue();
        assertThat(ValueNormalizers.isValidEmail("ana@example")).isFalse();
        assertThat(ValueNormalizers.isValidEmail(null)).isFalse();
    }

    @Test
    void yesNo_shouldTreatNullAsYes() {
        assertThat(ValueNormalizers.yesNo(null)).isEqualTo("yes");
        assertThat(ValueNormalizers.yesNo(false)).isEqualTo("no");
    }
}

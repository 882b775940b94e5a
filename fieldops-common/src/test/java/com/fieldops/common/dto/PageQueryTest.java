package com.fieldops.common.dto;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageQueryTest {

    @Test
    void of_shouldApplyDefaultsAndClampPageSize() {
        PageQuery defaults = PageQuery.of(null, null);
        assertThat(defaults.getPage()).isEqualTo(1);
        assertThat(defaults.getPageSize()).isEqualTo(PageQuery.DEFAULT_PAGE_SIZE);
        assertThat(defaults.offset()).isZero();

        PageQuery clamped = PageQuery.of(-3, 10_000);
        assertThat(clamped.getPage()).isEqualTo(1);
        assertThat(clamped.getPageSize()).isEqualTo(PageQuery.MAX_PAGE_SIZE);
    }

    @Test
    void offset_shouldSkipPreviousPages() {
        assertThat(PageQuery.of(3, 50).offset()).isEqualTo(100L);
    }

    @Test
    void offset_hugePage_shouldNotOverflow() {
        PageQuery query = PageQuery.of(Integer.MAX_VALUE, PageQuery.MAX_PAGE_SIZE);

        assertThat(query.offset()).isPositive();
        assertThat(query.offset()).isEqualTo((Integer.MAX_VALUE - 1L) * PageQuery.MAX_PAGE_SIZE);
    }

    @Test
    void toResult_shouldCarryPaging() {
        PageResult<String> result = PageQuery.of(2, 5).toResult(List.of("a", "b"), 7);

        assertThat(result.getItems()).containsExactly("a", "b");
        assertThat(result.getTotal()).isEqualTo(7);
        assertThat(result.getPage()).isEqualTo(2);
        assertThat(result.getPageSize()).isEqualTo(5);
    }
}

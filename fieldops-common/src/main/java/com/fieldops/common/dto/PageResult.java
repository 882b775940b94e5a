package com.fieldops.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

/**
 * 分页查询结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResult<T> {

    private List<T> items;

    /** 满足条件的总记录数 */
    private long total;

    /** 页码，从 1 开始 */
    private int page;

    private int pageSize;

    public <R> PageResult<R> map(Function<T, R> mapper) {
        return PageResult.<R>builder()
                .items(items.stream().map(mapper).toList())
                .total(total)
                .page(page)
                .pageSize(pageSize)
                .build();
    }
}

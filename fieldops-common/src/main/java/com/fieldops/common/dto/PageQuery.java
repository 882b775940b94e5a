package com.fieldops.common.dto;

import lombok.Getter;

import java.util.List;

/**
 * 分页参数，负责页码与页大小的归一化。
 */
@Getter
public final class PageQuery {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 200;

    /** 页码，从 1 开始 */
    private final int page;

    private final int pageSize;

    private PageQuery(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }

    public static PageQuery of(Integer page, Integer pageSize) {
        int p = page == null || page < 1 ? 1 : page;
        int size = pageSize == null || pageSize < 1 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
        return new PageQuery(p, size);
    }

    /** 按 long 计算，页码很大时不会溢出 */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public <T> PageResult<T> toResult(List<T> items, long total) {
        return PageResult.<T>builder()
                .items(items)
                .total(total)
                .page(page)
                .pageSize(pageSize)
                .build();
    }
}

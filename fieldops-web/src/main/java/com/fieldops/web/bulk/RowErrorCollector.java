package com.fieldops.web.bulk;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 校验过程中收集的行级错误。
 */
public class RowErrorCollector {

    /** 唯一键相关错误使用的字段名 */
    public static final String UNIQUE_FIELD = "__unique__";

    private final List<RowError> errors = new ArrayList<>();
    private final Set<Integer> rowsWithErrors = new HashSet<>();

    public void add(int rowNumber, String field, String message) {
        errors.add(new RowError(rowNumber, field, message, "error"));
        rowsWithErrors.add(rowNumber);
    }

    public boolean hasErrors(int rowNumber) {
        return rowsWithErrors.contains(rowNumber);
    }

    public List<RowError> getErrors() {
        return errors;
    }

    public int size() {
        return errors.size();
    }

    @Data
    @AllArgsConstructor
    public static class RowError {
        private int rowNumber;
        private String field;
        private String message;
        private String severity;
    }
}

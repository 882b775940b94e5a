package com.fieldops.web.dto;

import com.fieldops.web.entity.ImportRowErrorEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowErrorView {

    private Integer rowNumber;
    private String field;
    private String message;
    private String severity;

    public static RowErrorView from(ImportRowErrorEntity error) {
        return new RowErrorView(error.getRowNumber(), error.getField(), error.getMessage(), error.getSeverity());
    }
}

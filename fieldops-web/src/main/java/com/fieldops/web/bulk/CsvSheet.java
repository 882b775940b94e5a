package com.fieldops.web.bulk;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 解析后的 CSV：表头 + 数据行（已跳过说明行）。
 */
@Getter
@AllArgsConstructor
public class CsvSheet {

    private final List<String> header;
    private final List<Row> rows;

    /**
     * 一行数据。rowNumber 为该行在文件中的记录序号，表头为第 1 行。
     */
    @Getter
    @AllArgsConstructor
    public static class Row {

        private final int rowNumber;
        private final List<String> cells;

        public String cell(int index) {
            return index < cells.size() ? cells.get(index) : "";
        }

        public boolean isBlank() {
            return cells.stream().allMatch(String::isBlank);
        }
    }
}

package com.fieldops.web.bulk;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fieldops.common.exception.ValidationException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSV 读写（基于 jackson-dataformat-csv）。
 */
public final class CsvSheets {

    private static final CsvMapper MAPPER = new CsvMapper();

    private static final char BOM = '\uFEFF';

    /** 说明行中出现的关键字 */
    private static final List<String> INSTRUCTION_KEYWORDS = List.of(
            "required", "optional", "separate", "yes/no", "default");

    private CsvSheets() {
    }

    /**
     * 读取 UTF-8 CSV。第一行是表头；紧随其后的说明行（模板第二行）会被跳过。
     *
     * @throws ValidationException 文件为空
     * @throws IOException         读取失败
     */
    public static CsvSheet read(InputStream input) throws IOException {
        List<String[]> records = new ArrayList<>();
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = MAPPER.readerFor(String[].class)
                     .with(CsvParser.Feature.WRAP_AS_ARRAY)
                     .with(CsvSchema.emptySchema())
                     .readValues(reader)) {
            while (it.hasNextValue()) {
                records.add(it.nextValue());
            }
        }
        if (records.isEmpty()) {
            throw new ValidationException("EMPTY_FILE", "文件没有表头");
        }

        List<String> header = trimAll(records.get(0));
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1).trim());
        }

        List<CsvSheet.Row> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> cells = trimAll(records.get(i));
            if (i == 1 && isInstructionRow(cells)) {
                continue;
            }
            rows.add(new CsvSheet.Row(i + 1, cells));
        }
        return new CsvSheet(header, rows);
    }

    /**
     * 写出 CSV（UTF-8，不带 BOM）。
     */
    public static byte[] write(List<String> header, List<List<String>> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             SequenceWriter seq = MAPPER.writerFor(String[].class)
                     .with(CsvSchema.emptySchema())
                     .writeValues(writer)) {
            seq.write(toArray(header));
            for (List<String> row : rows) {
                seq.write(toArray(row));
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 写出失败", e);
        }
        return out.toByteArray();
    }

    /**
     * 判断是否为模板说明行：每个非空单元格都包含说明关键字，且至少有一个这样的单元格。
     * 可选列留空的普通数据行不会被当成说明行。
     */
    static boolean isInstructionRow(List<String> cells) {
        int hints = 0;
        for (String cell : cells) {
            String raw = cell.toLowerCase(Locale.ROOT);
            if (raw.isEmpty()) {
                continue;
            }
            if (INSTRUCTION_KEYWORDS.stream().noneMatch(raw::contains)) {
                return false;
            }
            hints++;
        }
        return hints > 0;
    }

    private static List<String> trimAll(String[] values) {
        List<String> result = new ArrayList<>(values.length);
        for (String value : values) {
            result.add(value == null ? "" : value.trim());
        }
        return result;
    }

    private static String[] toArray(List<String> values) {
        String[] array = new String[values.size()];
        for (int i = 0; i < values.size(); i++) {
            array[i] = values.get(i) == null ? "" : values.get(i);
        }
        return array;
    }
}

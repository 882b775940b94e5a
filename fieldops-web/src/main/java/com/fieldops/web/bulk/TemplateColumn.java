package com.fieldops.web.bulk;

import lombok.Getter;

import java.util.function.Function;

/**
 * 导入模板中的一列：表头文字、内部字段名、填写说明、是否必填、取值归一化函数。
 */
@Getter
public class TemplateColumn {

    private final String label;
    private final String key;
    private final String instruction;
    private final boolean required;
    private final Function<String, Object> normalizer;

    private TemplateColumn(String label, String key, String instruction, boolean required,
                           Function<String, Object> normalizer) {
        this.label = label;
        this.key = key;
        this.instruction = instruction;
        this.required = required;
        this.normalizer = normalizer;
    }

    public static TemplateColumn required(String label, String key, Function<String, Object> normalizer) {
        return new TemplateColumn(label, key, "Required", true, normalizer);
    }

    public static TemplateColumn optional(String label, String key, String instruction,
                                          Function<String, Object> normalizer) {
        return new TemplateColumn(label, key, instruction, false, normalizer);
    }

    /**
     * 对单元格原始文本做归一化。
     *
     * @throws IllegalArgumentException 取值非法
     */
    public Object normalize(String raw) {
        return normalizer.apply(raw);
    }
}

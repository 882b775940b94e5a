package com.fieldops.web.bulk;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 某个实体的导入模板定义。
 * <p>
 * uniqueKeyGroups 按顺序尝试，第一组字段全部有值的作为该行的唯一键，
 * 用于文件内查重和判断记录是否已存在。
 */
@Getter
public class EntityImportConfig {

    public static final String TEMPLATE_VERSION = "v1";

    private final String entity;
    private final String templateVersion;
    private final List<TemplateColumn> columns;
    private final List<List<String>> uniqueKeyGroups;

    /** false 时允许行没有唯一键（每行都视为新记录） */
    private final boolean uniqueKeyRequired;

    public EntityImportConfig(String entity, List<TemplateColumn> columns, List<List<String>> uniqueKeyGroups,
                              boolean uniqueKeyRequired) {
        this.entity = entity;
        this.templateVersion = TEMPLATE_VERSION;
        this.columns = List.copyOf(columns);
        this.uniqueKeyGroups = List.copyOf(uniqueKeyGroups);
        this.uniqueKeyRequired = uniqueKeyRequired;
    }

    /**
     * 归一化后的表头（标签或字段名）到字段名的映射。
     */
    public Map<String, String> headerMap() {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (TemplateColumn column : columns) {
            mapping.put(ValueNormalizers.normalizeHeader(column.getLabel()), column.getKey());
            mapping.put(ValueNormalizers.normalizeHeader(column.getKey()), column.getKey());
        }
        return mapping;
    }

    public Optional<TemplateColumn> column(String key) {
        return columns.stream().filter(c -> c.getKey().equals(key)).findFirst();
    }

    public String labelFor(String key) {
        return column(key).map(TemplateColumn::getLabel).orElse(key);
    }

    public List<String> requiredKeys() {
        List<String> keys = new ArrayList<>();
        for (TemplateColumn column : columns) {
            if (column.isRequired()) {
                keys.add(column.getKey());
            }
        }
        return keys;
    }

    public List<String> labels() {
        return columns.stream().map(TemplateColumn::getLabel).toList();
    }

    public List<String> instructions() {
        return columns.stream().map(TemplateColumn::getInstruction).toList();
    }

    /**
     * 解析行的唯一键，没有任何一组字段齐全时返回 null。
     */
    public List<String> resolveUniqueKey(Map<String, Object> row) {
        for (List<String> group : uniqueKeyGroups) {
            List<String> values = new ArrayList<>();
            for (String key : group) {
                Object value = row.get(key);
                if (value == null || value.toString().isBlank()) {
                    break;
                }
                values.add(value.toString().trim());
            }
            if (values.size() == group.size()) {
                List<String> key = new ArrayList<>(group.size() + 1);
                key.add(String.join("+", group));
                key.addAll(values);
                return key;
            }
        }
        return null;
    }
}

package com.fieldops.web.bulk;

import java.util.List;
import java.util.Map;

/**
 * 某个实体的批量导入导出实现。
 * <p>
 * 行数据以字段名为键、归一化后的值为值；通用的必填与唯一键校验由导入服务完成，
 * 这里只处理实体特有的规则。
 */
public interface BulkEntityHandler {

    EntityImportConfig config();

    default String entity() {
        return config().getEntity();
    }

    /**
     * 实体特有的校验（格式、引用关系），错误写入 errors。
     */
    void validate(int rowNumber, Map<String, Object> row, RowErrorCollector errors);

    /** 该行对应的记录是否已存在 */
    boolean exists(Map<String, Object> row);

    /**
     * 写入一行。调用方负责事务，失败时直接抛出异常。
     */
    ApplyResult apply(Map<String, Object> row, ImportMode mode);

    /** 当前记录总数（含停用） */
    long count();

    /** 导出全部记录，列顺序与模板一致 */
    List<List<String>> exportRows();
}

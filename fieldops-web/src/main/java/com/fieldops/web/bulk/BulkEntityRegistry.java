package com.fieldops.web.bulk;

import com.fieldops.common.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按实体名查找批量处理器。
 */
@Slf4j
@Component
public class BulkEntityRegistry {

    private final Map<String, BulkEntityHandler> handlers = new LinkedHashMap<>();

    public BulkEntityRegistry(List<BulkEntityHandler> handlers) {
        for (BulkEntityHandler handler : handlers) {
            this.handlers.put(handler.entity(), handler);
        }
        log.info("已注册批量导入实体: {}", this.handlers.keySet());
    }

    public BulkEntityHandler get(String entity) {
        BulkEntityHandler handler = handlers.get(entity);
        if (handler == null) {
            throw new NotFoundException("ENTITY_NOT_SUPPORTED", "不支持的实体: " + entity);
        }
        return handler;
    }

    public Set<String> entities() {
        return handlers.keySet();
    }
}

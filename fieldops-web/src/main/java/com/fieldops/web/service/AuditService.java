package com.fieldops.web.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.entity.AuditLogEntity;
import com.fieldops.web.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 审计日志写入。payload 序列化为 JSON 文本保存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final JdbcAggregateTemplate aggregateTemplate;
    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public void record(String userId, String action, String resourceType, String resourceId,
                       Map<String, ?> payload) {
        AuditLogEntity entry = AuditLogEntity.builder()
                .id(IdGenerator.uuid())
                .userId(userId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .payloadJson(toJson(payload))
                .build();
        aggregateTemplate.insert(entry);
        log.debug("审计: action={}, {}={}", action, resourceType, resourceId);
    }

    public List<AuditLogEntity> findByResource(String resourceType, String resourceId) {
        return auditLogRepository.findByResource(resourceType, resourceId);
    }

    private String toJson(Object obj) {
        if (obj == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            log.warn("审计内容序列化失败: {}", e.getMessage());
            return null;
        }
    }
}

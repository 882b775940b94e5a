package com.fieldops.web.service;

import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.common.exception.ConflictException;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.exception.ValidationException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.dto.ClientCreateRequest;
import com.fieldops.web.dto.ClientUpdateRequest;
import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 客户管理。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientService {

    private final ClientRepository clientRepository;
    private final JdbcAggregateTemplate aggregateTemplate;

    public ClientEntity create(ClientCreateRequest request) {
        String id = StringUtils.hasText(request.getId()) ? request.getId().trim() : IdGenerator.uuid();
        if (clientRepository.existsById(id)) {
            throw new ConflictException("ID_TAKEN", "客户 ID 已存在: " + id);
        }
        ClientEntity client = ClientEntity.builder()
                .id(id)
                .name(request.getName().trim())
                .document(normalizeDocument(request.getDocument()))
                .address(trimToNull(request.getAddress()))
                .build();
        aggregateTemplate.insert(client);
        log.info("客户已创建: id={}, name={}", id, client.getName());
        return get(id);
    }

    public ClientEntity get(String id) {
        return clientRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("CLIENT_NOT_FOUND", "客户不存在: " + id));
    }

    /**
     * 获取启用中的客户，停用客户视同不存在。
     */
    public ClientEntity requireActive(String id) {
        ClientEntity client = get(id);
        if (!Boolean.TRUE.equals(client.getIsActive())) {
            throw new NotFoundException("CLIENT_NOT_FOUND", "客户不存在或已停用: " + id);
        }
        return client;
    }

    public PageResult<ClientEntity> list(String document, boolean includeInactive, PageQuery page) {
        String documentFilter = StringUtils.hasText(document) ? normalizeDocument(document) : null;
        return page.toResult(
                clientRepository.search(documentFilter, includeInactive, page.getPageSize(), page.offset()),
                clientRepository.countSearch(documentFilter, includeInactive));
    }

    public ClientEntity update(String id, ClientUpdateRequest request) {
        ClientEntity client = get(id);
        if (StringUtils.hasText(request.getName())) {
            client.setName(request.getName().trim());
        }
        if (request.getDocument() != null) {
            client.setDocument(normalizeDocument(request.getDocument()));
        }
        if (request.getAddress() != null) {
            client.setAddress(trimToNull(request.getAddress()));
        }
        clientRepository.save(client);
        log.info("客户已更新: id={}", id);
        return get(id);
    }

    public ClientEntity setActive(String id, boolean active) {
        ClientEntity client = get(id);
        if (!Boolean.valueOf(active).equals(client.getIsActive())) {
            client.setIsActive(active);
            clientRepository.save(client);
            log.info("客户已{}: id={}", active ? "恢复" : "停用", id);
        }
        return client;
    }

    /**
     * 证件号只保留数字，必须是 11 位（CPF）或 14 位（CNPJ）；空值返回 null。
     */
    public static String normalizeDocument(String document) {
        if (document == null) {
            return null;
        }
        String digits = document.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        if (!isValidDocument(digits)) {
            throw new ValidationException("INVALID_DOCUMENT", "证件号应为 11 位或 14 位数字: " + document);
        }
        return digits;
    }

    public static boolean isValidDocument(String digits) {
        return digits.matches("\\d{11}|\\d{14}");
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

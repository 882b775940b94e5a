package com.fieldops.web.service;

import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.common.exception.ConflictException;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.dto.AssetCreateRequest;
import com.fieldops.web.dto.AssetUpdateRequest;
import com.fieldops.web.entity.AssetEntity;
import com.fieldops.web.repository.AssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 资产管理，所有操作都限定在某个客户之下。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetService {

    public static final String DEFAULT_STATUS = "operating";

    private final AssetRepository assetRepository;
    private final ClientService clientService;
    private final JdbcAggregateTemplate aggregateTemplate;

    public AssetEntity create(String clientId, AssetCreateRequest request) {
        clientService.requireActive(clientId);
        String id = StringUtils.hasText(request.getId()) ? request.getId().trim() : IdGenerator.uuid();
        if (assetRepository.existsById(id)) {
            throw new ConflictException("ID_TAKEN", "资产 ID 已存在: " + id);
        }
        AssetEntity asset = AssetEntity.builder()
                .id(id)
                .clientId(clientId)
                .name(request.getName().trim())
                .type(trimToNull(request.getType()))
                .location(trimToNull(request.getLocation()))
                .status(StringUtils.hasText(request.getStatus()) ? request.getStatus().trim() : DEFAULT_STATUS)
                .build();
        aggregateTemplate.insert(asset);
        log.info("资产已创建: id={}, clientId={}", id, clientId);
        return get(clientId, id);
    }

    /**
     * 按 ID 获取资产，不属于该客户时视为不存在。
     */
    public AssetEntity get(String clientId, String assetId) {
        return assetRepository.findById(assetId)
                .filter(a -> a.getClientId().equals(clientId))
                .orElseThrow(() -> new NotFoundException("ASSET_NOT_FOUND", "资产不存在: " + assetId));
    }

    public AssetEntity get(String assetId) {
        return assetRepository.findById(assetId)
                .orElseThrow(() -> new NotFoundException("ASSET_NOT_FOUND", "资产不存在: " + assetId));
    }

    public PageResult<AssetEntity> list(String clientId, String status, boolean includeInactive, PageQuery page) {
        clientService.get(clientId);
        String statusFilter = StringUtils.hasText(status) ? status.trim() : null;
        return page.toResult(
                assetRepository.search(clientId, statusFilter, includeInactive, page.getPageSize(), page.offset()),
                assetRepository.countSearch(clientId, statusFilter, includeInactive));
    }

    public AssetEntity update(String clientId, String assetId, AssetUpdateRequest request) {
        AssetEntity asset = get(clientId, assetId);
        if (StringUtils.hasText(request.getName())) {
            asset.setName(request.getName().trim());
        }
        if (request.getType() != null) {
            asset.setType(trimToNull(request.getType()));
        }
        if (request.getLocation() != null) {
            asset.setLocation(trimToNull(request.getLocation()));
        }
        if (StringUtils.hasText(request.getStatus())) {
            asset.setStatus(request.getStatus().trim());
        }
        assetRepository.save(asset);
        log.info("资产已更新: id={}", assetId);
        return get(clientId, assetId);
    }

    public AssetEntity setActive(String clientId, String assetId, boolean active) {
        AssetEntity asset = get(clientId, assetId);
        if (!Boolean.valueOf(active).equals(asset.getIsActive())) {
            asset.setIsActive(active);
            assetRepository.save(asset);
            log.info("资产已{}: id={}", active ? "恢复" : "停用", assetId);
        }
        return asset;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

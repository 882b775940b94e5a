package com.fieldops.web.bulk.handler;

import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.bulk.ApplyResult;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.EntityImportConfig;
import com.fieldops.web.bulk.ImportMode;
import com.fieldops.web.bulk.RowErrorCollector;
import com.fieldops.web.bulk.TemplateColumn;
import com.fieldops.web.bulk.ValueNormalizers;
import com.fieldops.web.entity.AssetEntity;
import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.repository.AssetRepository;
import com.fieldops.web.service.AssetService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 资产批量导入导出。
 * <p>
 * 客户通过 Client ID 或 Client Document 指定；没有 ID 的行以（客户, 名称）判断是否已存在。
 */
@Component
@RequiredArgsConstructor
public class AssetBulkHandler implements BulkEntityHandler {

    private static final EntityImportConfig CONFIG = new EntityImportConfig("assets", List.of(
            TemplateColumn.optional("ID", "id", "Optional", ValueNormalizers::text),
            TemplateColumn.required("Name", "name", ValueNormalizers::text),
            TemplateColumn.optional("Client ID", ClientLookup.CLIENT_ID, "Required if client document is empty",
                    ValueNormalizers::text),
            TemplateColumn.optional("Client Document", ClientLookup.CLIENT_DOCUMENT, "Required if client ID is empty",
                    ValueNormalizers::digits),
            TemplateColumn.optional("Type", "type", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Location", "location", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Status", "status", "Optional (default operating)", ValueNormalizers::lowerText),
            TemplateColumn.optional("Active", "is_active", "Optional (yes/no)", ValueNormalizers::bool)
    ), List.of(
            List.of("id"),
            List.of(ClientLookup.CLIENT_ID, "name"),
            List.of(ClientLookup.CLIENT_DOCUMENT, "name")
    ), true);

    private final AssetRepository assetRepository;
    private final ClientLookup clientLookup;
    private final JdbcAggregateTemplate aggregateTemplate;

    @Override
    public EntityImportConfig config() {
        return CONFIG;
    }

    @Override
    public void validate(int rowNumber, Map<String, Object> row, RowErrorCollector errors) {
        if (!clientLookup.hasReference(row)) {
            String id = BulkRows.str(row, "id");
            if (id == null || assetRepository.findById(id).isEmpty()) {
                errors.add(rowNumber, ClientLookup.CLIENT_ID, "新资产必须指定客户 ID 或客户证件号");
            }
            return;
        }
        Optional<ClientEntity> client = clientLookup.resolve(row);
        if (client.isEmpty()) {
            errors.add(rowNumber, ClientLookup.CLIENT_ID, "找不到对应的客户");
            return;
        }
        String id = BulkRows.str(row, "id");
        if (id != null) {
            assetRepository.findById(id)
                    .filter(a -> !a.getClientId().equals(client.get().getId()))
                    .ifPresent(a -> errors.add(rowNumber, ClientLookup.CLIENT_ID, "资产已属于其他客户，不能通过导入转移"));
        }
    }

    @Override
    public boolean exists(Map<String, Object> row) {
        return findExisting(row).isPresent();
    }

    @Override
    public ApplyResult apply(Map<String, Object> row, ImportMode mode) {
        Optional<AssetEntity> existing = findExisting(row);
        if (mode.shouldSkip(existing.isPresent())) {
            return ApplyResult.SKIPPED;
        }
        Boolean active = BulkRows.bool(row, "is_active");

        if (existing.isPresent()) {
            AssetEntity asset = existing.get();
            asset.setName(BulkRows.str(row, "name"));
            if (BulkRows.str(row, "type") != null) {
                asset.setType(BulkRows.str(row, "type"));
            }
            if (BulkRows.str(row, "location") != null) {
                asset.setLocation(BulkRows.str(row, "location"));
            }
            if (BulkRows.str(row, "status") != null) {
                asset.setStatus(BulkRows.str(row, "status"));
            }
            if (active != null) {
                asset.setIsActive(active);
            }
            assetRepository.save(asset);
            return ApplyResult.UPDATED;
        }

        ClientEntity client = clientLookup.resolve(row)
                .orElseThrow(() -> new IllegalStateException("找不到对应的客户"));
        String id = BulkRows.str(row, "id");
        String status = BulkRows.str(row, "status");
        aggregateTemplate.insert(AssetEntity.builder()
                .id(id != null ? id : IdGenerator.uuid())
                .clientId(client.getId())
                .name(BulkRows.str(row, "name"))
                .type(BulkRows.str(row, "type"))
                .location(BulkRows.str(row, "location"))
                .status(status != null ? status : AssetService.DEFAULT_STATUS)
                .isActive(active != null ? active : Boolean.TRUE)
                .build());
        return ApplyResult.CREATED;
    }

    @Override
    public long count() {
        return assetRepository.count();
    }

    @Override
    public List<List<String>> exportRows() {
        Map<String, String> documents = clientLookup.documentsById();
        List<List<String>> rows = new ArrayList<>();
        for (AssetEntity asset : assetRepository.findAllForExport()) {
            rows.add(List.of(asset.getId(), asset.getName(), asset.getClientId(),
                    BulkRows.orEmpty(documents.get(asset.getClientId())),
                    BulkRows.orEmpty(asset.getType()), BulkRows.orEmpty(asset.getLocation()),
                    BulkRows.orEmpty(asset.getStatus()), ValueNormalizers.yesNo(asset.getIsActive())));
        }
        return rows;
    }

    private Optional<AssetEntity> findExisting(Map<String, Object> row) {
        String id = BulkRows.str(row, "id");
        if (id != null) {
            return assetRepository.findById(id);
        }
        String name = BulkRows.str(row, "name");
        if (name == null) {
            return Optional.empty();
        }
        return clientLookup.resolve(row)
                .flatMap(client -> assetRepository.findFirstByClientIdAndName(client.getId(), name));
    }
}

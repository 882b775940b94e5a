package com.fieldops.web.bulk.handler;

import com.fieldops.common.util.IdGenerator;
import com.fieldops.common.util.SqliteTime;
import com.fieldops.web.bulk.ApplyResult;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.EntityImportConfig;
import com.fieldops.web.bulk.ImportMode;
import com.fieldops.web.bulk.RowErrorCollector;
import com.fieldops.web.bulk.TemplateColumn;
import com.fieldops.web.bulk.ValueNormalizers;
import com.fieldops.web.entity.AssetEntity;
import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.entity.WorkOrderEntity;
import com.fieldops.web.repository.AssetRepository;
import com.fieldops.web.repository.WorkOrderRepository;
import com.fieldops.web.service.WorkOrderService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工单批量导入导出。工单没有自然键：带 ID 的行可更新已有工单，不带 ID 的行总是新建。
 */
@Component
@RequiredArgsConstructor
public class WorkOrderBulkHandler implements BulkEntityHandler {

    private static final EntityImportConfig CONFIG = new EntityImportConfig("work_orders", List.of(
            TemplateColumn.optional("ID", "id", "Optional", ValueNormalizers::text),
            TemplateColumn.required("Title", "title", ValueNormalizers::text),
            TemplateColumn.optional("Client ID", ClientLookup.CLIENT_ID, "Required if client document is empty",
                    ValueNormalizers::text),
            TemplateColumn.optional("Client Document", ClientLookup.CLIENT_DOCUMENT, "Required if client ID is empty",
                    ValueNormalizers::digits),
            TemplateColumn.optional("Asset ID", "asset_id", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Description", "description", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Status", "status",
                    "Optional (open/in_progress/on_hold/closed/cancelled, default open)", ValueNormalizers::lowerText),
            TemplateColumn.optional("Created By", "created_by", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Active", "is_active", "Optional (yes/no)", ValueNormalizers::bool)
    ), List.of(List.of("id")), false);

    private final WorkOrderRepository workOrderRepository;
    private final AssetRepository assetRepository;
    private final ClientLookup clientLookup;
    private final JdbcAggregateTemplate aggregateTemplate;

    @Override
    public EntityImportConfig config() {
        return CONFIG;
    }

    @Override
    public void validate(int rowNumber, Map<String, Object> row, RowErrorCollector errors) {
        String status = BulkRows.str(row, "status");
        if (status != null && !WorkOrderService.isKnownStatus(status)) {
            errors.add(rowNumber, "status", "未知的工单状态: " + status);
        }

        if (!clientLookup.hasReference(row)) {
            errors.add(rowNumber, ClientLookup.CLIENT_ID, "必须指定客户 ID 或客户证件号");
            return;
        }
        Optional<ClientEntity> client = clientLookup.resolve(row);
        if (client.isEmpty()) {
            errors.add(rowNumber, ClientLookup.CLIENT_ID, "找不到对应的客户");
            return;
        }

        String assetId = BulkRows.str(row, "asset_id");
        if (assetId != null) {
            Optional<AssetEntity> asset = assetRepository.findById(assetId);
            if (asset.isEmpty()) {
                errors.add(rowNumber, "asset_id", "找不到对应的资产");
            } else if (!asset.get().getClientId().equals(client.get().getId())) {
                errors.add(rowNumber, "asset_id", "资产不属于该客户");
            }
            return;
        }

        // 行里没有资产时，更新后的工单仍沿用原资产，原资产必须属于新客户
        Optional<WorkOrderEntity> existing = findExisting(row);
        String storedAssetId = existing.map(WorkOrderEntity::getAssetId).orElse(null);
        if (storedAssetId != null) {
            boolean sameClient = assetRepository.findById(storedAssetId)
                    .map(a -> a.getClientId().equals(client.get().getId()))
                    .orElse(false);
            if (!sameClient) {
                errors.add(rowNumber, "asset_id", "工单关联的资产 " + storedAssetId + " 不属于该客户");
            }
        }
    }

    @Override
    public boolean exists(Map<String, Object> row) {
        return findExisting(row).isPresent();
    }

    @Override
    public ApplyResult apply(Map<String, Object> row, ImportMode mode) {
        Optional<WorkOrderEntity> existing = findExisting(row);
        if (mode.shouldSkip(existing.isPresent())) {
            return ApplyResult.SKIPPED;
        }
        ClientEntity client = clientLookup.resolve(row)
                .orElseThrow(() -> new IllegalStateException("找不到对应的客户"));
        String status = BulkRows.str(row, "status");
        Boolean active = BulkRows.bool(row, "is_active");

        if (existing.isPresent()) {
            WorkOrderEntity workOrder = existing.get();
            workOrder.setClientId(client.getId());
            workOrder.setTitle(BulkRows.str(row, "title"));
            if (BulkRows.str(row, "asset_id") != null) {
                workOrder.setAssetId(BulkRows.str(row, "asset_id"));
            }
            if (BulkRows.str(row, "description") != null) {
                workOrder.setDescription(BulkRows.str(row, "description"));
            }
            if (status != null) {
                WorkOrderService.applyStatus(workOrder, status);
            }
            if (BulkRows.str(row, "created_by") != null) {
                workOrder.setCreatedBy(BulkRows.str(row, "created_by"));
            }
            if (active != null) {
                workOrder.setIsActive(active);
            }
            workOrderRepository.save(workOrder);
            return ApplyResult.UPDATED;
        }

        String id = BulkRows.str(row, "id");
        String effectiveStatus = status != null ? status : WorkOrderService.OPEN;
        aggregateTemplate.insert(WorkOrderEntity.builder()
                .id(id != null ? id : IdGenerator.uuid())
                .clientId(client.getId())
                .assetId(BulkRows.str(row, "asset_id"))
                .title(BulkRows.str(row, "title"))
                .description(BulkRows.str(row, "description"))
                .status(effectiveStatus)
                .closedAt(WorkOrderService.CLOSED.equals(effectiveStatus) ? SqliteTime.now() : null)
                .createdBy(BulkRows.str(row, "created_by"))
                .isActive(active != null ? active : Boolean.TRUE)
                .build());
        return ApplyResult.CREATED;
    }

    @Override
    public long count() {
        return workOrderRepository.count();
    }

    @Override
    public List<List<String>> exportRows() {
        Map<String, String> documents = clientLookup.documentsById();
        List<List<String>> rows = new ArrayList<>();
        for (WorkOrderEntity wo : workOrderRepository.findAllForExport()) {
            rows.add(List.of(wo.getId(), wo.getTitle(), wo.getClientId(),
                    BulkRows.orEmpty(documents.get(wo.getClientId())), BulkRows.orEmpty(wo.getAssetId()),
                    BulkRows.orEmpty(wo.getDescription()), wo.getStatus(), BulkRows.orEmpty(wo.getCreatedBy()),
                    ValueNormalizers.yesNo(wo.getIsActive())));
        }
        return rows;
    }

    private Optional<WorkOrderEntity> findExisting(Map<String, Object> row) {
        String id = BulkRows.str(row, "id");
        return id == null ? Optional.empty() : workOrderRepository.findById(id);
    }
}

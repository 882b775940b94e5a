package com.fieldops.web.service;

import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.common.exception.ConflictException;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.exception.ValidationException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.common.util.SqliteTime;
import com.fieldops.web.dto.WorkOrderCreateRequest;
import com.fieldops.web.dto.WorkOrderUpdateRequest;
import com.fieldops.web.entity.AssetEntity;
import com.fieldops.web.entity.WorkOrderEntity;
import com.fieldops.web.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 工单管理。
 * <p>
 * 状态流转：open / in_progress / on_hold 之间自由切换；进入 closed 记录 closedAt，
 * 离开 closed 清空 closedAt；closed / cancelled 只能通过 reopen 回到 open。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkOrderService {

    public static final String OPEN = "open";
    public static final String CLOSED = "closed";
    public static final String CANCELLED = "cancelled";

    public static final List<String> STATUSES = List.of(OPEN, "in_progress", "on_hold", CLOSED, CANCELLED);

    private final WorkOrderRepository workOrderRepository;
    private final ClientService clientService;
    private final AssetService assetService;
    private final JdbcAggregateTemplate aggregateTemplate;

    public WorkOrderEntity create(WorkOrderCreateRequest request, String requestUserId) {
        String clientId = request.getClientId().trim();
        clientService.requireActive(clientId);
        String assetId = StringUtils.hasText(request.getAssetId()) ? request.getAssetId().trim() : null;
        if (assetId != null) {
            checkAssetBelongsTo(assetId, clientId);
        }
        String status = StringUtils.hasText(request.getStatus()) ? checkStatus(request.getStatus()) : OPEN;

        String id = StringUtils.hasText(request.getId()) ? request.getId().trim() : IdGenerator.uuid();
        if (workOrderRepository.existsById(id)) {
            throw new ConflictException("ID_TAKEN", "工单 ID 已存在: " + id);
        }
        String createdBy = StringUtils.hasText(request.getCreatedBy()) ? request.getCreatedBy().trim() : requestUserId;

        WorkOrderEntity workOrder = WorkOrderEntity.builder()
                .id(id)
                .clientId(clientId)
                .assetId(assetId)
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .status(status)
                .closedAt(CLOSED.equals(status) ? SqliteTime.now() : null)
                .createdBy(StringUtils.hasText(createdBy) ? createdBy : null)
                .build();
        aggregateTemplate.insert(workOrder);
        log.info("工单已创建: id={}, clientId={}, status={}", id, clientId, status);
        return get(id);
    }

    public WorkOrderEntity get(String id) {
        return workOrderRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("WORK_ORDER_NOT_FOUND", "工单不存在: " + id));
    }

    public PageResult<WorkOrderEntity> list(String status, String clientId, String assetId,
                                            boolean includeInactive, PageQuery page) {
        String statusFilter = StringUtils.hasText(status) ? status.trim() : null;
        String clientFilter = StringUtils.hasText(clientId) ? clientId.trim() : null;
        String assetFilter = StringUtils.hasText(assetId) ? assetId.trim() : null;
        return page.toResult(
                workOrderRepository.search(statusFilter, clientFilter, assetFilter, includeInactive,
                        page.getPageSize(), page.offset()),
                workOrderRepository.countSearch(statusFilter, clientFilter, assetFilter, includeInactive));
    }

    public WorkOrderEntity update(String id, WorkOrderUpdateRequest request) {
        WorkOrderEntity workOrder = get(id);
        if (StringUtils.hasText(request.getAssetId())) {
            String assetId = request.getAssetId().trim();
            checkAssetBelongsTo(assetId, workOrder.getClientId());
            workOrder.setAssetId(assetId);
        }
        if (StringUtils.hasText(request.getTitle())) {
            workOrder.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            workOrder.setDescription(request.getDescription());
        }
        if (StringUtils.hasText(request.getStatus())) {
            applyStatus(workOrder, checkStatus(request.getStatus()));
        }
        workOrderRepository.save(workOrder);
        log.info("工单已更新: id={}, status={}", id, workOrder.getStatus());
        return get(id);
    }

    public WorkOrderEntity close(String id) {
        WorkOrderEntity workOrder = get(id);
        if (CLOSED.equals(workOrder.getStatus())) {
            throw new ConflictException("ALREADY_CLOSED", "工单已关闭: " + id);
        }
        applyStatus(workOrder, CLOSED);
        workOrderRepository.save(workOrder);
        log.info("工单已关闭: id={}", id);
        return get(id);
    }

    public WorkOrderEntity reopen(String id) {
        WorkOrderEntity workOrder = get(id);
        if (!CLOSED.equals(workOrder.getStatus()) && !CANCELLED.equals(workOrder.getStatus())) {
            throw new ConflictException("INVALID_TRANSITION", "只有已关闭或已取消的工单可以重新打开: " + id);
        }
        applyStatus(workOrder, OPEN);
        workOrderRepository.save(workOrder);
        log.info("工单已重新打开: id={}", id);
        return get(id);
    }

    public WorkOrderEntity setActive(String id, boolean active) {
        WorkOrderEntity workOrder = get(id);
        if (!Boolean.valueOf(active).equals(workOrder.getIsActive())) {
            workOrder.setIsActive(active);
            workOrderRepository.save(workOrder);
            log.info("工单已{}: id={}", active ? "恢复" : "停用", id);
        }
        return workOrder;
    }

    public static boolean isKnownStatus(String status) {
        return status != null && STATUSES.contains(status);
    }

    private static String checkStatus(String status) {
        String value = status.trim();
        if (!isKnownStatus(value)) {
            throw new ValidationException("INVALID_STATUS", "未知的工单状态: " + value + "，可选值 " + STATUSES);
        }
        return value;
    }

    /**
     * 切换状态并维护 closedAt。
     */
    public static void applyStatus(WorkOrderEntity workOrder, String status) {
        if (CLOSED.equals(status) && !CLOSED.equals(workOrder.getStatus())) {
            workOrder.setClosedAt(SqliteTime.now());
        } else if (!CLOSED.equals(status)) {
            workOrder.setClosedAt(null);
        }
        workOrder.setStatus(status);
    }

    private void checkAssetBelongsTo(String assetId, String clientId) {
        AssetEntity asset = assetService.get(assetId);
        if (!asset.getClientId().equals(clientId)) {
            throw new ValidationException("ASSET_CLIENT_MISMATCH", "资产 " + assetId + " 不属于客户 " + clientId);
        }
    }
}

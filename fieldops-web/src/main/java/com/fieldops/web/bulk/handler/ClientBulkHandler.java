package com.fieldops.web.bulk.handler;

import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.bulk.ApplyResult;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.EntityImportConfig;
import com.fieldops.web.bulk.ImportMode;
import com.fieldops.web.bulk.RowErrorCollector;
import com.fieldops.web.bulk.TemplateColumn;
import com.fieldops.web.bulk.ValueNormalizers;
import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.repository.ClientRepository;
import com.fieldops.web.service.ClientService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 客户批量导入导出。唯一键依次为 ID、证件号。
 */
@Component
@RequiredArgsConstructor
public class ClientBulkHandler implements BulkEntityHandler {

    private static final EntityImportConfig CONFIG = new EntityImportConfig("clients", List.of(
            TemplateColumn.optional("ID", "id", "Optional", ValueNormalizers::text),
            TemplateColumn.required("Name", "name", ValueNormalizers::text),
            TemplateColumn.optional("Document", "document", "Required if ID is empty (11 or 14 digits)",
                    ValueNormalizers::digits),
            TemplateColumn.optional("Address", "address", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Active", "is_active", "Optional (yes/no)", ValueNormalizers::bool)
    ), List.of(List.of("id"), List.of("document")), true);

    private final ClientRepository clientRepository;
    private final JdbcAggregateTemplate aggregateTemplate;

    @Override
    public EntityImportConfig config() {
        return CONFIG;
    }

    @Override
    public void validate(int rowNumber, Map<String, Object> row, RowErrorCollector errors) {
        String document = BulkRows.str(row, "document");
        if (document != null && !ClientService.isValidDocument(document)) {
            errors.add(rowNumber, "document", "证件号应为 11 位或 14 位数字");
        }
    }

    @Override
    public boolean exists(Map<String, Object> row) {
        return findExisting(row).isPresent();
    }

    @Override
    public ApplyResult apply(Map<String, Object> row, ImportMode mode) {
        Optional<ClientEntity> existing = findExisting(row);
        if (mode.shouldSkip(existing.isPresent())) {
            return ApplyResult.SKIPPED;
        }
        Boolean active = BulkRows.bool(row, "is_active");

        if (existing.isPresent()) {
            ClientEntity client = existing.get();
            client.setName(BulkRows.str(row, "name"));
            if (BulkRows.str(row, "document") != null) {
                client.setDocument(BulkRows.str(row, "document"));
            }
            if (BulkRows.str(row, "address") != null) {
                client.setAddress(BulkRows.str(row, "address"));
            }
            if (active != null) {
                client.setIsActive(active);
            }
            clientRepository.save(client);
            return ApplyResult.UPDATED;
        }

        String id = BulkRows.str(row, "id");
        aggregateTemplate.insert(ClientEntity.builder()
                .id(id != null ? id : IdGenerator.uuid())
                .name(BulkRows.str(row, "name"))
                .document(BulkRows.str(row, "document"))
                .address(BulkRows.str(row, "address"))
                .isActive(active != null ? active : Boolean.TRUE)
                .build());
        return ApplyResult.CREATED;
    }

    @Override
    public long count() {
        return clientRepository.count();
    }

    @Override
    public List<List<String>> exportRows() {
        List<List<String>> rows = new ArrayList<>();
        for (ClientEntity client : clientRepository.findAllForExport()) {
            rows.add(List.of(client.getId(), client.getName(), BulkRows.orEmpty(client.getDocument()),
                    BulkRows.orEmpty(client.getAddress()), ValueNormalizers.yesNo(client.getIsActive())));
        }
        return rows;
    }

    private Optional<ClientEntity> findExisting(Map<String, Object> row) {
        String id = BulkRows.str(row, "id");
        if (id != null) {
            return clientRepository.findById(id);
        }
        String document = BulkRows.str(row, "document");
        return document == null ? Optional.empty() : clientRepository.findFirstByDocument(document);
    }
}

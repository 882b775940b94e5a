package com.fieldops.web.bulk.handler;

import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 导入行中的客户引用解析：优先 client_id，其次 client_document。
 */
@Component
@RequiredArgsConstructor
class ClientLookup {

    static final String CLIENT_ID = "client_id";
    static final String CLIENT_DOCUMENT = "client_document";

    private final ClientRepository clientRepository;

    boolean hasReference(Map<String, Object> row) {
        return BulkRows.str(row, CLIENT_ID) != null || BulkRows.str(row, CLIENT_DOCUMENT) != null;
    }

    Optional<ClientEntity> resolve(Map<String, Object> row) {
        String clientId = BulkRows.str(row, CLIENT_ID);
        if (clientId != null) {
            return clientRepository.findById(clientId);
        }
        String document = BulkRows.str(row, CLIENT_DOCUMENT);
        if (document != null) {
            return clientRepository.findFirstByDocument(document);
        }
        return Optional.empty();
    }

    /** 客户 ID → 证件号，用于导出 */
    Map<String, String> documentsById() {
        Map<String, String> documents = new HashMap<>();
        for (ClientEntity client : clientRepository.findAll()) {
            documents.put(client.getId(), client.getDocument());
        }
        return documents;
    }
}

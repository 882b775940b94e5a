package com.fieldops.api;

import com.fieldops.FieldOpsTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.ThreadLocalRandom;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CrudApiTest extends FieldOpsTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void health_shouldReportDatabaseUp() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.database").value("up"))
                .andExpect(jsonPath("$.tables", hasItem("work_orders")));
    }

    @Test
    void createUser_shouldNormalizeEmailAndHidePassword() throws Exception {
        String email = "Tech." + System.nanoTime() + "@Example.com";
        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Tech\",\"email\":\"" + email + "\",\"password\":\"pw123\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.email").value(email.toLowerCase()))
                .andExpect(jsonPath("$.data.role").value("user"))
                .andExpect(jsonPath("$.data.isActive").value(true))
                .andExpect(jsonPath("$.data.password").doesNotExist());

        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Dup\",\"email\":\"" + email.toUpperCase() + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_TAKEN"));
    }

    @Test
    void createUser_withoutEmail_shouldFailValidation() throws Exception {
        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"No Mail\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void clientAssetWorkOrder_lifecycle() throws Exception {
        String clientId = createClient(randomDocument());

        MvcResult assetResult = mockMvc.perform(post("/api/clients/" + clientId + "/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Chiller 01\",\"type\":\"hvac\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("operating"))
                .andReturn();
        String assetId = JsonPath.read(assetResult.getResponse().getContentAsString(), "$.data.id");

        MvcResult orderResult = mockMvc.perform(post("/api/work-orders")
                        .header("X-User-Id", "tech-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"clientId\":\"" + clientId + "\",\"assetId\":\"" + assetId
                                + "\",\"title\":\"Compressor noise\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("open"))
                .andExpect(jsonPath("$.data.openedAt", notNullValue()))
                .andExpect(jsonPath("$.data.createdBy").value("tech-1"))
                .andReturn();
        String orderId = JsonPath.read(orderResult.getResponse().getContentAsString(), "$.data.id");

        mockMvc.perform(post("/api/work-orders/" + orderId + "/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("closed"))
                .andExpect(jsonPath("$.data.closedAt", notNullValue()));

        mockMvc.perform(post("/api/work-orders/" + orderId + "/close"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_CLOSED"));

        mockMvc.perform(post("/api/work-orders/" + orderId + "/reopen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("open"))
                .andExpect(jsonPath("$.data.closedAt").doesNotExist());

        mockMvc.perform(get("/api/work-orders").param("clientId", clientId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.items[0].id").value(orderId));
    }

    @Test
    void createWorkOrder_withAssetOfAnotherClient_shouldBeRejected() throws Exception {
        String clientA = createClient(randomDocument());
        String clientB = createClient(randomDocument());
        MvcResult assetResult = mockMvc.perform(post("/api/clients/" + clientB + "/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Pump\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        String assetOfB = JsonPath.read(assetResult.getResponse().getContentAsString(), "$.data.id");

        mockMvc.perform(post("/api/work-orders").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"clientId\":\"" + clientA + "\",\"assetId\":\"" + assetOfB
                                + "\",\"title\":\"Wrong asset\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ASSET_CLIENT_MISMATCH"));

        mockMvc.perform(get("/api/clients/" + clientA + "/assets/" + assetOfB))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ASSET_NOT_FOUND"));
    }

    @Test
    void createWorkOrder_withUnknownClient_shouldReturnNotFound() throws Exception {
        mockMvc.perform(post("/api/work-orders").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"clientId\":\"missing-client\",\"title\":\"Orphan\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CLIENT_NOT_FOUND"));
    }

    @Test
    void deactivateClient_shouldHideFromDefaultListing() throws Exception {
        String document = randomDocument();
        String clientId = createClient(document);

        mockMvc.perform(delete("/api/clients/" + clientId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isActive").value(false));

        mockMvc.perform(get("/api/clients").param("pageSize", "200"))
                .andExpect(jsonPath("$.data.items[*].id", not(hasItem(clientId))));
        mockMvc.perform(get("/api/clients").param("document", document).param("includeInactive", "true"))
                .andExpect(jsonPath("$.data.items[0].id").value(clientId));

        mockMvc.perform(post("/api/clients/" + clientId + "/restore"))
                .andExpect(jsonPath("$.data.isActive").value(true));
    }

    @Test
    void createClient_withInvalidDocument_shouldFail() throws Exception {
        mockMvc.perform(post("/api/clients").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Bad Doc\",\"document\":\"123\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DOCUMENT"));
    }

    private String createClient(String document) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/clients").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Acme " + document + "\",\"document\":\"" + document + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.document").value(document))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    static String randomDocument() {
        return String.valueOf(ThreadLocalRandom.current().nextLong(10_000_000_000L, 99_999_999_999L));
    }
}

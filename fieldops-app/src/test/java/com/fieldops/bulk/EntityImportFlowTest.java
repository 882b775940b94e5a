package com.fieldops.bulk;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.ThreadLocalRandom;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 客户、资产、工单的导入流程。
 */
@SpringBootTest
@AutoConfigureMockMvc
class EntityImportFlowTest extends BulkTestSupport {

    private static final String CLIENTS_HEADER = "ID,Name,Document,Address,Active\n";

    @Test
    void importClients_shouldCreateAndMatchByIdOrDocument() throws Exception {
        String docA = randomDocument();
        String docB = randomDocument();
        String docNew = randomDocument();
        String clientA = createClient(docA);
        String clientB = createClient(docB);

        // 首个数据行只有可选列为空，不能被当成说明行
        String csv = CLIENTS_HEADER
                + ",New Co," + docNew + ",,\n"
                + ",Renamed A," + docA + ",Rua B 10,\n"
                + clientB + ",Renamed B,,,no\n";
        String jobId = upload("clients", csv, "upsert");

        mockMvc.perform(post("/api/bulk/import/" + jobId + "/validate"))
                .andExpect(jsonPath("$.data.status").value("ready_to_confirm"))
                .andExpect(jsonPath("$.data.preview.created").value(1))
                .andExpect(jsonPath("$.data.preview.updated").value(2));

        confirmAndAwait(jobId);

        mockMvc.perform(get("/api/clients/" + clientA))
                .andExpect(jsonPath("$.data.name").value("Renamed A"))
                .andExpect(jsonPath("$.data.address").value("Rua B 10"));
        mockMvc.perform(get("/api/clients/" + clientB))
                .andExpect(jsonPath("$.data.name").value("Renamed B"))
                .andExpect(jsonPath("$.data.document").value(docB))
                .andExpect(jsonPath("$.data.isActive").value(false));
        mockMvc.perform(get("/api/clients").param("document", docNew))
                .andExpect(jsonPath("$.data.items[0].name").value("New Co"));
    }

    @Test
    void importClients_createOnlyAndUpdateOnly_shouldCountSkippedRows() throws Exception {
        String docExisting = randomDocument();
        String clientId = createClient(docExisting);
        String docNew = randomDocument();
        String csv = CLIENTS_HEADER
                + ",Existing Co," + docExisting + ",,\n"
                + ",Fresh Co," + docNew + ",,\n";

        String createOnly = upload("clients", csv, "create_only");
        mockMvc.perform(post("/api/bulk/import/" + createOnly + "/validate"))
                .andExpect(jsonPath("$.data.status").value("ready_to_confirm"))
                .andExpect(jsonPath("$.data.preview.created").value(1))
                .andExpect(jsonPath("$.data.preview.updated").value(0))
                .andExpect(jsonPath("$.data.preview.skipped").value(1));

        String updateOnly = upload("clients", csv + "\n", "update_only");
        mockMvc.perform(post("/api/bulk/import/" + updateOnly + "/validate"))
                .andExpect(jsonPath("$.data.preview.created").value(0))
                .andExpect(jsonPath("$.data.preview.updated").value(1))
                .andExpect(jsonPath("$.data.preview.skipped").value(1));

        confirmAndAwait(createOnly);
        mockMvc.perform(get("/api/bulk/import/" + createOnly))
                .andExpect(jsonPath("$.data.summary.created").value(1))
                .andExpect(jsonPath("$.data.summary.skipped").value(1));
        // create_only 不改动已有客户
        mockMvc.perform(get("/api/clients/" + clientId))
                .andExpect(jsonPath("$.data.name").value("Acme " + docExisting));
    }

    @Test
    void importAssets_shouldResolveClientAndRejectOwnershipChanges() throws Exception {
        String docA = randomDocument();
        String clientA = createClient(docA);
        String clientB = createClient(randomDocument());
        String assetOfA = createAsset(clientA, "Chiller " + docA);

        String invalid = "ID,Name,Client ID,Client Document,Type\n"
                + assetOfA + ",Moved," + clientB + ",,\n"
                + ",Orphan,,,pump\n"
                + ",Ghost,,99999999999,pump\n";
        String invalidJob = upload("assets", invalid, "upsert");
        // Orphan 行既没有客户引用也没有任何唯一键，记两条错误
        mockMvc.perform(post("/api/bulk/import/" + invalidJob + "/validate"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.summary.errorsCount").value(4));
        mockMvc.perform(get("/api/bulk/import/" + invalidJob + "/errors"))
                .andExpect(jsonPath("$.data[*].field", hasItems("client_id")))
                .andExpect(jsonPath("$.data[*].rowNumber", hasItems(2, 3, 4)));

        String csv = "ID,Name,Client ID,Client Document,Type\n"
                + ",Pump by document,," + docA + ",pump\n"
                + ",Pump by id," + clientB + ",,pump\n"
                + assetOfA + ",Chiller renamed,,,\n";
        String jobId = upload("assets", csv, "upsert");
        mockMvc.perform(post("/api/bulk/import/" + jobId + "/validate"))
                .andExpect(jsonPath("$.data.status").value("ready_to_confirm"))
                .andExpect(jsonPath("$.data.preview.created").value(2))
                .andExpect(jsonPath("$.data.preview.updated").value(1));

        confirmAndAwait(jobId);

        mockMvc.perform(get("/api/clients/" + clientA + "/assets"))
                .andExpect(jsonPath("$.data.items[*].name", hasItems("Pump by document", "Chiller renamed")));
        mockMvc.perform(get("/api/clients/" + clientB + "/assets"))
                .andExpect(jsonPath("$.data.items[0].name").value("Pump by id"))
                .andExpect(jsonPath("$.data.items[0].type").value("pump"));
    }

    @Test
    void importWorkOrders_clientChangeKeepingForeignAsset_shouldBeRejected() throws Exception {
        String clientA = createClient(randomDocument());
        String docB = randomDocument();
        String clientB = createClient(docB);
        String assetOfA = createAsset(clientA, "Boiler " + docB);
        String assetOfB = createAsset(clientB, "Pump " + docB);
        String orderId = createWorkOrder(clientA, assetOfA);

        String mismatch = upload("work_orders", "ID,Title,Client ID\n" + orderId + ",Leak," + clientB + "\n", "upsert");
        mockMvc.perform(post("/api/bulk/import/" + mismatch + "/validate"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.summary.errorsCount").value(1));
        mockMvc.perform(get("/api/bulk/import/" + mismatch + "/errors"))
                .andExpect(jsonPath("$.data[0].rowNumber").value(2))
                .andExpect(jsonPath("$.data[0].field").value("asset_id"));

        String csv = "ID,Title,Client ID,Client Document,Asset ID,Status\n"
                + orderId + ",Leak," + clientB + ",," + assetOfB + ",in_progress\n"
                + ",New visit,," + docB + ",,\n"
                + ",Wrong asset," + clientB + ",," + assetOfA + ",\n";
        String invalidJob = upload("work_orders", csv, "upsert");
        mockMvc.perform(post("/api/bulk/import/" + invalidJob + "/validate"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.summary.errorsCount").value(1));

        String jobId = upload("work_orders", csv.substring(0, csv.lastIndexOf(",Wrong asset")), "upsert");
        mockMvc.perform(post("/api/bulk/import/" + jobId + "/validate"))
                .andExpect(jsonPath("$.data.status").value("ready_to_confirm"))
                .andExpect(jsonPath("$.data.preview.created").value(1))
                .andExpect(jsonPath("$.data.preview.updated").value(1));

        confirmAndAwait(jobId);

        mockMvc.perform(get("/api/work-orders/" + orderId))
                .andExpect(jsonPath("$.data.clientId").value(clientB))
                .andExpect(jsonPath("$.data.assetId").value(assetOfB))
                .andExpect(jsonPath("$.data.status").value("in_progress"));
        mockMvc.perform(get("/api/work-orders").param("clientId", clientB))
                .andExpect(jsonPath("$.data.items[*].title", hasItems("Leak", "New visit")));
    }

    private String createClient(String document) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/clients").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Acme " + document + "\",\"document\":\"" + document + "\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    private String createAsset(String clientId, String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/clients/" + clientId + "/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    private String createWorkOrder(String clientId, String assetId) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/work-orders").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"clientId\":\"" + clientId + "\",\"assetId\":\"" + assetId
                                + "\",\"title\":\"Inspection\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    private static String randomDocument() {
        return String.valueOf(ThreadLocalRandom.current().nextLong(10_000_000_000L, 99_999_999_999L));
    }
}

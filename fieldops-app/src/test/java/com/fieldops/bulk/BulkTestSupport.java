package com.fieldops.bulk;

import com.fieldops.FieldOpsTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 批量导入测试的公共操作：上传、确认并等待作业结束。
 */
abstract class BulkTestSupport extends FieldOpsTestSupport {

    @Autowired
    protected MockMvc mockMvc;

    protected String upload(String entity, String csv, String mode) throws Exception {
        MvcResult result = mockMvc.perform(multipart("/api/bulk/import/" + entity + "/upload")
                        .file(csvFile(csv))
                        .param("mode", mode)
                        .header("X-User-Id", "admin-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("queued"))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
    }

    /** 确认作业并等待其完成 */
    protected void confirmAndAwait(String jobId) throws Exception {
        mockMvc.perform(post("/api/bulk/import/" + jobId + "/confirm").header("X-User-Id", "admin-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("queued"));
        awaitStatus("/api/bulk/import/" + jobId, "completed");
    }

    protected static MockMultipartFile csvFile(String csv) {
        return new MockMultipartFile("file", "import.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8));
    }

    protected void awaitStatus(String url, String expected) throws Exception {
        String status = null;
        for (int i = 0; i < 100; i++) {
            MvcResult result = mockMvc.perform(get(url)).andReturn();
            status = JsonPath.read(result.getResponse().getContentAsString(), "$.data.status");
            if (expected.equals(status) || "failed".equals(status)) {
                break;
            }
            Thread.sleep(100);
        }
        assertThat(status).isEqualTo(expected);
    }
}

package com.autoping.monitor.ping;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PingJobApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createRequiresUrlAndInterval() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void createProbesImmediatelyAndListsJob() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        long id = createJob("5 minutes");

        mockMvc.perform(get("/api/jobs/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lastResult").value("Success: 200"))
            .andExpect(jsonPath("$.interval").value("5 minutes"))
            .andExpect(jsonPath("$.emailRateLimit").value(30))
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.failureState").value("normal"))
            .andExpect(jsonPath("$.nextRun").isNotEmpty());

        mockMvc.perform(get("/api/jobs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$[*].id").value(hasItem((int) id)));
    }

    @Test
    void toggleStopsAndRestartsJob() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        long id = createJob("1 minute");

        mockMvc.perform(patch("/api/jobs/" + id + "/toggle"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("stopped"))
            .andExpect(jsonPath("$.nextRun").isEmpty());

        mockMvc.perform(patch("/api/jobs/" + id + "/toggle"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("active"));
    }

    @Test
    void resetOfHealthyJobIsRejected() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        long id = createJob("1 minute");

        mockMvc.perform(patch("/api/jobs/" + id + "/reset"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("job_not_permanently_paused"));
    }

    @Test
    void blankEmailClearsAlertAddress() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        long id = createJob("1 minute");

        mockMvc.perform(patch("/api/jobs/" + id + "/email")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"alertEmail\":\"  \"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.alertEmail").isEmpty());
    }

    @Test
    void unknownJobReturnsNotFound() throws Exception {
        mockMvc.perform(patch("/api/jobs/999999/toggle"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("job_not_found"));
    }

    @Test
    void deletedJobIsGone() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        long id = createJob("1 minute");

        mockMvc.perform(delete("/api/jobs/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Job deleted"));

        mockMvc.perform(get("/api/jobs/" + id))
            .andExpect(status().isNotFound());
    }

    private long createJob(String interval) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "url", server.url("/health").toString(),
            "interval", interval,
            "alertEmail", "ops@example.com"
        ));
        String response = mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(response).get("id").asLong();
    }
}

package com.hashfleet.monitor.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hashfleet.monitor.ingest.ReportIngestionService;
import com.hashfleet.monitor.registry.LiveRegistry;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.bigtable.BigtableHistoryStore;
import com.hashfleet.monitor.storage.bigtable.InMemoryWideColumnTable;
import com.hashfleet.monitor.testutil.MutableClock;
import com.hashfleet.monitor.testutil.RecordingBroadcaster;
import com.hashfleet.monitor.testutil.RecordingHistoryStore;
import com.hashfleet.monitor.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.hashfleet.monitor.testutil.TestFactory.BASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class HashrateControllerTest {

    private static final String REPORT = """
            {
              "instance_id": "rig-1",
              "total_hashes": 1000,
              "overall_hashrate": 10.5,
              "recent_hashrate": 12.5,
              "timestamp": "2026-01-24T11:59:58",
              "gpu_count": 2,
              "gpu_available": true,
              "temperature": 68.0,
              "unexpected": "ignored"
            }
            """;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private MutableClock clock;
    private LiveRegistry registry;
    private RecordingHistoryStore historyStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE);
        registry = TestFactory.createRegistry(clock);
        historyStore = new RecordingHistoryStore();
    }

    private MockMvc mockMvc(HistoryStore store) {
        ReportIngestionService ingestion = new ReportIngestionService(registry, new RecordingBroadcaster(), store);
        HashrateController controller = new HashrateController(
                ingestion, registry, new HistoryQueryService(store, registry), store, clock);
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void testReportIsAcceptedAndListed() throws Exception {
        MockMvc mvc = mockMvc(historyStore);

        mvc.perform(post("/api/hashrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REPORT)
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        mvc.perform(get("/api/instances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].instance_id").value("rig-1"))
                .andExpect(jsonPath("$[0].ip_address").value("203.0.113.9"))
                .andExpect(jsonPath("$[0].temperature").value(68.0))
                .andExpect(jsonPath("$[0].gpu_name").doesNotExist());

        mvc.perform(get("/api/stats"))
                .andExpect(jsonPath("$.total_instances").value(1))
                .andExpect(jsonPath("$.total_hashrate").value(12.5))
                .andExpect(jsonPath("$.total_gpus").value(2));

        assertThat(historyStore.written()).hasSize(1);
    }

    @Test
    void testMissingFieldIsBadRequest() throws Exception {
        mockMvc(historyStore).perform(post("/api/hashrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instance_id\": \"rig-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing field: total_hashes"));

        assertThat(registry.size()).isZero();
    }

    @Test
    void testMalformedBodyIsBadRequest() throws Exception {
        mockMvc(historyStore).perform(post("/api/hashrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testPersistenceFailureIsServerError() throws Exception {
        historyStore.setFailing(true);

        mockMvc(historyStore).perform(post("/api/hashrate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REPORT))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("store offline"));

        assertThat(registry.snapshot()).hasSize(1);
    }

    @Test
    void testStaleProducersAreNotListed() throws Exception {
        MockMvc mvc = mockMvc(historyStore);
        mvc.perform(post("/api/hashrate").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isOk());

        clock.advanceSeconds(31);

        mvc.perform(get("/api/instances")).andExpect(jsonPath("$", hasSize(0)));
        mvc.perform(get("/api/stats"))
                .andExpect(jsonPath("$.total_instances").value(0))
                .andExpect(jsonPath("$.avg_hashrate").value(0.0));
    }

    @Test
    void testHistoryDefaultsAndFailures() throws Exception {
        MockMvc mvc = mockMvc(historyStore);
        mvc.perform(post("/api/hashrate").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isOk());

        mvc.perform(get("/api/history/rig-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].hashrate").value(12.5));

        historyStore.setFailing(true);
        mvc.perform(get("/api/history/rig-1").param("hours", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testSummaryCombinesLiveAndPersisted() throws Exception {
        MockMvc mvc = mockMvc(historyStore);
        mvc.perform(post("/api/hashrate").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isOk());

        mvc.perform(get("/api/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current.active_instances").value(1))
                .andExpect(jsonPath("$.current.total_hashrate").value(12.5))
                .andExpect(jsonPath("$.last_24h.unique_instances").value(1))
                .andExpect(jsonPath("$.last_24h.hours").value(24))
                .andExpect(jsonPath("$.last_24h.window").value("TRAILING_WINDOW"));
    }

    /**
     * A failed history read keeps the live half and labels the stored half as unavailable.
     */
    @Test
    void testSummaryWithFailingStoreIsLabelledUnavailable() throws Exception {
        MockMvc mvc = mockMvc(historyStore);
        mvc.perform(post("/api/hashrate").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isOk());

        historyStore.setFailing(true);

        mvc.perform(get("/api/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current.active_instances").value(1))
                .andExpect(jsonPath("$.last_24h.unique_instances").value(0))
                .andExpect(jsonPath("$.last_24h.window").value("UNAVAILABLE"));
    }

    @Test
    void testStoredInstancesNotSupportedOnRowStore() throws Exception {
        mockMvc(historyStore).perform(get("/api/stored-instances"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testStoredInstancesFromWideColumnStore() throws Exception {
        MockMvc mvc = mockMvc(new BigtableHistoryStore(new InMemoryWideColumnTable(), clock));
        mvc.perform(post("/api/hashrate").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isOk());

        mvc.perform(get("/api/stored-instances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].instance_id").value("rig-1"))
                .andExpect(jsonPath("$[0].last_seen").value("2026-01-24T11:59:58.000000Z"))
                .andExpect(jsonPath("$[0].hashrate").value(12.5))
                .andExpect(jsonPath("$[0].temperature").value(68.0));

        mvc.perform(get("/api/summary"))
                .andExpect(jsonPath("$.last_24h.window").value("CURRENT_SNAPSHOT"));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc(historyStore).perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").value("2026-01-24T12:00:00Z"))
                .andExpect(jsonPath("$.backend").value("recording"));
    }
}

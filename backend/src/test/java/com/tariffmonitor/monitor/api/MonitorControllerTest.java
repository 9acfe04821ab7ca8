package com.tariffmonitor.monitor.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class MonitorControllerTest {

  @Autowired
  private WebApplicationContext context;

  @TempDir
  Path tempDir;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
  }

  @Test
  void runsEndpointIsPostOnly() throws Exception {
    mockMvc.perform(get("/api/monitor/runs"))
        .andExpect(status().isMethodNotAllowed());
  }

  @Test
  void emptySourceListCompletesWithEmptyRecord() throws Exception {
    Path sourceList = tempDir.resolve("empty_sources.json");
    Files.writeString(sourceList, "[]");

    mockMvc.perform(post("/api/monitor/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"sourceListPath\": \"" + sourceList.toString().replace("\\", "\\\\") + "\", \"quickMode\": true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.quickMode").value(true))
        .andExpect(jsonPath("$.record.sources.length()").value(0))
        .andExpect(jsonPath("$.reportPath").isNotEmpty());
  }

  @Test
  void missingSourceListIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/monitor/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"sourceListPath\": \"/definitely/not/here.json\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_source_list"));
  }

  @Test
  void activeFlagIsReported() throws Exception {
    mockMvc.perform(get("/api/monitor/runs/active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(false));
  }
}

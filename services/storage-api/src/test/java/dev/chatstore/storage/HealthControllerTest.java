package dev.chatstore.storage;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    MockMvc mvc;

    @Test
    void health_isPublic_andReportsUptime() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.startTime", endsWith("Z")))
                .andExpect(jsonPath("$.currentTime", endsWith("Z")))
                .andExpect(jsonPath("$.uptime").isNotEmpty());
    }

    @Test
    void formatUptime_splitsIntoParts() {
        Duration uptime = Duration.ofDays(2).plusHours(3).plusMinutes(4).plusSeconds(5);

        assertThat(HealthController.formatUptime(uptime)).isEqualTo("2d 3hrs 4mins 5s");
        assertThat(HealthController.formatUptime(Duration.ZERO)).isEqualTo("0d 0hrs 0mins 0s");
    }
}

package com.signal.controller;

import com.signal.model.Bar;
import com.signal.service.SignalEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@TestPropertySource(properties = {
        "signal.generator.enabled=false",
        "signal.news.enabled=false"
})
@DisplayName("IngestController integration tests")
class IngestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SignalEngine engine;

    private static String tick(double price, long timestamp) {
        return "{\"price\": " + price + ", \"timestamp\": " + timestamp + "}";
    }

    @Test
    @DisplayName("POST /ticks accepts a valid tick and rolls bars")
    void tickAccepted() throws Exception {
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.1, 1_700_000_100_000L)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"));
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.2, 1_700_000_160_000L)))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/status"))
                .andExpect(jsonPath("$.barsSealed").value(1))
                .andExpect(jsonPath("$.latestPrice").value(1.2));
    }

    @Test
    @DisplayName("POST /ticks rejects an out-of-order tick with 409")
    void tickOutOfOrder() throws Exception {
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.1, 1_700_000_160_000L)))
                .andExpect(status().isAccepted());
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.1, 1_700_000_100_000L)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("rejected: out of order"));
    }

    @Test
    @DisplayName("POST /ticks rejects a tick that falls inside seeded history with 409")
    void tickInsideSeededHistory() throws Exception {
        engine.seed(List.of(
                new Bar(1_700_000_100_000L, 1.1, 1.1, 1.1, 1.1, 0),
                new Bar(1_700_000_160_000L, 1.1, 1.1, 1.1, 1.1, 0)));

        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.2, 1_700_000_165_000L)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("rejected: out of order"));
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(1.2, 1_700_000_220_000L)))
                .andExpect(status().isAccepted());
    }

    @Test
    @DisplayName("POST /ticks with a missing or invalid price returns 400")
    void tickInvalid() throws Exception {
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content("{\"timestamp\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", startsWith("error")));
        mockMvc.perform(post("/ticks").contentType(MediaType.APPLICATION_JSON).content(tick(-1.0, 1L)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", startsWith("error")));
    }

    @Test
    @DisplayName("POST /news feeds sentiment and shows up in /status")
    void newsAccepted() throws Exception {
        mockMvc.perform(post("/news").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"headline\": \"ECB surprises with hike\", \"sentiment\": \"POSITIVE\", \"impact\": \"HIGH\"}"))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/status"))
                .andExpect(jsonPath("$.lastNews.headline").value("ECB surprises with hike"))
                .andExpect(jsonPath("$.lastNews.source").value("api"));
    }

    @Test
    @DisplayName("POST /news with a blank headline or unknown sentiment returns 400")
    void newsInvalid() throws Exception {
        mockMvc.perform(post("/news").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"headline\": \" \", \"sentiment\": \"POSITIVE\", \"impact\": \"LOW\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", startsWith("error")));
        mockMvc.perform(post("/news").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"headline\": \"x\", \"sentiment\": \"EUPHORIC\", \"impact\": \"LOW\"}"))
                .andExpect(status().isBadRequest());
    }
}

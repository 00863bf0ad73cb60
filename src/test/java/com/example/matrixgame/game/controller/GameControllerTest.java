package com.example.matrixgame.game.controller;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class GameControllerTest {

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("creating a game answers 201 with the lobby state")
    void createGame() throws Exception {
        mockMvc.perform(post("/api/games")
                        .header(USER_HEADER, "host-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Strait crisis", "hostName": "Host",
                                 "settings": {"argumentLimit": 2},
                                 "personas": [{"name": "Navy", "isNpc": false}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("LOBBY"))
                .andExpect(jsonPath("$.data.currentPhase").value("WAITING"))
                .andExpect(jsonPath("$.data.settings.argumentLimit").value(2))
                .andExpect(jsonPath("$.data.players.length()").value(1))
                .andExpect(jsonPath("$.data.personas[0].name").value("Navy"));
    }

    @Test
    @DisplayName("a request without a caller identity is refused")
    void missingIdentity() throws Exception {
        mockMvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"hostName\": \"y\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));
    }

    @Test
    @DisplayName("error kinds map to 404, 400 and 409")
    void errorMapping() throws Exception {
        mockMvc.perform(get("/api/games/{gameId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GAME_NOT_FOUND"));

        mockMvc.perform(post("/api/games")
                        .header(USER_HEADER, "host-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\", \"hostName\": \"Host\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        String host = "host-" + UUID.randomUUID();
        Long gameId = createGame(host);
        mockMvc.perform(post("/api/games/{gameId}/start", gameId).header(USER_HEADER, host))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_ENOUGH_PLAYERS"));

        mockMvc.perform(post("/api/games/{gameId}/join", gameId)
                        .header(USER_HEADER, host)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerName\": \"Again\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    @DisplayName("the strategy catalogue lists both strategies")
    void resolutionStrategies() throws Exception {
        mockMvc.perform(get("/api/resolution-strategies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].id", hasItems("token_draw", "arbiter")));
    }

    private Long createGame(String host) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/games")
                        .header(USER_HEADER, host)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Game\", \"hostName\": \"Host\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("data").path("id").asLong();
    }
}

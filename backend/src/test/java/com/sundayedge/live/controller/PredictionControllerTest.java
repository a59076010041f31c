package com.sundayedge.live.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sundayedge.live.model.LedgerStatistics;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionPayload;
import com.sundayedge.live.model.PredictionStatus;
import com.sundayedge.live.service.PredictionLedger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PredictionControllerTest {
  @Mock private PredictionLedger predictionLedger;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new PredictionController(predictionLedger)).build();
  }

  @Test
  void createsPrediction() throws Exception {
    when(predictionLedger.createPrediction(
            eq("wk1-kc-buf"), eq(PredictionKind.MONEYLINE), any(PredictionPayload.class)))
        .thenReturn(prediction(PredictionStatus.PENDING));

    mockMvc
        .perform(
            post("/api/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"gameId\":\"wk1-kc-buf\",\"kind\":\"MONEYLINE\","
                        + "\"payload\":{\"pick\":\"Kansas City Chiefs\",\"confidence\":72}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("OK"))
        .andExpect(jsonPath("$.prediction.id").value("wk1-kc-buf:MONEYLINE"));
  }

  @Test
  void unknownGameReportsFailure() throws Exception {
    when(predictionLedger.createPrediction(eq("wk9-x"), eq(PredictionKind.SPREAD), any()))
        .thenThrow(new IllegalArgumentException("Unknown game: wk9-x"));

    mockMvc
        .perform(
            post("/api/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gameId\":\"wk9-x\",\"kind\":\"SPREAD\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.message").value("Unknown game: wk9-x"));
  }

  @Test
  void resolvesFlaggedPrediction() throws Exception {
    when(predictionLedger.resolveManually("wk1-kc-buf:MONEYLINE", PredictionStatus.PUSH))
        .thenReturn(prediction(PredictionStatus.PUSH));

    mockMvc
        .perform(post("/api/predictions/wk1-kc-buf:MONEYLINE/resolve").param("status", "push"))
        .andExpect(jsonPath("$.status").value("OK"))
        .andExpect(jsonPath("$.prediction.status").value("PUSH"));
  }

  @Test
  void invalidResolutionStatusReportsFailure() throws Exception {
    mockMvc
        .perform(post("/api/predictions/wk1-kc-buf:MONEYLINE/resolve").param("status", "maybe"))
        .andExpect(jsonPath("$.status").value("FAILED"));
  }

  @Test
  void listsPredictionsAndStatistics() throws Exception {
    when(predictionLedger.listPredictions("wk1-kc-buf"))
        .thenReturn(List.of(prediction(PredictionStatus.WIN)));
    when(predictionLedger.getStatistics()).thenReturn(new LedgerStatistics());

    mockMvc
        .perform(get("/api/predictions").param("gameId", "wk1-kc-buf"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].status").value("WIN"));
    mockMvc.perform(get("/api/predictions/statistics")).andExpect(status().isOk());
  }

  private static Prediction prediction(PredictionStatus status) {
    Prediction prediction = new Prediction();
    prediction.setId("wk1-kc-buf:MONEYLINE");
    prediction.setGameId("wk1-kc-buf");
    prediction.setKind(PredictionKind.MONEYLINE);
    prediction.setPick("Kansas City Chiefs");
    prediction.setConfidence(72);
    prediction.setStatus(status);
    return prediction;
  }
}

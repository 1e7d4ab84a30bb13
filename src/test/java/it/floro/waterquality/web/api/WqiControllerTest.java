package it.floro.waterquality.web.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test end-to-end degli endpoint /api/wqi: richiesta HTTP, calcolo e mappatura degli errori.
 */
@SpringBootTest
@AutoConfigureMockMvc
public class WqiControllerTest {

    private static final String REFERENCE =
            "{\"ph\":7.6,\"bod\":2.2,\"dissolvedOxygen\":5.5,\"fecalColiform\":6}";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testCalculateFromBody() throws Exception {
        mockMvc.perform(post("/api/wqi/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REFERENCE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wqi").value(closeTo(83.17, 0.05)))
                .andExpect(jsonPath("$.subIndices.ph").value(closeTo(90.10, 0.01)))
                .andExpect(jsonPath("$.weightedIndices.dissolvedOxygen").value(closeTo(26.49, 0.01)))
                .andExpect(jsonPath("$.classification").value("Good to Excellent"))
                .andExpect(jsonPath("$.cpcbClass").value("A"))
                .andExpect(jsonPath("$.status").value("Non Polluted"))
                .andExpect(jsonPath("$.mpcbClass").value("A-I"));
    }

    @Test
    void testCalculateFromQueryString() throws Exception {
        mockMvc.perform(get("/api/wqi/calculate")
                        .param("ph", "4")
                        .param("bod", "40")
                        .param("dissolvedOxygen", "0.5")
                        .param("fecalColiform", "200000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wqi").value(closeTo(12.58, 0.05)))
                .andExpect(jsonPath("$.classification").value("Bad to Very Bad"))
                .andExpect(jsonPath("$.cpcbClass").value("D/E"));
    }

    @Test
    void testZeroFecalColiformIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/wqi/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ph\":7.0,\"bod\":2.0,\"dissolvedOxygen\":6.0,\"fecalColiform\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.parameter").value("fecalColiform"));
    }

    @Test
    void testMissingFieldIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/wqi/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ph\":7.0,\"bod\":2.0,\"fecalColiform\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Parametro obbligatorio mancante: dissolvedOxygen"));
    }

    @Test
    void testMissingOrMalformedQueryParameter() throws Exception {
        mockMvc.perform(get("/api/wqi/calculate")
                        .param("ph", "7")
                        .param("bod", "2")
                        .param("dissolvedOxygen", "6"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("fecalColiform"));

        mockMvc.perform(get("/api/wqi/calculate")
                        .param("ph", "neutro")
                        .param("bod", "2")
                        .param("dissolvedOxygen", "6")
                        .param("fecalColiform", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("ph"));
    }

    @Test
    void testBatch() throws Exception {
        mockMvc.perform(post("/api/wqi/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + REFERENCE + ",{\"ph\":4,\"bod\":40,\"dissolvedOxygen\":0.5,\"fecalColiform\":200000}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].classification").value("Good to Excellent"))
                .andExpect(jsonPath("$[1].classification").value("Bad to Very Bad"));

        mockMvc.perform(post("/api/wqi/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + REFERENCE + ",{\"ph\":7,\"bod\":2,\"dissolvedOxygen\":6,\"fecalColiform\":-1}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("Lettura #1")))
                .andExpect(jsonPath("$.parameter").value("fecalColiform"));
    }

    @Test
    void testBatchWithNullReadingIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/wqi/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + REFERENCE + ",null]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(startsWith("Lettura #1")));
    }

    @Test
    void testValidate() throws Exception {
        mockMvc.perform(post("/api/wqi/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ph\":7.0,\"bod\":2.0,\"dissolvedOxygen\":25.0,\"fecalColiform\":10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.issues", hasSize(1)))
                .andExpect(jsonPath("$.issues[0]").value("Dissolved Oxygen out of realistic range (0-20 mg/l)"));
    }

    @Test
    void testStandard() throws Exception {
        mockMvc.perform(get("/api/wqi/standard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weights.dissolvedOxygen").value(0.31))
                .andExpect(jsonPath("$.weights.fecalColiform").value(0.28))
                .andExpect(jsonPath("$.weights.ph").value(0.22))
                .andExpect(jsonPath("$.weights.bod").value(0.19))
                .andExpect(jsonPath("$.bands", hasSize(4)))
                .andExpect(jsonPath("$.bands[0].minWqi").value(63.0))
                .andExpect(jsonPath("$.bands[3].cpcbClass").value("D/E"));
    }
}

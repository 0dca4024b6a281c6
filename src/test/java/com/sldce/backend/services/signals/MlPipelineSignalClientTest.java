package com.sldce.backend.services.signals;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.sldce.backend.config.SignalProviderProperties;
import com.sldce.backend.entities.Dataset;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.UpstreamSignalException;

class MlPipelineSignalClientTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MlPipelineSignalClient client;
    private Sample sample;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.createServer(restTemplate);
        client = new MlPipelineSignalClient(restTemplate, new SignalProviderProperties("http://ml-pipeline:8000/", 5));
        sample = Sample.builder()
                .id(42L)
                .dataset(Dataset.builder().id(7L).build())
                .sampleIndex(3)
                .features(List.of(0.5, 1.5))
                .originalLabel(0)
                .currentLabel(0)
                .build();
    }

    @Test
    void predict_postsSampleAndParsesPrediction() {
        server.expect(requestTo("http://ml-pipeline:8000/predict"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.sample_id").value(42))
                .andExpect(jsonPath("$.dataset_id").value(7))
                .andExpect(jsonPath("$.current_label").value(0))
                .andExpect(jsonPath("$.features[1]").value(1.5))
                .andRespond(withSuccess("{\"predicted_label\":2,\"confidence\":0.93,\"model\":\"rf\"}",
                        MediaType.APPLICATION_JSON));

        SignalPrediction prediction = client.predict(sample);

        assertThat(prediction.predictedLabel()).isEqualTo(2);
        assertThat(prediction.confidence()).isEqualTo(0.93);
        server.verify();
    }

    @Test
    void anomalyScore_parsesScore() {
        server.expect(requestTo("http://ml-pipeline:8000/anomaly-score"))
                .andRespond(withSuccess("{\"anomaly_score\":0.41}", MediaType.APPLICATION_JSON));

        assertThat(client.anomalyScore(sample)).isEqualTo(0.41);
        server.verify();
    }

    @Test
    void predict_serverError_isUpstreamFailure() {
        server.expect(requestTo("http://ml-pipeline:8000/predict"))
                .andRespond(withServerError().body("model not loaded"));

        assertThatThrownBy(() -> client.predict(sample))
                .isInstanceOf(UpstreamSignalException.class)
                .hasMessageContaining("500")
                .hasMessageContaining("model not loaded");
    }

    @Test
    void anomalyScore_missingField_isUpstreamFailure() {
        server.expect(requestTo("http://ml-pipeline:8000/anomaly-score"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.anomalyScore(sample))
                .isInstanceOf(UpstreamSignalException.class)
                .hasMessageContaining("sample 42");
    }
}

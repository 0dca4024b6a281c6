package com.sldce.backend.services.signals;

import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sldce.backend.config.SignalProviderProperties;
import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.UpstreamSignalException;

import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for the ML pipeline service that hosts the trained classifier and anomaly detector.
 */
@Slf4j
@Component
public class MlPipelineSignalClient implements SignalProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public MlPipelineSignalClient(RestTemplate restTemplate, SignalProviderProperties properties) {
        this.restTemplate = restTemplate;
        String url = properties.baseUrl().trim();
        if (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
    }

    @Override
    public SignalPrediction predict(Sample sample) {
        PredictResponse response = post("/predict", sample, PredictResponse.class);
        if (response.predictedLabel() == null || response.confidence() == null) {
            throw new UpstreamSignalException("ml-pipeline returned an incomplete prediction for sample " + sample.getId());
        }
        return new SignalPrediction(response.predictedLabel(), response.confidence());
    }

    @Override
    public double anomalyScore(Sample sample) {
        AnomalyResponse response = post("/anomaly-score", sample, AnomalyResponse.class);
        if (response.anomalyScore() == null) {
            throw new UpstreamSignalException("ml-pipeline returned no anomaly score for sample " + sample.getId());
        }
        return response.anomalyScore();
    }

    private <T> T post(String path, Sample sample, Class<T> responseType) {
        String url = baseUrl + path;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<SampleRequest> request = new HttpEntity<>(SampleRequest.of(sample), headers);

        try {
            ResponseEntity<T> response = restTemplate.postForEntity(url, request, responseType);
            T body = response.getBody();
            if (body == null) {
                throw new UpstreamSignalException("ml-pipeline returned empty body from " + path + " for sample " + sample.getId());
            }
            return body;
        } catch (HttpStatusCodeException e) {
            String payload = e.getResponseBodyAsString();
            String msg = "ml-pipeline error status=" + e.getStatusCode() + " path=" + path + " sample=" + sample.getId()
                    + " body=" + (payload.length() > 500 ? payload.substring(0, 500) : payload);
            log.warn("[MlPipelineSignalClient] {}", msg);
            throw new UpstreamSignalException(msg, e);
        } catch (ResourceAccessException e) {
            log.warn("[MlPipelineSignalClient] ml-pipeline unreachable url={}: {}", url, e.getMessage());
            throw new UpstreamSignalException("ml-pipeline unreachable at " + url, e);
        } catch (RestClientException e) {
            throw new UpstreamSignalException("ml-pipeline call failed for sample " + sample.getId() + ": " + e.getMessage(), e);
        }
    }

    public record SampleRequest(
            @JsonProperty("dataset_id") Long datasetId,
            @JsonProperty("sample_id") Long sampleId,
            @JsonProperty("sample_index") int sampleIndex,
            List<Double> features,
            @JsonProperty("current_label") int currentLabel
    ) {
        static SampleRequest of(Sample sample) {
            Long datasetId = sample.getDataset() != null ? sample.getDataset().getId() : null;
            return new SampleRequest(datasetId, sample.getId(), sample.getSampleIndex(), sample.getFeatures(), sample.getCurrentLabel());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PredictResponse(
            @JsonProperty("predicted_label") Integer predictedLabel,
            Double confidence
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnomalyResponse(@JsonProperty("anomaly_score") Double anomalyScore) {
    }
}

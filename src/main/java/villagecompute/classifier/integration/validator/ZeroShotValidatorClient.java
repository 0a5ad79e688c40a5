package villagecompute.classifier.integration.validator;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.LabelScoreType;
import villagecompute.classifier.exceptions.ValidatorException;

/**
 * HTTP client for a zero-shot classification endpoint (Hugging Face inference format, e.g. facebook/bart-large-mnli).
 *
 * <p>
 * Request body:
 *
 * <pre>
 * {"inputs": "...", "parameters": {"candidate_labels": ["A", "B"], "multi_label": false}}
 * </pre>
 *
 * <p>
 * Response body: {@code {"sequence": "...", "labels": ["B", "A"], "scores": [0.8, 0.2]}}. Some deployments wrap the
 * object in a single-element array; both shapes are accepted.
 */
@ApplicationScoped
public class ZeroShotValidatorClient {

    private static final Logger LOG = Logger.getLogger(ZeroShotValidatorClient.class);

    @ConfigProperty(
            name = "classifier.validator.url",
            defaultValue = "http://localhost:8003/models/facebook/bart-large-mnli")
    String validatorUrl;

    @ConfigProperty(
            name = "classifier.validator.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "classifier.validator.timeout-seconds",
            defaultValue = "30")
    int timeoutSeconds;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public ZeroShotValidatorClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    /**
     * Scores the text against every candidate label.
     *
     * @param text
     *            text to classify
     * @param candidateLabels
     *            labels to choose from
     * @return labels with scores, highest score first
     * @throws ValidatorException
     *             if the endpoint fails, times out or answers with an unreadable payload
     */
    public List<LabelScoreType> classify(String text, List<String> candidateLabels) {
        if (candidateLabels == null || candidateLabels.isEmpty()) {
            throw new ValidatorException("Zero-shot validation requires at least one candidate label");
        }
        LOG.debugf("Zero-shot validation against %d labels", candidateLabels.size());

        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("inputs", text == null ? "" : text);
            ObjectNode parameters = body.putObject("parameters");
            ArrayNode labels = parameters.putArray("candidate_labels");
            candidateLabels.forEach(labels::add);
            parameters.put("multi_label", false);

            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(validatorUrl))
                    .timeout(Duration.ofSeconds(timeoutSeconds)).header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            if (apiKey != null) {
                apiKey.filter(k -> !k.isBlank()).ifPresent(k -> builder.header("Authorization", "Bearer " + k));
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ValidatorException(
                        "Zero-shot validator returned status " + response.statusCode() + ": " + response.body());
            }

            return parseResponse(objectMapper.readTree(response.body()));

        } catch (ValidatorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidatorException("Interrupted while calling zero-shot validator", e);
        } catch (Exception e) {
            LOG.warnf("Zero-shot validator call failed: %s", e.getMessage());
            throw new ValidatorException("Zero-shot validator call failed: " + e.getMessage(), e);
        }
    }

    List<LabelScoreType> parseResponse(JsonNode root) {
        JsonNode result = root.isArray() && root.size() > 0 ? root.get(0) : root;

        if (result.has("error")) {
            throw new ValidatorException("Zero-shot validator error: " + result.get("error").asText());
        }

        JsonNode labels = result.get("labels");
        JsonNode scores = result.get("scores");
        if (labels == null || scores == null || !labels.isArray() || !scores.isArray()
                || labels.size() != scores.size() || labels.isEmpty()) {
            throw new ValidatorException("Invalid response from zero-shot validator: missing labels or scores");
        }

        List<LabelScoreType> results = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            results.add(new LabelScoreType(labels.get(i).asText(), scores.get(i).asDouble()));
        }
        results.sort(Comparator.comparingDouble(LabelScoreType::score).reversed());
        return results;
    }
}

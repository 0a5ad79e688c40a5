package villagecompute.classifier.integration.store;

import java.util.Map;

/**
 * One search result from the similarity store.
 *
 * @param id
 *            entry identifier
 * @param payload
 *            payload stored with the entry
 * @param score
 *            relevance score in [0,1], higher is closer
 */
public record SimilarityHit(String id, Map<String, Object> payload, double score) {

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? "" : value.toString();
    }

    public double payloadDouble(String key) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}

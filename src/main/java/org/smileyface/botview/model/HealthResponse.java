package org.smileyface.botview.model;

import java.util.Map;

/**
 * Service status: cache backend and per-identity strategy availability in priority order.
 */
public record HealthResponse(String status,
                             String cacheType,
                             Map<String, Boolean> crawlerStrategies,
                             Map<String, Boolean> visitorStrategies) {
}

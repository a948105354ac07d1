package com.evidencetrust.enhancement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.evidencetrust.governance.Dimension;

/**
 * Maps external finding categories to the dimension that receives them. The mapping must cover
 * every {@link ExternalCategory} and may only target adjustable dimensions.
 */
public final class FindingRouter {
    private final Map<ExternalCategory, Dimension> routes;

    public FindingRouter(Map<ExternalCategory, Dimension> routes) {
        EnumMap<ExternalCategory, Dimension> copy = new EnumMap<>(ExternalCategory.class);
        for (ExternalCategory category : ExternalCategory.values()) {
            Dimension target = routes.get(category);
            if (target == null) {
                throw new IllegalArgumentException("No route for external category " + category);
            }
            if (!target.adjustable()) {
                throw new IllegalArgumentException(
                        "External category " + category + " may not be routed to " + target.key());
            }
            copy.put(category, target);
        }
        this.routes = Collections.unmodifiableMap(copy);
    }

    public static FindingRouter defaults() {
        EnumMap<ExternalCategory, Dimension> routes = new EnumMap<>(ExternalCategory.class);
        routes.put(ExternalCategory.METHODOLOGY, Dimension.METHODOLOGY);
        routes.put(ExternalCategory.COMPLETENESS, Dimension.COMPLETENESS);
        routes.put(ExternalCategory.BIAS_DETECTION, Dimension.BIAS_DETECTION);
        routes.put(ExternalCategory.BIAS, Dimension.BIAS_DETECTION);
        return new FindingRouter(routes);
    }

    public Dimension route(ExternalCategory category) {
        return routes.get(category);
    }

    /**
     * @return the target dimension, or empty when the category string is not a known category
     */
    public Optional<Dimension> route(String category) {
        return ExternalCategory.parse(category).map(routes::get);
    }

    public Map<ExternalCategory, Dimension> routes() {
        return routes;
    }
}

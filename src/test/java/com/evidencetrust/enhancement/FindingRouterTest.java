package com.evidencetrust.enhancement;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.Dimension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FindingRouterTest {

    @Test
    void shouldRouteKnownCategoriesAndAliases() {
        FindingRouter router = FindingRouter.defaults();

        assertEquals(Optional.of(Dimension.METHODOLOGY), router.route("Methodology"));
        assertEquals(Optional.of(Dimension.BIAS_DETECTION), router.route("bias"));
        assertEquals(Optional.of(Dimension.BIAS_DETECTION), router.route("bias-detection"));
        assertEquals(Optional.of(Dimension.COMPLETENESS), router.route("completeness"));
    }

    @Test
    void shouldDropUnknownCategories() {
        FindingRouter router = FindingRouter.defaults();

        assertEquals(Optional.empty(), router.route("evidence_integrity"));
        assertEquals(Optional.empty(), router.route("scope"));
        assertEquals(Optional.empty(), router.route((String) null));
    }

    @Test
    void shouldRejectRouteIntoEvidenceIntegrity() {
        Map<ExternalCategory, Dimension> routes = new EnumMap<>(FindingRouter.defaults().routes());
        routes.put(ExternalCategory.COMPLETENESS, Dimension.EVIDENCE_INTEGRITY);

        assertThrows(IllegalArgumentException.class, () -> new FindingRouter(routes));
    }

    @Test
    void shouldRejectIncompleteMapping() {
        Map<ExternalCategory, Dimension> routes = new EnumMap<>(FindingRouter.defaults().routes());
        routes.remove(ExternalCategory.BIAS);

        assertThrows(IllegalArgumentException.class, () -> new FindingRouter(routes));
    }
}

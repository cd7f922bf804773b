package dev.pekelund.reconciler.service;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so log lines emitted during a
 * reconciliation run share the same identifiers (run id, offer document, stage).
 */
final class ReconciliationMdc {

    static final String KEY_RUN_ID = "reconciliation.runId";
    static final String KEY_OFFER = "reconciliation.offer";
    static final String KEY_STAGE = "reconciliation.stage";

    private ReconciliationMdc() {
        // Utility class
    }

    static Context open(String runId, String offerDocument) {
        return new Context(runId, offerDocument);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String runId, String offerDocument) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_RUN_ID, runId);
            putIfHasText(KEY_OFFER, offerDocument);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}

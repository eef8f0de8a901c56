package com.clawrelay.autoreply.queue;

import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;
import com.clawrelay.common.session.SessionEntry;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves effective queue settings.
 * Precedence: session entry → byTransport (mode only) → messages.queue →
 * built-in defaults. Invalid configured values are skipped.
 */
public final class QueueSettingsResolver {

    private QueueSettingsResolver() {
    }

    public static QueueSettings resolve(RelayConfig cfg, String transport, SessionEntry entry) {
        RelayConfig.QueueConfig queueCfg = cfg != null && cfg.getMessages() != null
                ? cfg.getMessages().getQueue()
                : null;
        SessionEntry session = entry != null ? entry : SessionEntry.empty();

        QueueMode mode = session.getQueueMode();
        if (mode == null) {
            mode = transportMode(queueCfg, transport);
        }
        if (mode == null && queueCfg != null) {
            mode = QueueMode.normalize(queueCfg.getMode());
        }
        if (mode == null) {
            mode = QueueSettings.DEFAULT_MODE;
        }

        int debounceMs = firstNonNegative(session.getQueueDebounceMs(),
                queueCfg != null ? queueCfg.getDebounceMs() : null, QueueSettings.DEFAULT_DEBOUNCE_MS);
        int cap = firstPositive(session.getQueueCap(),
                queueCfg != null ? queueCfg.getCap() : null, QueueSettings.DEFAULT_CAP);

        QueueDropPolicy drop = session.getQueueDrop();
        if (drop == null && queueCfg != null) {
            drop = QueueDropPolicy.normalize(queueCfg.getDrop());
        }
        if (drop == null) {
            drop = QueueSettings.DEFAULT_DROP;
        }
        return new QueueSettings(mode, debounceMs, cap, drop);
    }

    private static QueueMode transportMode(RelayConfig.QueueConfig queueCfg, String transport) {
        if (queueCfg == null || transport == null || transport.isBlank()) {
            return null;
        }
        Map<String, String> byTransport = queueCfg.getByTransport();
        if (byTransport == null) {
            return null;
        }
        String raw = byTransport.get(transport.trim().toLowerCase(Locale.ROOT));
        if (raw == null) {
            raw = byTransport.get(transport);
        }
        return QueueMode.normalize(raw);
    }

    private static int firstNonNegative(Integer session, Integer configured, int fallback) {
        if (session != null && session >= 0) {
            return session;
        }
        if (configured != null && configured >= 0) {
            return configured;
        }
        return fallback;
    }

    private static int firstPositive(Integer session, Integer configured, int fallback) {
        if (session != null && session > 0) {
            return session;
        }
        if (configured != null && configured > 0) {
            return configured;
        }
        return fallback;
    }
}

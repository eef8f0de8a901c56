package com.clawrelay.agent.runtime;

import com.clawrelay.agent.TestConfigs;
import com.clawrelay.common.config.RelayConfig;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ElevatedGateTest {

    @Nested
    class Allowlists {

        @Test
        void globalAndAgentAllowlists_bothAdmitSender() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "+15551234567");
            TestConfigs.agentElevated(cfg, "main", null, "whatsapp", "+15551234567");

            ElevatedGate.ElevatedPermissions p = ElevatedGate.resolve(cfg, "main", "whatsapp", "+15551234567");

            assertTrue(p.enabled());
            assertTrue(p.allowed());
            assertTrue(p.failures().isEmpty());
        }

        @Test
        void missingFromGlobalList_isRefused() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "+15550000000");
            TestConfigs.agentElevated(cfg, "main", null, "whatsapp", "+15551234567");

            ElevatedGate.ElevatedPermissions p = ElevatedGate.resolve(cfg, "main", "whatsapp", "+15551234567");

            assertFalse(p.allowed());
            assertEquals(List.of(new ElevatedGate.GateFailure("allowFrom", "tools.elevated.allowFrom.whatsapp")),
                    p.failures());
        }

        @Test
        void missingFromAgentList_isRefusedWithAgentKey() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "+15551234567");
            TestConfigs.agentElevated(cfg, "main", null, "whatsapp", "+15550000000");

            ElevatedGate.ElevatedPermissions p = ElevatedGate.resolve(cfg, "main", "whatsapp", "+15551234567");

            assertFalse(p.allowed());
            assertEquals("agents.list[].tools.elevated.allowFrom.whatsapp", p.failures().get(0).key());
        }

        @Test
        void unconfiguredAgentList_doesNotRestrict() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "telegram", "alice");

            assertTrue(ElevatedGate.resolve(cfg, "main", "telegram", "alice").allowed());
        }

        @Test
        void noGlobalList_admitsNobody() {
            assertFalse(ElevatedGate.resolve(new RelayConfig(), "main", "telegram", "alice").allowed());
        }

        @Test
        void wildcard_admitsEveryone() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "discord", "*");

            assertTrue(ElevatedGate.resolve(cfg, "main", "discord", "anyone").allowed());
        }

        @ParameterizedTest
        @ValueSource(strings = { "whatsapp:+15551234567", "  +15551234567 ", "WhatsApp:+15551234567" })
        void senderPrefixesAndWhitespace_areIgnored(String sender) {
            Map<String, List<String>> allowFrom = Map.of("whatsapp", List.of("+15551234567"));

            assertTrue(ElevatedGate.isApprovedSender(allowFrom, "whatsapp", sender));
        }

        @Test
        void slugMatching_ignoresCaseAndPunctuation() {
            Map<String, List<String>> allowFrom = Map.of("slack", List.of("@Jane Doe"));

            assertTrue(ElevatedGate.isApprovedSender(allowFrom, "slack", "jane-doe"));
            assertFalse(ElevatedGate.isApprovedSender(allowFrom, "slack", "john-doe"));
        }
    }

    @Nested
    class Switches {

        @Test
        void globallyDisabled_failsEnabledGate() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "*");
            cfg.getTools().getElevated().setEnabled(false);

            ElevatedGate.ElevatedPermissions p = ElevatedGate.resolve(cfg, "main", "whatsapp", "x");

            assertFalse(p.enabled());
            assertEquals("tools.elevated.enabled", p.failures().get(0).key());
        }

        @Test
        void disabledForAgent_onlyAffectsThatAgent() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "*");
            TestConfigs.agentElevated(cfg, "ops", false, null);

            assertFalse(ElevatedGate.resolve(cfg, "ops", "whatsapp", "x").allowed());
            assertTrue(ElevatedGate.resolve(cfg, "main", "whatsapp", "x").allowed());
            assertFalse(ElevatedGate.isAvailable(cfg, "ops"));
        }

        @Test
        void missingTransport_isRefused() {
            RelayConfig cfg = TestConfigs.globalElevated(new RelayConfig(), "whatsapp", "*");

            assertFalse(ElevatedGate.resolve(cfg, "main", null, "x").allowed());
        }
    }

    @Test
    void unavailableMessage_namesFailingGatesAndFixKeys() {
        String text = ElevatedGate.formatUnavailableMessage(
                List.of(new ElevatedGate.GateFailure("allowFrom", "tools.elevated.allowFrom.whatsapp")));

        assertTrue(text.startsWith("elevated is not available right now (runtime=direct)."));
        assertTrue(text.contains("Failing gates: allowFrom (tools.elevated.allowFrom.whatsapp)"));
        assertTrue(text.contains("- agents.list[].tools.elevated.allowFrom.<transport>"));
    }
}

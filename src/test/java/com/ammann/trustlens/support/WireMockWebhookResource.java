/* (C)2026 */
package com.ammann.trustlens.support;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;
import java.util.Map;

/**
 * Starts a WireMock server standing in for the notification webhook and points
 * {@code trustlens.notification.webhook-url} at it.
 */
public class WireMockWebhookResource implements QuarkusTestResourceLifecycleManager {

    public static final String HOOK_PATH = "/services/T000/B000/hook";

    private static WireMockServer server;

    @Override
    public Map<String, String> start() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        return Map.of(
                "trustlens.notification.webhook-url", server.baseUrl() + HOOK_PATH,
                "trustlens.notification.timeout", "2s");
    }

    @Override
    public void stop() {
        if (server != null) {
            server.stop();
        }
    }

    public static WireMockServer server() {
        return server;
    }
}

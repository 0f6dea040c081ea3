/* (C)2026 */
package com.ammann.trustlens.notification;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * MicroProfile REST client for an incoming webhook. The base URI is the full webhook URL,
 * so the interface declares no path of its own.
 */
@RegisterRestClient(configKey = "notification-webhook")
public interface WebhookClient {

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    Response post(WebhookMessage message);
}

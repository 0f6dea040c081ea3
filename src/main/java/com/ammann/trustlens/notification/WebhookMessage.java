/* (C)2026 */
package com.ammann.trustlens.notification;

/**
 * JSON payload posted to an incoming webhook ({@code {"text": "..."}}).
 *
 * @param text message text
 */
public record WebhookMessage(String text) {}

package com.eventalerts.alerter.domain.notification;

import lombok.Builder;

/**
 * A rendered alert. {@code compactHtml} is the HTML body without the inline logo, for
 * mailboxes that only relay the message on.
 */
@Builder
public record RenderedMessage(String subject, String plainText, String html, String compactHtml) {

    public RenderedMessage compact() {
        return compactHtml == null ? this : new RenderedMessage(subject, plainText, compactHtml, compactHtml);
    }
}

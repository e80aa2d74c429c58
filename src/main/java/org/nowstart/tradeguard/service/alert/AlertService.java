package org.nowstart.tradeguard.service.alert;

import java.util.Map;

/**
 * Outbound operator notification channel. Delivery (chat, webhook, pager) lives behind this seam.
 */
public interface AlertService {

    void notify(String title, String message, Map<String, Object> context);
}

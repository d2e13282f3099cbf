package com.panwatch.notification.sender;

import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.exception.ChannelException;
import com.panwatch.mapper.JsonHelper;
import com.panwatch.notification.ChannelSender;
import com.panwatch.notification.NotificationTemplateEngine;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Base for webhook-style senders: config lookup, JSON POST through the shared RestTemplate,
 * and checking the status code most push services put in a 200 response body.
 */
public abstract class AbstractChannelSender implements ChannelSender {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RestTemplate restTemplate;
    protected final NotificationTemplateEngine templateEngine;

    protected AbstractChannelSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        this.restTemplate = restTemplate;
        this.templateEngine = templateEngine;
    }

    protected String required(NotifyChannel channel, String key) {
        String value = channel.getConfig() == null ? null : channel.getConfig().get(key);
        if (value == null || value.isBlank()) {
            throw new ChannelException(
                    String.format("Channel '%s' (%s) is missing required config '%s'", channel.getName(), type(), key));
        }
        return value.trim();
    }

    protected String optional(NotifyChannel channel, String key, String defaultValue) {
        String value = channel.getConfig() == null ? null : channel.getConfig().get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * POSTs JSON and returns the parsed response body (empty map when there is none).
     * {@code url} must already be encoded; it is sent as is.
     */
    protected Map<String, Object> postJson(String url, Object payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ChannelException(type() + " endpoint is not a valid URL: " + url, e);
        }
        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(uri, new HttpEntity<>(payload, headers), String.class);
            return parseBody(response.getBody());
        } catch (RestClientException e) {
            throw new ChannelException(type() + " request failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> parseBody(String body) {
        if (body == null || !body.stripLeading().startsWith("{")) {
            return Map.of();
        }
        try {
            return JsonHelper.readObjectMap(body);
        } catch (IllegalStateException e) {
            log.debug("Unparseable {} response body: {}", type(), body);
            return Map.of();
        }
    }

    /** Fails unless {@code body[field]} equals {@code expected}; {@code messageField} names the error text. */
    protected void expectField(Map<String, Object> body, String field, Object expected, String messageField) {
        Object actual = body.get(field);
        if (!Objects.equals(String.valueOf(actual), String.valueOf(expected))) {
            throw new ChannelException(String.format(
                    "%s rejected the message: %s=%s, %s", type(), field, actual, body.get(messageField)));
        }
    }

    protected static String hmacSha256Base64(String key, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new ChannelException("HMAC signing failed", e);
        }
    }
}

package com.payment.lifecycle.webhook;

import com.payment.lifecycle.api.AuthenticationFailedException;
import com.payment.lifecycle.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HMAC-SHA256 check of CinetPay notifications. The signed payload is the concatenation of
 * the notification fields in {@link #SIGNED_FIELDS} order, absent fields contributing an
 * empty string; the header carries the lowercase hex digest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    static final List<String> SIGNED_FIELDS = List.of(
            "cpm_site_id", "cpm_trans_id", "cpm_trans_date", "cpm_amount", "cpm_currency",
            "signature", "payment_method", "cel_phone_num", "cpm_phone_prefixe", "cpm_language",
            "cpm_version", "cpm_payment_config", "cpm_page_action", "cpm_custom",
            "cpm_designation", "cpm_error_message");

    private final GatewayProperties properties;

    /**
     * @throws AuthenticationFailedException signature missing, secret not configured, or mismatch
     */
    public void authenticate(Map<String, String> fields, String providedSignature) {
        if (providedSignature == null || providedSignature.isBlank()) {
            throw new AuthenticationFailedException("Missing notification signature");
        }
        String secret = properties.getSecretKey();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured; rejecting every notification");
            throw new AuthenticationFailedException("Webhook secret not configured");
        }
        byte[] expected = sign(fields, secret).getBytes(StandardCharsets.UTF_8);
        byte[] provided = providedSignature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided)) {
            throw new AuthenticationFailedException("Notification signature mismatch");
        }
    }

    public String sign(Map<String, String> fields) {
        return sign(fields, properties.getSecretKey());
    }

    static String canonicalPayload(Map<String, String> fields) {
        StringBuilder payload = new StringBuilder();
        for (String name : SIGNED_FIELDS) {
            String value = fields.get(name);
            payload.append(value != null ? value : "");
        }
        return payload.toString();
    }

    private static String sign(Map<String, String> fields, String secret) {
        try {
            Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = hmac.doFinal(canonicalPayload(fields).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}

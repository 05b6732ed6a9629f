package com.payment.lifecycle.webhook;

import com.payment.lifecycle.api.AuthenticationFailedException;
import com.payment.lifecycle.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureVerifierTest {

    private GatewayProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setSecretKey("test-secret");
        verifier = new WebhookSignatureVerifier(properties);
    }

    @Test
    void canonicalPayloadFollowsFieldOrderAndSkipsUnsignedFields() {
        Map<String, String> fields = new HashMap<>();
        fields.put("cpm_trans_id", "REF-1");
        fields.put("cpm_site_id", "site-1");
        fields.put("cpm_amount", "5000");
        fields.put("unsigned_extra", "ignored");

        assertThat(WebhookSignatureVerifier.canonicalPayload(fields)).isEqualTo("site-1REF-15000");
    }

    @Test
    void validSignatureIsAccepted() {
        Map<String, String> fields = notification();
        String signature = verifier.sign(fields);

        assertThat(signature).hasSize(64).matches("[0-9a-f]+");
        assertThatCode(() -> verifier.authenticate(fields, signature)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.authenticate(fields, signature.toUpperCase())).doesNotThrowAnyException();
    }

    @Test
    void tamperedFieldFailsAuthentication() {
        Map<String, String> fields = notification();
        String signature = verifier.sign(fields);
        fields.put("cpm_amount", "1");

        assertThatThrownBy(() -> verifier.authenticate(fields, signature))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("mismatch");
    }

    @Test
    void missingSignatureFailsAuthentication() {
        assertThatThrownBy(() -> verifier.authenticate(notification(), " "))
                .isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> verifier.authenticate(notification(), null))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void unconfiguredSecretRejectsEverything() {
        String signature = verifier.sign(notification());
        properties.setSecretKey("");

        assertThatThrownBy(() -> verifier.authenticate(notification(), signature))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("not configured");
    }

    static Map<String, String> notification() {
        Map<String, String> fields = new HashMap<>();
        fields.put("cpm_site_id", "site-1");
        fields.put("cpm_trans_id", "CINETPAY_42_7_20260301101530000_AB2C");
        fields.put("cpm_trans_date", "2026-03-01 10:20:00");
        fields.put("cpm_amount", "5000");
        fields.put("cpm_currency", "XAF");
        fields.put("payment_method", "OM");
        fields.put("cel_phone_num", "690000000");
        fields.put("cpm_phone_prefixe", "237");
        return fields;
    }
}

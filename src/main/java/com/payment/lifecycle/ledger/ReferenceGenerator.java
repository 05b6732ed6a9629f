package com.payment.lifecycle.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds external references of the form
 * {@code OPERATOR_payerId_contextId_yyyyMMddHHmmssSSS_XXXX}. The random suffix keeps
 * two requests from the same payer in the same millisecond apart.
 */
@Component
@RequiredArgsConstructor
public class ReferenceGenerator {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);
    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int SUFFIX_LENGTH = 4;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public String generate(String operatorTag, Long payerId, Long contextId) {
        StringBuilder sb = new StringBuilder(64)
                .append(operatorTag.toUpperCase(Locale.ROOT))
                .append('_').append(payerId)
                .append('_').append(contextId)
                .append('_').append(TIMESTAMP.format(clock.instant()))
                .append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}

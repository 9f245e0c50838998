package com.github.dimitryivaniuta.gateway.smartpay.psp;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA512 signatures as used by the PSP: fields joined by a comma, keyed with the Base64-decoded
 * signing key, rendered as lowercase hex.
 */
@Component
public class HmacSignatureService implements SignatureService {

    private static final String ALGORITHM = "HmacSHA512";

    @Override
    public String sign(List<String> fields, String signingKey) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new IllegalArgumentException("signing key is required");
        }
        String data = fields.stream()
                .map(f -> Objects.toString(f, ""))
                .collect(Collectors.joining(","));
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(Base64.getDecoder().decode(signingKey), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute " + ALGORITHM + " signature", e);
        }
    }

    @Override
    public void verify(Signable payload, String signingKey) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new InvalidSignatureException("No signing key configured");
        }
        String received = payload.signature();
        if (received == null || received.isBlank()) {
            throw new InvalidSignatureException("Signature missing");
        }
        String expected = sign(payload.signatureFields(), signingKey);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                received.getBytes(StandardCharsets.US_ASCII)
        );
        if (!matches) {
            throw new InvalidSignatureException("Signature mismatch");
        }
    }
}

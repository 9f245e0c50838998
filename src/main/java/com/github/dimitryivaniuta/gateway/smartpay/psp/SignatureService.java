package com.github.dimitryivaniuta.gateway.smartpay.psp;

import java.util.List;

/**
 * Signs and verifies PSP payloads.
 */
public interface SignatureService {

    /**
     * Computes the signature over the given fields.
     *
     * @param fields     ordered field values
     * @param signingKey Base64-encoded signing key
     * @return lowercase hex signature
     */
    String sign(List<String> fields, String signingKey);

    /**
     * Verifies a signed payload.
     *
     * @param payload    payload to check
     * @param signingKey Base64-encoded signing key; blank means nothing can be verified
     * @throws InvalidSignatureException when the signature is missing or does not match
     */
    void verify(Signable payload, String signingKey);
}

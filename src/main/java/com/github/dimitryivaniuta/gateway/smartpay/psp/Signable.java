package com.github.dimitryivaniuta.gateway.smartpay.psp;

import java.util.List;

/**
 * PSP payload that carries a signature over an ordered list of its own fields.
 */
public interface Signable {

    /**
     * Fields covered by the signature, in signing order.
     *
     * @return field values; {@code null} values are signed as empty strings
     */
    List<String> signatureFields();

    /**
     * Signature received with the payload.
     *
     * @return lowercase hex signature, may be {@code null}
     */
    String signature();
}

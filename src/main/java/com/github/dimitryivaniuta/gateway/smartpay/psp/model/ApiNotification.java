package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.github.dimitryivaniuta.gateway.smartpay.psp.Signable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Webhook envelope sent by the PSP when order results are waiting.
 *
 * @param authentication token used to fetch the results
 * @param expiry         token expiry
 * @param eventName      event to fetch results for
 * @param poiId          point of interaction id
 * @param signature      signature over the other fields
 */
public record ApiNotification(
        String authentication,
        String expiry,
        String eventName,
        Integer poiId,
        String signature
) implements Signable {

    @Override
    public List<String> signatureFields() {
        return Arrays.asList(authentication, expiry, eventName, Objects.toString(poiId, null));
    }
}

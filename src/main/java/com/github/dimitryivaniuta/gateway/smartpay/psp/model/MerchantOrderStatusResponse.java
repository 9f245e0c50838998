package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.github.dimitryivaniuta.gateway.smartpay.psp.Signable;
import java.util.ArrayList;
import java.util.List;

/**
 * One batch of order results fetched after a notification.
 *
 * @param moreOrderResultsAvailable whether another fetch returns more results
 * @param orderResults              results in this batch
 * @param signature                 signature over the flag and every result
 */
public record MerchantOrderStatusResponse(
        boolean moreOrderResultsAvailable,
        List<MerchantOrderResult> orderResults,
        String signature
) implements Signable {

    public MerchantOrderStatusResponse {
        orderResults = orderResults == null ? List.of() : List.copyOf(orderResults);
    }

    @Override
    public List<String> signatureFields() {
        List<String> fields = new ArrayList<>();
        fields.add(String.valueOf(moreOrderResultsAvailable));
        for (MerchantOrderResult result : orderResults) {
            fields.addAll(result.signatureFields());
        }
        return fields;
    }
}

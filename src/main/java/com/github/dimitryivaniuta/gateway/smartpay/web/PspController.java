package com.github.dimitryivaniuta.gateway.smartpay.web;

import com.github.dimitryivaniuta.gateway.smartpay.service.CheckoutService;
import com.github.dimitryivaniuta.gateway.smartpay.service.NotificationPoller;
import com.github.dimitryivaniuta.gateway.smartpay.service.PaymentReturnService;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.DetailItem;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.PaymentRequestResult;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.StatusUpdateResult;
import com.github.dimitryivaniuta.gateway.smartpay.web.dto.BasketDto;
import com.github.dimitryivaniuta.gateway.smartpay.web.dto.CheckoutRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storefront and PSP endpoints of one PSP account.
 */
@RestController
@RequestMapping("/api/psp/{providerId}")
public class PspController {

    private static final Logger log = LoggerFactory.getLogger(PspController.class);

    private final CheckoutService checkoutService;
    private final PaymentReturnService returnService;
    private final NotificationPoller notificationPoller;
    private final CurrentRequestParameters requestParameters;

    public PspController(
            CheckoutService checkoutService,
            PaymentReturnService returnService,
            NotificationPoller notificationPoller,
            CurrentRequestParameters requestParameters
    ) {
        this.checkoutService = checkoutService;
        this.returnService = returnService;
        this.notificationPoller = notificationPoller;
        this.requestParameters = requestParameters;
    }

    /**
     * Announces the order at the PSP.
     *
     * @param providerId PSP account
     * @param request    checkout request
     * @return redirect instruction for the storefront
     */
    @PostMapping(value = "/checkout", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public PaymentRequestResult checkout(@PathVariable Long providerId, @Valid @RequestBody CheckoutRequest request) {
        List<ShoppingBasket> baskets = request.baskets().stream().map(BasketDto::toBasket).toList();
        return checkoutService.handlePaymentRequest(
                providerId,
                baskets,
                new DetailItem(request.customer()),
                request.paymentMethod(),
                request.invoiceNumber()
        );
    }

    /**
     * Browser return from the PSP ({@code order_id}, {@code status}, {@code signature}).
     *
     * @param providerId PSP account
     * @return 302 to the success, pending or fail URL
     */
    @GetMapping("/return")
    public ResponseEntity<Void> returnFromPsp(@PathVariable Long providerId) {
        String target = returnService.redirectUrlOnReturn(providerId, requestParameters.returnParameters());
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(target)).build();
    }

    /**
     * Relayed status update.
     *
     * @param providerId PSP account
     * @return status update result
     */
    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatusUpdateResult statusUpdate(@PathVariable Long providerId) {
        return returnService.processStatusUpdate(providerId, requestParameters.returnParameters());
    }

    /**
     * PSP webhook. Always 200 so the PSP does not retry and trigger duplicate relays.
     *
     * @param providerId PSP account
     * @param body       notification JSON
     * @return empty 200
     */
    @PostMapping("/notifications")
    public ResponseEntity<Void> notification(@PathVariable Long providerId, @RequestBody(required = false) String body) {
        try {
            notificationPoller.handleNotification(providerId, body);
        } catch (RuntimeException e) {
            log.error("Notification processing failed. provider={}", providerId, e);
        }
        return ResponseEntity.ok().build();
    }
}

package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;
import com.github.dimitryivaniuta.gateway.smartpay.psp.HmacSignatureService;
import com.github.dimitryivaniuta.gateway.smartpay.psp.PspApiException;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SmartPayGateway;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.ApiNotification;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResult;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderStatusResponse;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.Money;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.PollSummary;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.RelayCall;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class NotificationPollerTest {

    private final HmacSignatureService signatures = new HmacSignatureService();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private SmartPayGateway gateway;
    private RelayDispatcher relay;
    private PaymentStatusLogger statusLogger;
    private AppProperties props;
    private NotificationPoller poller;

    @BeforeEach
    void setUp() {
        ProviderSettingsResolver resolver = Mockito.mock(ProviderSettingsResolver.class);
        Mockito.when(resolver.resolve(TestSettings.PROVIDER_ID)).thenReturn(TestSettings.settings());

        gateway = Mockito.mock(SmartPayGateway.class);
        statusLogger = Mockito.mock(PaymentStatusLogger.class);
        relay = Mockito.mock(RelayDispatcher.class);
        Mockito.when(relay.newBatch()).thenAnswer(inv -> new RelayBatch(relay, Runnable::run, Duration.ofSeconds(5)));
        Mockito.when(relay.prepare(Mockito.anyString(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString()))
                .thenAnswer(inv -> new RelayCall(inv.getArgument(1), inv.getArgument(2), URI.create(TestSettings.WEBHOOK_URL)));

        props = new AppProperties();
        props.getRelay().setAwaitTimeout(Duration.ofSeconds(5));

        poller = new NotificationPoller(resolver, gateway, signatures, relay, statusLogger, objectMapper, props);
    }

    @Test
    void fetchesUntilNoMoreResultsAreAvailable() throws Exception {
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.eq(GatewayEnvironment.SANDBOX)))
                .thenReturn(
                        batch(true, result("INV-1", "COMPLETED")),
                        batch(true, result("INV-2", "CANCELLED")),
                        batch(false, result("INV-3", "EXPIRED")));

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Mockito.verify(gateway, Mockito.times(3)).retrieveAnnouncement(Mockito.any(), Mockito.any());
        Assertions.assertEquals(3, summary.batchesFetched());
        Assertions.assertEquals(3, summary.relayCalls());
        Assertions.assertEquals(3, summary.relay().relayed());
        Assertions.assertFalse(summary.isAborted());
    }

    @Test
    void relaysTerminalResultsAndOnlyLogsInProgress() throws Exception {
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.any()))
                .thenReturn(batch(false, result("INV-1", "IN_PROGRESS"), result("INV-2", "COMPLETED")));

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Assertions.assertEquals(1, summary.inProgress());
        Assertions.assertEquals(1, summary.relayCalls());
        Mockito.verify(statusLogger).log("Smart Pay", "INV-1", OrderStatus.IN_PROGRESS, StatusSource.NOTIFICATION);
        Mockito.verify(relay).prepare(TestSettings.WEBHOOK_URL, "INV-2", "COMPLETED", TestSettings.SIGNING_KEY);
        Mockito.verify(relay, Mockito.never())
                .prepare(Mockito.anyString(), Mockito.eq("INV-1"), Mockito.anyString(), Mockito.anyString());
        Mockito.verify(relay).send(Mockito.argThat(call -> call.orderId().equals("INV-2")));
    }

    @Test
    void invalidNotificationSignatureHasNoSideEffects() throws Exception {
        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(false));

        Assertions.assertEquals(NotificationPoller.INVALID_NOTIFICATION_SIGNATURE, summary.abortReason());
        Mockito.verifyNoInteractions(gateway, statusLogger);
        Mockito.verify(relay, Mockito.never()).newBatch();
    }

    @Test
    void undecodableNotificationIsIgnored() {
        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, "not json");

        Assertions.assertEquals(NotificationPoller.UNDECODABLE, summary.abortReason());
        Mockito.verifyNoInteractions(gateway);
    }

    @Test
    void invalidBatchSignatureStopsTheLoop() throws Exception {
        MerchantOrderStatusResponse forged = new MerchantOrderStatusResponse(
                true, List.of(result("INV-9", "COMPLETED")), "deadbeef");
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.any()))
                .thenReturn(batch(true, result("INV-1", "COMPLETED")), forged);

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Assertions.assertEquals(NotificationPoller.INVALID_BATCH_SIGNATURE, summary.abortReason());
        Assertions.assertEquals(2, summary.batchesFetched());
        Assertions.assertEquals(1, summary.relayCalls());
        Mockito.verify(relay, Mockito.never())
                .prepare(Mockito.anyString(), Mockito.eq("INV-9"), Mockito.anyString(), Mockito.anyString());
    }

    @Test
    void maxBatchesBoundsAMisbehavingContinuationFlag() throws Exception {
        props.getNotification().setMaxBatches(4);
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.any()))
                .thenReturn(batch(true, result("INV-1", "IN_PROGRESS")));

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Mockito.verify(gateway, Mockito.times(4)).retrieveAnnouncement(Mockito.any(), Mockito.any());
        Assertions.assertEquals(NotificationPoller.MAX_BATCHES_REACHED, summary.abortReason());
    }

    @Test
    void fetchFailureStopsWithoutThrowing() throws Exception {
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.any()))
                .thenThrow(new PspApiException(500, "boom"));

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Assertions.assertEquals(NotificationPoller.FETCH_FAILED, summary.abortReason());
        Assertions.assertEquals(0, summary.batchesFetched());
    }

    @Test
    void relayFailuresAreCountedNotThrown() throws Exception {
        Mockito.doThrow(new IllegalStateException("store down")).when(relay).send(Mockito.any());
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(), Mockito.any()))
                .thenReturn(batch(false, result("INV-1", "COMPLETED"), result("INV-2", "EXPIRED")));

        PollSummary summary = poller.handleNotification(TestSettings.PROVIDER_ID, notificationJson(true));

        Assertions.assertEquals(2, summary.relay().failed());
        Assertions.assertEquals(0, summary.relay().relayed());
        Mockito.verify(relay, Mockito.times(2)).onFailed(Mockito.any(), Mockito.any());
    }

    private String notificationJson(boolean validSignature) throws Exception {
        ApiNotification unsigned = new ApiNotification(
                "notify-token", "2030-01-01T10:00:00.000+01:00", "merchant.order.status.changed", 1000, null);
        String signature = validSignature
                ? signatures.sign(unsigned.signatureFields(), TestSettings.SIGNING_KEY)
                : "0000";
        return objectMapper.writeValueAsString(new ApiNotification(
                unsigned.authentication(), unsigned.expiry(), unsigned.eventName(), unsigned.poiId(), signature));
    }

    private MerchantOrderStatusResponse batch(boolean more, MerchantOrderResult... results) {
        MerchantOrderStatusResponse unsigned = new MerchantOrderStatusResponse(more, List.of(results), null);
        String signature = signatures.sign(unsigned.signatureFields(), TestSettings.SIGNING_KEY);
        return new MerchantOrderStatusResponse(more, List.of(results), signature);
    }

    private static MerchantOrderResult result(String orderId, String status) {
        return new MerchantOrderResult(orderId, "psp-" + orderId, 1000, status, "2030-01-01T10:00:00.000+01:00",
                null, new Money(Money.EUR, 2500), new Money(Money.EUR, 2500));
    }
}

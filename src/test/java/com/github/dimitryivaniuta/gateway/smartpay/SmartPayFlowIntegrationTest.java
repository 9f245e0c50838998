package com.github.dimitryivaniuta.gateway.smartpay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.OutboxStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentServiceProvider;
import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentStatusLogEntry;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SignatureService;
import com.github.dimitryivaniuta.gateway.smartpay.psp.SmartPayGateway;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.AccessToken;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.ApiNotification;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrder;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResponse;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderResult;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrderStatusResponse;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.Money;
import com.github.dimitryivaniuta.gateway.smartpay.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.smartpay.repo.PaymentServiceProviderRepository;
import com.github.dimitryivaniuta.gateway.smartpay.repo.PaymentStatusLogRepository;
import com.github.dimitryivaniuta.gateway.smartpay.service.OutboxDispatcher;
import com.github.dimitryivaniuta.gateway.smartpay.service.ProviderSecretStore;
import com.github.dimitryivaniuta.gateway.smartpay.service.ProviderSettingsResolver;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.client.RestClient;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Checkout, browser return and notification relay against a real Postgres (Testcontainers), with the PSP
 * and Kafka mocked. The relay calls this application's own status endpoint.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SmartPayFlowIntegrationTest {

    private static final long PROVIDER_ID = 1L;
    private static final String SIGNING_KEY = "c21hcnRwYXktdGVzdC1zaWduaW5nLWtleS0zMmJ5dGU=";
    private static final Duration ASYNC_TIMEOUT = Duration.ofSeconds(10);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("smartpay")
            .withUsername("smartpay")
            .withPassword("smartpay");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);

        r.add("spring.cache.type", () -> "none");
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("spring.kafka.admin.auto-create", () -> "false");
        r.add("app.outbox.publish-interval-ms", () -> "9999999");
        r.add("app.environment", () -> "DEVELOPMENT");
        r.add("app.secrets.encryption-key", () -> "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=");
    }

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    SignatureService signatureService;

    @Autowired
    PaymentServiceProviderRepository providerRepository;

    @Autowired
    ProviderSecretStore secretStore;

    @Autowired
    PaymentStatusLogRepository statusLogRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @MockBean
    SmartPayGateway gateway;

    @BeforeEach
    void seedProvider() {
        PaymentServiceProvider provider = PaymentServiceProvider.of(
                PROVIDER_ID, "Smart Pay", "https://shop.example/success", "https://shop.example/fail");
        provider.setPendingUrl("https://shop.example/pending");
        provider.setWebhookUrl("http://localhost:" + port + "/api/psp/" + PROVIDER_ID + "/status");
        providerRepository.save(provider);

        secretStore.store(PROVIDER_ID, ProviderSettingsResolver.REFRESH_TOKEN_TEST, "refresh-token");
        secretStore.store(PROVIDER_ID, ProviderSettingsResolver.SIGNING_KEY_TEST, SIGNING_KEY);
    }

    @Test
    void checkoutAnnouncesOrderAtThePsp() {
        Mockito.when(gateway.refreshAccessToken("refresh-token", GatewayEnvironment.SANDBOX))
                .thenReturn(new AccessToken("access-token", "2030-01-01T00:00:00.000+01:00", 28_800_000L));
        Mockito.when(gateway.announce(Mockito.any(MerchantOrder.class), Mockito.eq("access-token"), Mockito.eq(GatewayEnvironment.SANDBOX)))
                .thenReturn(new MerchantOrderResponse("https://psp.example/pay/abc", "psp-1"));

        Map<String, Object> body = Map.of(
                "invoiceNumber", "INV-CHECKOUT",
                "paymentMethod", "ideal",
                "customer", Map.of("firstname", "Jan", "lastname", "Jansen", "street", "Dorpsstraat",
                        "housenumber", "1", "zipcode", "1234 AB", "city", "Utrecht", "country", "NL"),
                "baskets", List.of(Map.of(
                        "details", Map.of(),
                        "lines", List.of(Map.of("title", "Socks", "quantity", "2", "price", "12.50")))));

        ResponseEntity<Map> response = rest.postForEntity(url("/checkout"), json(body), Map.class);

        Assertions.assertEquals(HttpStatus.OK, response.getStatusCode());
        Assertions.assertEquals(Boolean.TRUE, response.getBody().get("successful"));
        Assertions.assertEquals("https://psp.example/pay/abc", response.getBody().get("actionData"));

        ArgumentCaptor<MerchantOrder> order = ArgumentCaptor.forClass(MerchantOrder.class);
        Mockito.verify(gateway).announce(order.capture(), Mockito.eq("access-token"), Mockito.eq(GatewayEnvironment.SANDBOX));
        Assertions.assertEquals("INV-CHECKOUT", order.getValue().merchantOrderId());
        Assertions.assertEquals(new Money(Money.EUR, 2500), order.getValue().amount());
    }

    @Test
    void verifiedReturnRedirectsAndIsLogged() {
        String signature = signatureService.sign(List.of("INV-RETURN", "COMPLETED"), SIGNING_KEY);

        ResponseEntity<Void> response = browserReturn("order_id=INV-RETURN&status=COMPLETED&signature=" + signature);

        Assertions.assertEquals(HttpStatus.FOUND, response.getStatusCode());
        Assertions.assertEquals("https://shop.example/success", response.getHeaders().getLocation().toString());

        Awaitility.await().atMost(ASYNC_TIMEOUT).untilAsserted(() -> {
            List<PaymentStatusLogEntry> entries = statusLogRepository.findByOrderIdOrderByCreatedAtAsc("INV-RETURN");
            Assertions.assertEquals(1, entries.size());
            Assertions.assertEquals(OrderStatus.COMPLETED, entries.get(0).getStatus());
            Assertions.assertEquals(StatusSource.RETURN, entries.get(0).getSource());
        });
    }

    @Test
    void tamperedReturnGoesToFailUrl() {
        ResponseEntity<Void> response = browserReturn("order_id=INV-TAMPERED&status=COMPLETED&signature=deadbeef");

        Assertions.assertEquals(HttpStatus.FOUND, response.getStatusCode());
        Assertions.assertEquals("https://shop.example/fail", response.getHeaders().getLocation().toString());
    }

    @Test
    void notificationRelaysTerminalStatusesToTheStatusEndpoint() {
        MerchantOrderResult completed = result("INV-NOTIFY-1", "COMPLETED");
        MerchantOrderResult open = result("INV-NOTIFY-2", "IN_PROGRESS");
        MerchantOrderStatusResponse unsigned = new MerchantOrderStatusResponse(false, List.of(completed, open), null);
        MerchantOrderStatusResponse batch = new MerchantOrderStatusResponse(false, List.of(completed, open),
                signatureService.sign(unsigned.signatureFields(), SIGNING_KEY));
        Mockito.when(gateway.retrieveAnnouncement(Mockito.any(ApiNotification.class), Mockito.eq(GatewayEnvironment.SANDBOX)))
                .thenReturn(batch);

        ApiNotification notification = new ApiNotification("notify-token", "2030-01-01T00:00:00.000+01:00",
                "merchant.order.status.changed", 1000, null);
        ApiNotification signed = new ApiNotification(notification.authentication(), notification.expiry(),
                notification.eventName(), notification.poiId(),
                signatureService.sign(notification.signatureFields(), SIGNING_KEY));

        ResponseEntity<Void> response = rest.postForEntity(url("/notifications"), json(signed), Void.class);

        Assertions.assertEquals(HttpStatus.OK, response.getStatusCode());
        Awaitility.await().atMost(ASYNC_TIMEOUT).untilAsserted(() -> {
            List<PaymentStatusLogEntry> relayed = statusLogRepository.findByOrderIdOrderByCreatedAtAsc("INV-NOTIFY-1");
            Assertions.assertEquals(1, relayed.size());
            Assertions.assertEquals(StatusSource.STATUS_UPDATE, relayed.get(0).getSource());

            List<PaymentStatusLogEntry> pending = statusLogRepository.findByOrderIdOrderByCreatedAtAsc("INV-NOTIFY-2");
            Assertions.assertEquals(1, pending.size());
            Assertions.assertEquals(OrderStatus.IN_PROGRESS, pending.get(0).getStatus());
            Assertions.assertEquals(StatusSource.NOTIFICATION, pending.get(0).getSource());
        });
    }

    @Test
    void forgedNotificationIsAcknowledgedButIgnored() {
        ApiNotification forged = new ApiNotification("notify-token", "2030-01-01T00:00:00.000+01:00",
                "merchant.order.status.changed", 1000, "deadbeef");

        ResponseEntity<Void> response = rest.postForEntity(url("/notifications"), json(forged), Void.class);

        Assertions.assertEquals(HttpStatus.OK, response.getStatusCode());
        Mockito.verify(gateway, Mockito.never()).retrieveAnnouncement(Mockito.any(), Mockito.any());
    }

    @Test
    void unknownProviderIsNotFound() {
        ResponseEntity<Map> response = rest.getForEntity(
                "http://localhost:" + port + "/api/psp/999/status?order_id=X", Map.class);

        Assertions.assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        Assertions.assertEquals("PROVIDER_NOT_FOUND", response.getBody().get("code"));
    }

    @Test
    void statusEventsArePublishedFromTheOutbox(@Autowired OutboxDispatcher dispatcher) {
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        String signature = signatureService.sign(List.of("INV-OUTBOX", "EXPIRED"), SIGNING_KEY);
        rest.getForEntity(url("/status?order_id=INV-OUTBOX&status=EXPIRED&signature=" + signature), Map.class);
        Awaitility.await().atMost(ASYNC_TIMEOUT).until(
                () -> !statusLogRepository.findByOrderIdOrderByCreatedAtAsc("INV-OUTBOX").isEmpty());

        dispatcher.publishBatch();

        Mockito.verify(kafkaTemplate, Mockito.atLeastOnce())
                .send(Mockito.eq("psp-status-events"), Mockito.eq("INV-OUTBOX"), Mockito.contains("\"EXPIRED\""));
        Assertions.assertEquals(0, outboxEventRepository.countByStatus(OutboxStatus.NEW));
    }

    @Test
    void inProgressReturnGoesToPendingUrl() {
        String signature = signatureService.sign(List.of("INV-PENDING", "IN_PROGRESS"), SIGNING_KEY);

        ResponseEntity<Void> response = browserReturn("order_id=INV-PENDING&status=IN_PROGRESS&signature=" + signature);

        Assertions.assertEquals("https://shop.example/pending", response.getHeaders().getLocation().toString());
    }

    /**
     * The JDK client does not follow redirects, so the 302 itself is observed.
     */
    private ResponseEntity<Void> browserReturn(String query) {
        return RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(HttpClient.newHttpClient()))
                .build()
                .get()
                .uri(url("/return?" + query))
                .retrieve()
                .toBodilessEntity();
    }

    private String url(String path) {
        return "http://localhost:" + port + "/api/psp/" + PROVIDER_ID + path;
    }

    private HttpEntity<String> json(Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            return new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static MerchantOrderResult result(String orderId, String status) {
        return new MerchantOrderResult(orderId, "psp-" + orderId, 1000, status, "2030-01-01T00:00:00.000+01:00",
                null, new Money(Money.EUR, 2500), new Money(Money.EUR, 2500));
    }
}

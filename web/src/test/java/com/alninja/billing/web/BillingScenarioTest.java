package com.alninja.billing.web;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.core.DocumentPaths;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.api.DocumentStoreException;
import com.alninja.billing.docstore.api.VersionedDocument;
import com.alninja.billing.docstore.core.InMemoryDocumentStore;
import com.alninja.billing.docstore.core.OptimisticDocumentUpdater;
import com.alninja.billing.lifecycle.LifeCycleRegistry;
import com.alninja.billing.lifecycle.SimpleLifeCycleRegistry;
import com.alninja.billing.pipeline.BillingEndpoint;
import com.alninja.billing.pipeline.BillingRequest;
import com.alninja.billing.pipeline.Capability;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import javax.annotation.Nullable;
import javax.ws.rs.client.Client;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

/**
 * End-to-end billing behavior of endpoints wired through {@link BillingWebModule} over an in-memory document store.
 */
public class BillingScenarioTest {
    /** 2026-01-01T00:00:00Z */
    private static final long START = 1_767_225_600_000L;
    private static final long DAY = TimeUnit.DAYS.toMillis(1);
    private static final BillingEndpoint AUTHORIZE = BillingEndpoint.withSecurity("authorizeApp");
    private static final BillingEndpoint GET_NEXT = BillingEndpoint.withSecurity("getNext").and(Capability.USAGE_LOGGING);
    private static final EndpointHandler HANDLER = request -> JsonHelper.newObject().put("id", 50000);

    private long _now = START;
    private FlakyDocumentStore _store;
    private SimpleLifeCycleRegistry _lifeCycle;
    private BillingRequestHandler _handler;
    private BillingConfiguration _configuration;
    private Injector _injector;

    @BeforeMethod
    public void setUp() {
        _store = new FlakyDocumentStore();
        _lifeCycle = new SimpleLifeCycleRegistry();
        _configuration = new BillingConfiguration();

        Clock clock = mock(Clock.class);
        when(clock.millis()).thenAnswer(new Answer<Long>() {
            @Override
            public Long answer(InvocationOnMock invocation) throws Throwable {
                return _now;
            }
        });

        _injector = Guice.createInjector(new AbstractModule() {
            @Override
            protected void configure() {
                binder().requireExplicitBindings();

                bind(BillingConfiguration.class).toInstance(_configuration);
                bind(DocumentStore.class).toInstance(_store);
                bind(LifeCycleRegistry.class).toInstance(_lifeCycle);
                bind(Clock.class).toInstance(clock);
                bind(Client.class).toInstance(mock(Client.class));
                bind(MetricRegistry.class).asEagerSingleton();

                install(new BillingWebModule());
            }
        });
        _handler = _injector.getInstance(BillingRequestHandler.class);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        _lifeCycle.stop();
    }

    // Scenario A
    @Test
    public void testUnownedAppClaimedByOrganizationUser() throws Exception {
        put(DocumentPaths.APPS, "[{\"id\":\"app1\",\"name\":\"Sales\",\"publisher\":\"Acme\",\"freeUntil\":" + (START + 10 * DAY) + "}]");
        put(DocumentPaths.ORGANIZATIONS, "[{\"id\":\"org1\",\"publishers\":[\"Acme\"],\"users\":[\"dev@acme.com\"]}]");

        BillingInvocation first = call(AUTHORIZE, headers("app1", "Acme", "dev@acme.com"));
        first.getWritebacks().get(10, TimeUnit.SECONDS);

        assertEquals(first.getResponse().getStatus(), 200);
        JsonNode app = read(DocumentPaths.APPS).get(0);
        assertEquals(app.get("ownerType").asText(), "organization");
        assertEquals(app.get("ownerId").asText(), "org1");
        assertEquals(app.get("name").asText(), "Sales");

        _now += 30 * DAY;
        BillingInvocation second = call(AUTHORIZE, headers("app1", "Acme", "dev@acme.com"));

        assertEquals(second.getResponse().getStatus(), 200);
        assertFalse(body(second).has("warning"));
        assertNull(second.getResponse().getHeaderString(BillingRequest.CLAIM_ISSUE_HEADER));
    }

    // Scenario B
    @Test
    public void testUnlimitedPlanBypassesUserChecks() throws Exception {
        put(DocumentPaths.APPS, "[{\"id\":\"app1\",\"publisher\":\"Acme\",\"ownerType\":\"organization\",\"ownerId\":\"org1\"}]");
        put(DocumentPaths.ORGANIZATIONS, "[{\"id\":\"org1\",\"plan\":\"unlimited\"}]");

        BillingInvocation invocation = call(AUTHORIZE, headers("app1", "Acme", "stranger@example.com"));
        invocation.getWritebacks().get(10, TimeUnit.SECONDS);

        assertEquals(invocation.getResponse().getStatus(), 200);
        assertFalse(body(invocation).has("warning"));
        JsonNode organization = read(DocumentPaths.ORGANIZATIONS).get(0);
        assertFalse(organization.has("users"));
        assertFalse(organization.has("deniedUsers"));
        assertNull(_store.get(DocumentPaths.unknownUserLog("org1")));
    }

    // Scenario C
    @Test
    public void testUnknownDomainDeniedAndRecordedOnce() throws Exception {
        put(DocumentPaths.APPS, "[{\"id\":\"app1\",\"publisher\":\"Acme\",\"ownerType\":\"organization\",\"ownerId\":\"org1\"}]");
        put(DocumentPaths.ORGANIZATIONS, "[{\"id\":\"org1\",\"domains\":[\"acme.com\"],\"denyUnknownDomains\":true}]");

        for (int i = 0; i < 3; i++) {
            BillingInvocation invocation = call(AUTHORIZE, headers("app1", "Acme", "stranger@example.com"));
            invocation.getWritebacks().get(10, TimeUnit.SECONDS);

            Response response = invocation.getResponse();
            assertEquals(response.getStatus(), 403);
            assertEquals(JsonHelper.asJson(response.getEntity()),
                    "{\"error\":{\"code\":\"USER_NOT_AUTHORIZED\",\"gitEmail\":\"stranger@example.com\"}}");
        }

        JsonNode denied = read(DocumentPaths.ORGANIZATIONS).get(0).get("deniedUsers");
        assertEquals(denied.size(), 1);
        assertEquals(denied.get(0).asText(), "stranger@example.com");
    }

    // Scenario D
    @Test
    public void testAmbiguousClaimLeavesAppUnowned() throws Exception {
        put(DocumentPaths.APPS, "[{\"id\":\"app1\",\"publisher\":\"Acme\",\"freeUntil\":" + (START + 10 * DAY) + "}]");
        put(DocumentPaths.ORGANIZATIONS, "[" +
                "{\"id\":\"org1\",\"publishers\":[\"Acme\"],\"domains\":[\"acme.com\"]}," +
                "{\"id\":\"org2\",\"publishers\":[\"acme\"],\"domains\":[\"ACME.com\"]}]");

        BillingInvocation invocation = call(AUTHORIZE, headers("app1", "Acme", "dev@acme.com"));
        invocation.getWritebacks().get(10, TimeUnit.SECONDS);

        Response response = invocation.getResponse();
        assertEquals(response.getStatus(), 200);
        assertEquals(response.getHeaderString(BillingRequest.CLAIM_ISSUE_HEADER), "true");
        JsonNode warning = body(invocation).get("warning");
        assertEquals(warning.get("code").asText(), "APP_GRACE_PERIOD");
        assertEquals(warning.get("timeRemaining").asLong(), 10 * DAY);
        assertFalse(read(DocumentPaths.APPS).get(0).has("ownerId"));
    }

    // Scenario E
    @Test
    public void testStorageFailureFailsOpen() throws Exception {
        put(DocumentPaths.ORGANIZATIONS, "[]");
        _store.fail(DocumentPaths.APPS);

        BillingInvocation invocation = call(AUTHORIZE, headers("app1", "Acme", "dev@acme.com"));
        invocation.getWritebacks().get(10, TimeUnit.SECONDS);

        assertEquals(invocation.getResponse().getStatus(), 200);
        assertEquals(body(invocation), JsonHelper.newObject().put("id", 50000));
        JsonNode faults = read(DocumentPaths.UNHANDLED_ERRORS);
        assertEquals(faults.size(), 1);
        assertEquals(faults.get(0).get("timestamp").asLong(), START);
        assertTrue(faults.get(0).get("message").asText().contains(DocumentPaths.APPS));
    }

    @Test
    public void testNewAppRegisteredOnFirstUse() throws Exception {
        String appId = "0F8FAD5B-D9CB-469F-A165-70867728950E";

        BillingInvocation invocation = call(AUTHORIZE, headers(appId, "Acme", "dev@acme.com"));
        invocation.getWritebacks().get(10, TimeUnit.SECONDS);

        assertEquals(body(invocation).get("warning").get("timeRemaining").asLong(), 15 * DAY);
        JsonNode app = read(DocumentPaths.APPS).get(0);
        assertEquals(app.get("id").asText(), appId.toLowerCase());
        assertEquals(app.get("freeUntil").asLong(), START + 15 * DAY);

        _now += 15 * DAY;
        Response expired = call(AUTHORIZE, headers(appId, "Acme", "dev@acme.com")).getResponse();
        assertEquals(expired.getStatus(), 403);
        assertEquals(JsonHelper.asJson(expired.getEntity()), "{\"error\":{\"code\":\"GRACE_EXPIRED\"}}");
    }

    @Test
    public void testUsageLogged() throws Exception {
        put(DocumentPaths.APPS, "[{\"id\":\"app1\",\"publisher\":\"Acme\",\"ownerType\":\"organization\",\"ownerId\":\"org1\"}]");
        put(DocumentPaths.ORGANIZATIONS, "[{\"id\":\"org1\",\"users\":[\"dev@acme.com\"]}]");

        call(GET_NEXT, headers("app1", "Acme", "dev@acme.com")).getWritebacks().get(10, TimeUnit.SECONDS);

        JsonNode features = read(DocumentPaths.featureLog("org1"));
        assertEquals(features.size(), 1);
        assertEquals(features.get(0).get("feature").asText(), "getNext");
        assertEquals(read(DocumentPaths.ORGANIZATIONS).get(0).get("userFirstSeenTimestamp").get("dev@acme.com").asLong(), START);
    }

    @Test
    public void testOutdatedClientRejectedBeforeStorageAccess() throws Exception {
        _store.fail(DocumentPaths.APPS);
        Map<String, String> headers = headers("app1", "Acme", "dev@acme.com");
        headers.put("Ninja-Version", "3.0.5");

        BillingInvocation invocation = call(AUTHORIZE, headers);
        invocation.getWritebacks().get(10, TimeUnit.SECONDS);

        assertEquals(invocation.getResponse().getStatus(), 426);
        assertNull(_store.get(DocumentPaths.UNHANDLED_ERRORS));
    }

    @Test
    public void testAppIdRequiredForSecuredEndpoint() {
        Map<String, String> headers = headers("app1", "Acme", "dev@acme.com");
        headers.remove("Ninja-App-Id");

        assertEquals(call(AUTHORIZE, headers).getResponse().getStatus(), 400);
    }

    @Test
    public void testHandlerFailureIsServerError() throws Exception {
        BillingInvocation invocation = _handler.handle(httpHeaders(headers("app1", "Acme", "dev@acme.com")), AUTHORIZE,
                request -> {
                    throw new IllegalStateException("boom");
                });

        assertEquals(invocation.getResponse().getStatus(), 500);
        assertEquals(invocation.getResponse().getEntity(), "boom");
    }

    private BillingInvocation call(BillingEndpoint endpoint, Map<String, String> headers) {
        return _handler.handle(httpHeaders(headers), endpoint, HANDLER);
    }

    private static Map<String, String> headers(String appId, String publisher, String email) {
        Map<String, String> headers = Maps.newHashMap();
        headers.put("Ninja-App-Id", appId);
        headers.put("Ninja-App-Publisher", publisher);
        headers.put("Ninja-Git-Email", email);
        headers.put("Ninja-Version", "3.1.0");
        return headers;
    }

    private static HttpHeaders httpHeaders(Map<String, String> values) {
        HttpHeaders headers = mock(HttpHeaders.class);
        when(headers.getHeaderString(anyString())).thenAnswer(invocation -> values.get(invocation.<String>getArgument(0)));
        return headers;
    }

    private static JsonNode body(BillingInvocation invocation) {
        return (JsonNode) invocation.getResponse().getEntity();
    }

    private void put(String path, String json) {
        _store.set(path, json.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode read(String path) {
        return new OptimisticDocumentUpdater(_store, new MetricRegistry()).read(path, NullNode.getInstance());
    }

    /** In-memory store whose reads of selected documents fail. */
    private static class FlakyDocumentStore extends InMemoryDocumentStore {
        private final Set<String> _failing = Sets.newConcurrentHashSet();

        void fail(String path) {
            _failing.add(path);
        }

        @Nullable
        @Override
        public VersionedDocument get(String path) {
            if (_failing.contains(path)) {
                throw new DocumentStoreException(path, "Storage unavailable: " + path);
            }
            return super.get(path);
        }
    }
}

package com.alninja.billing.metering;

import com.alninja.billing.MeterEventsConfiguration;
import com.codahale.metrics.MetricRegistry;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.Client;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.Invocation;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.Form;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.MultivaluedMap;
import javax.ws.rs.core.Response;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;

public class JaxRsMeterEventSenderTest {
    private static final URI URL = URI.create("http://localhost:8765/v1/billing/meter_events");

    private Client _client;
    private Invocation.Builder _builder;
    private Response _response;
    private MetricRegistry _metricRegistry;
    private final Clock _clock = Clock.fixed(Instant.ofEpochSecond(1_767_225_600L, 999_000_000L), ZoneOffset.UTC);

    @BeforeMethod
    public void setUp() {
        _client = mock(Client.class);
        WebTarget target = mock(WebTarget.class);
        _builder = mock(Invocation.Builder.class);
        _response = mock(Response.class);
        _metricRegistry = new MetricRegistry();

        when(_client.target(URL)).thenReturn(target);
        when(target.request(MediaType.APPLICATION_JSON_TYPE)).thenReturn(_builder);
        when(_builder.header(HttpHeaders.AUTHORIZATION, "Bearer sk_test")).thenReturn(_builder);
        when(_builder.post(any(Entity.class))).thenReturn(_response);
    }

    private JaxRsMeterEventSender sender(String secretKey) {
        MeterEventsConfiguration configuration = new MeterEventsConfiguration().setUrl(URL).setSecretKey(secretKey);
        return new JaxRsMeterEventSender(_client, configuration, _clock, _metricRegistry);
    }

    private long meter(String name) {
        return _metricRegistry.meter(MetricRegistry.name("alninja.billing", "MeterEventSender", name)).getCount();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPostsFormEncodedEvent() {
        when(_response.getStatusInfo()).thenReturn(Response.Status.OK);

        sender("sk_test").send(MeterEventType.PAY_AS_YOU_GO_USER, "cus_1", "org1_2026-01_user_a@acme.com");

        ArgumentCaptor<Entity> captor = ArgumentCaptor.forClass(Entity.class);
        verify(_builder).post(captor.capture());
        Entity<Form> entity = captor.getValue();
        assertEquals(entity.getMediaType(), MediaType.APPLICATION_FORM_URLENCODED_TYPE);

        MultivaluedMap<String, String> form = entity.getEntity().asMap();
        assertEquals(form.getFirst("event_name"), "pay_as_you_go_user");
        assertEquals(form.getFirst("payload[stripe_customer_id]"), "cus_1");
        assertEquals(form.getFirst("payload[users]"), "1");
        assertEquals(form.getFirst("timestamp"), "1767225600");
        assertEquals(form.getFirst("identifier"), "org1_2026-01_user_a@acme.com");

        verify(_response).close();
        assertEquals(meter("sent"), 1);
        assertEquals(meter("failures"), 0);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testAppEventPayloadField() {
        when(_response.getStatusInfo()).thenReturn(Response.Status.OK);

        sender("sk_test").send(MeterEventType.PAY_AS_YOU_GO_APP, "cus_1", "org1_2026-01_app_app1|Acme");

        ArgumentCaptor<Entity> captor = ArgumentCaptor.forClass(Entity.class);
        verify(_builder).post(captor.capture());
        MultivaluedMap<String, String> form = ((Entity<Form>) captor.getValue()).getEntity().asMap();
        assertEquals(form.getFirst("event_name"), "pay_as_you_go_app");
        assertEquals(form.getFirst("payload[value]"), "1");
    }

    @Test
    public void testRejectedEventIsCounted() {
        when(_response.getStatusInfo()).thenReturn(Response.Status.BAD_REQUEST);
        when(_response.getStatus()).thenReturn(400);
        when(_response.hasEntity()).thenReturn(true);
        when(_response.readEntity(String.class)).thenReturn("{\"error\":\"no such customer\"}");

        sender("sk_test").send(MeterEventType.PAY_AS_YOU_GO_APP, "cus_1", "id");

        verify(_response).close();
        assertEquals(meter("sent"), 0);
        assertEquals(meter("failures"), 1);
    }

    @Test
    public void testConnectionFailureIsCounted() {
        when(_builder.post(any(Entity.class))).thenThrow(new ProcessingException("connection refused"));

        sender("sk_test").send(MeterEventType.PAY_AS_YOU_GO_APP, "cus_1", "id");

        assertEquals(meter("failures"), 1);
    }

    @Test
    public void testMissingSecretKeySkipsEvent() {
        sender(null).send(MeterEventType.PAY_AS_YOU_GO_APP, "cus_1", "id");
        sender("  ").send(MeterEventType.PAY_AS_YOU_GO_APP, "cus_1", "id");

        verifyNoInteractions(_client);
        assertEquals(meter("sent"), 0);
        assertEquals(meter("failures"), 0);
    }
}

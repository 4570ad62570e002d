package com.alninja.billing.metering;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.MeterEventsConfiguration;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.ProcessingException;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.client.Client;
import javax.ws.rs.client.Entity;
import javax.ws.rs.core.Form;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.net.URI;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Posts form encoded meter events, authenticated with the configured secret key.  Without a secret key events are
 * skipped with an error.
 */
public class JaxRsMeterEventSender implements MeterEventSender {
    private static final Logger _log = LoggerFactory.getLogger(JaxRsMeterEventSender.class);

    private final Client _client;
    private final URI _url;
    private final Optional<String> _secretKey;
    private final Clock _clock;
    private final Meter _sent;
    private final Meter _failures;

    @Inject
    public JaxRsMeterEventSender(Client client, BillingConfiguration configuration, Clock clock, MetricRegistry metricRegistry) {
        this(client, configuration.getMeterEvents(), clock, metricRegistry);
    }

    public JaxRsMeterEventSender(Client client, MeterEventsConfiguration configuration, Clock clock, MetricRegistry metricRegistry) {
        _client = checkNotNull(client, "client");
        _url = checkNotNull(configuration.getUrl(), "url");
        _secretKey = configuration.getSecretKey().filter(key -> !key.trim().isEmpty());
        _clock = checkNotNull(clock, "clock");
        _sent = metricRegistry.meter(MetricRegistry.name("alninja.billing", "MeterEventSender", "sent"));
        _failures = metricRegistry.meter(MetricRegistry.name("alninja.billing", "MeterEventSender", "failures"));
    }

    @Override
    public void send(MeterEventType type, String customerId, String identifier) {
        if (!_secretKey.isPresent()) {
            _log.error("Meter event secret key is not configured, skipping {} event {}", type.getEventName(), identifier);
            return;
        }

        Form form = new Form()
                .param("event_name", type.getEventName())
                .param("payload[stripe_customer_id]", customerId)
                .param("payload[" + type.getPayloadField() + "]", "1")
                .param("timestamp", Long.toString(TimeUnit.MILLISECONDS.toSeconds(_clock.millis())))
                .param("identifier", identifier);

        Response response = null;
        try {
            response = _client.target(_url)
                    .request(MediaType.APPLICATION_JSON_TYPE)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + _secretKey.get())
                    .post(Entity.form(form));

            if (response.getStatusInfo().getFamily() == Response.Status.Family.SUCCESSFUL) {
                _sent.mark();
            } else {
                _failures.mark();
                String detail = response.hasEntity() ? response.readEntity(String.class) : "";
                _log.error("Meter event {} failed: {} - {}", identifier, response.getStatus(), detail);
            }
        } catch (ProcessingException | WebApplicationException e) {
            _failures.mark();
            _log.error("Error sending meter event {}", identifier, e);
        } finally {
            if (response != null) {
                response.close();
            }
        }
    }
}

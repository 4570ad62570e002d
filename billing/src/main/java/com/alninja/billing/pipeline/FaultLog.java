package com.alninja.billing.pipeline;

import com.alninja.billing.core.DocumentPaths;
import com.alninja.billing.docstore.core.OptimisticDocumentUpdater;
import com.google.common.base.MoreObjects;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Records unexpected billing failures to {@code system/unhandledErrors.json} for later inspection.  Recording is best
 * effort: a failure to record is logged and otherwise ignored so it cannot fail the request.
 */
public class FaultLog {
    private static final Logger _log = LoggerFactory.getLogger(FaultLog.class);

    private final OptimisticDocumentUpdater _updater;
    private final Clock _clock;

    @Inject
    public FaultLog(OptimisticDocumentUpdater updater, Clock clock) {
        _updater = checkNotNull(updater, "updater");
        _clock = checkNotNull(clock, "clock");
    }

    public void record(Throwable fault) {
        String message = MoreObjects.firstNonNull(fault.getMessage(), fault.getClass().getName());
        try {
            _updater.append(DocumentPaths.UNHANDLED_ERRORS, new UnhandledError(_clock.millis(), message));
        } catch (RuntimeException e) {
            _log.error("Unable to record billing fault: {}", message, e);
        }
    }
}

package com.alninja.billing.web.headers;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.UpgradeRequiredException;
import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;
import com.google.inject.Inject;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Rejects clients that do not report a version or report one older than the supported minimum.
 * <p>
 * Versions are compared numerically part by part.  Missing or non-numeric parts count as zero, so {@code 3.1}
 * equals {@code 3.1.0}.
 */
public class VersionCheck {
    private static final Splitter DOT = Splitter.on('.');

    private final String _minimumVersion;

    @Inject
    public VersionCheck(BillingConfiguration configuration) {
        this(configuration.getMinimumClientVersion());
    }

    public VersionCheck(String minimumVersion) {
        _minimumVersion = checkNotNull(minimumVersion, "minimumVersion");
    }

    public void check(@Nullable String clientVersion) {
        if (clientVersion == null || compare(clientVersion, _minimumVersion) < 0) {
            throw new UpgradeRequiredException(_minimumVersion, clientVersion);
        }
    }

    static int compare(String a, String b) {
        List<String> partsA = DOT.splitToList(a);
        List<String> partsB = DOT.splitToList(b);
        for (int i = 0; i < Math.max(partsA.size(), partsB.size()); i++) {
            int result = Long.compare(part(partsA, i), part(partsB, i));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static long part(List<String> parts, int index) {
        if (index >= parts.size()) {
            return 0;
        }
        Integer value = Ints.tryParse(parts.get(index).trim());
        return value != null ? value : 0;
    }
}

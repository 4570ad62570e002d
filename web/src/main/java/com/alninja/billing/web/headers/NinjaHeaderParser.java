package com.alninja.billing.web.headers;

import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.pipeline.NinjaHeaders;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;

import javax.annotation.Nullable;
import javax.ws.rs.core.HttpHeaders;
import java.util.Locale;

/**
 * Reads the client identity sent by the extension.
 * <p>
 * Newer clients send everything but the app id and branch as a Base64 encoded JSON object in
 * {@value #PAYLOAD}; older clients send one header per value.  The app id and branch always come from their own
 * headers.
 */
public class NinjaHeaderParser {
    public static final String APP_ID = "Ninja-App-Id";
    public static final String GIT_BRANCH = "Ninja-Git-Branch";
    public static final String PAYLOAD = "Ninja-Header-Payload";
    public static final String GIT_NAME = "Ninja-Git-Name";
    public static final String GIT_EMAIL = "Ninja-Git-Email";
    public static final String APP_PUBLISHER = "Ninja-App-Publisher";
    public static final String APP_NAME = "Ninja-App-Name";
    public static final String APP_VERSION = "Ninja-App-Version";
    public static final String NINJA_VERSION = "Ninja-Version";

    /**
     * @throws IllegalArgumentException if the payload header is not Base64 encoded JSON
     */
    public NinjaHeaders parse(HttpHeaders headers) {
        NinjaHeaders.Builder builder = NinjaHeaders.builder()
                .appId(headers.getHeaderString(APP_ID))
                .gitBranch(headers.getHeaderString(GIT_BRANCH));

        String payload = headers.getHeaderString(PAYLOAD);
        if (!Strings.isNullOrEmpty(payload)) {
            JsonNode json = JsonHelper.readTree(BaseEncoding.base64().decode(payload.trim()), NullNode.getInstance());
            return builder
                    .gitUserName(text(json, "gitUserName"))
                    .gitUserEmail(lowerCase(text(json, "gitUserEmail")))
                    .appPublisher(text(json, "appPublisher"))
                    .appName(text(json, "appName"))
                    .appVersion(text(json, "appVersion"))
                    .ninjaVersion(text(json, "ninjaVersion"))
                    .build();
        }

        return builder
                .gitUserName(headers.getHeaderString(GIT_NAME))
                .gitUserEmail(lowerCase(headers.getHeaderString(GIT_EMAIL)))
                .appPublisher(headers.getHeaderString(APP_PUBLISHER))
                .appName(headers.getHeaderString(APP_NAME))
                .appVersion(headers.getHeaderString(APP_VERSION))
                .ninjaVersion(headers.getHeaderString(NINJA_VERSION))
                .build();
    }

    @Nullable
    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    @Nullable
    private static String lowerCase(@Nullable String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }
}

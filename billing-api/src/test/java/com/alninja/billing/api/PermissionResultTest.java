package com.alninja.billing.api;

import com.alninja.billing.common.json.JsonHelper;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class PermissionResultTest {

    @Test
    public void testAllowed() {
        PermissionResult result = PermissionResult.allowed();
        assertTrue(result.isAllowed());
        assertNull(result.getWarning());
        assertEquals(JsonHelper.asJson(result), "{\"allowed\":true}");
    }

    @Test
    public void testWarning() {
        PermissionResult result = PermissionResult.allowed(new PermissionWarning(WarningCode.ORG_GRACE_PERIOD, 100L, "a@b.com"));
        assertEquals(JsonHelper.asJson(result.getWarning()),
                "{\"code\":\"ORG_GRACE_PERIOD\",\"timeRemaining\":100,\"gitEmail\":\"a@b.com\"}");
    }

    @Test
    public void testDenied() {
        PermissionResult result = PermissionResult.denied(ErrorCode.GRACE_EXPIRED);
        assertFalse(result.isAllowed());
        assertEquals(result.getError().getCode(), ErrorCode.GRACE_EXPIRED);
        assertEquals(JsonHelper.fromJson(JsonHelper.asJson(result), PermissionResult.class), result);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDeniedRequiresError() {
        JsonHelper.fromJson("{\"allowed\":false}", PermissionResult.class);
    }

    @Test
    public void testPermissionDeniedBody() {
        PermissionDeniedException e = new PermissionDeniedException(
                new PermissionError(ErrorCode.USER_NOT_AUTHORIZED, "dev@contoso.com"));
        assertEquals(JsonHelper.asJson(e), "{\"error\":{\"code\":\"USER_NOT_AUTHORIZED\",\"gitEmail\":\"dev@contoso.com\"}}");
    }

    @Test
    public void testBlockReasonMapping() {
        assertEquals(BlockReason.fromValue("payment_failed").getErrorCode(), ErrorCode.PAYMENT_FAILED);
        assertEquals(BlockReason.fromValue("flagged").getErrorCode(), ErrorCode.ORG_FLAGGED);
        assertNull(BlockReason.fromValue("something_new"));
        assertEquals(SubscriptionTier.fromValue("payAsYouGo"), SubscriptionTier.PAY_AS_YOU_GO);
    }
}

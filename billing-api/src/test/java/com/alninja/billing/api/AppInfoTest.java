package com.alninja.billing.api;

import com.alninja.billing.common.json.JsonHelper;
import com.fasterxml.jackson.databind.JsonNode;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class AppInfoTest {

    @Test
    public void testReadStoredApp() {
        AppInfo app = JsonHelper.fromJson("{\"id\":\"abc\",\"name\":\"My App\",\"publisher\":\"Contoso\"," +
                "\"ownerType\":\"organization\",\"ownerId\":\"org1\",\"created\":1,\"freeUntil\":2," +
                "\"_authorization\":{\"key\":\"x\"}}", AppInfo.class);

        assertEquals(app.getId(), "abc");
        assertEquals(app.getOwnerType(), OwnerType.ORGANIZATION);
        assertEquals(app.getOwnerId(), "org1");
        assertTrue(app.hasOwner());
        assertFalse(app.isUnowned());
        assertFalse(app.isSponsored());
    }

    @Test
    public void testMissingOptionalFields() {
        AppInfo app = JsonHelper.fromJson("{\"id\":\"abc\"}", AppInfo.class);
        assertEquals(app.getName(), "");
        assertEquals(app.getPublisher(), "");
        assertNull(app.getOwnerType());
        assertTrue(app.isUnowned());
    }

    @Test
    public void testUnknownOwnerTypeReadsAsNull() {
        AppInfo app = JsonHelper.fromJson("{\"id\":\"abc\",\"ownerType\":\"team\",\"ownerId\":\"t1\"}", AppInfo.class);
        assertNull(app.getOwnerType());
        assertTrue(app.hasOwner());
    }

    @Test
    public void testOrphanSerialization() {
        JsonNode json = JsonHelper.toTree(AppInfo.orphan("abc", "", "Contoso", 10, 20));
        assertEquals(json.size(), 5);
        assertEquals(json.get("freeUntil").asLong(), 20);
        assertFalse(json.has("sponsored"));
        assertFalse(json.has("ownerId"));
        assertFalse(json.has("unowned"));
    }

    @Test
    public void testOwnerTransitions() {
        AppInfo orphan = AppInfo.orphan("abc", "n", "p", 10, 20);
        AppInfo owned = orphan.withOwner(OwnerType.USER, "u1");
        assertEquals(owned.getOwnerType(), OwnerType.USER);
        assertEquals(owned.withoutOwner(), orphan);
        assertEquals(owned.withName("").getName(), "");
    }
}

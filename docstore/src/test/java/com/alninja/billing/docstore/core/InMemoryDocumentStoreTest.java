package com.alninja.billing.docstore.core;

import com.alninja.billing.docstore.api.DocumentConflictException;
import com.alninja.billing.docstore.api.VersionedDocument;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;

public class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore _store;

    @BeforeMethod
    public void setUp() {
        _store = new InMemoryDocumentStore();
    }

    @Test
    public void testMissingDocument() {
        assertNull(_store.get("system/apps.json"));
    }

    @Test
    public void testCreateAndReplace() {
        String v1 = _store.put("system/apps.json", bytes("[]"), null);
        VersionedDocument doc = _store.get("system/apps.json");
        assertEquals(doc.getVersion(), v1);
        assertEquals(new String(doc.getContent(), StandardCharsets.UTF_8), "[]");

        String v2 = _store.put("system/apps.json", bytes("[1]"), v1);
        assertNotEquals(v2, v1);
        assertEquals(_store.get("system/apps.json").getVersion(), v2);
    }

    @Test(expectedExceptions = DocumentConflictException.class)
    public void testCreateWhenAlreadyExists() {
        _store.put("system/apps.json", bytes("[]"), null);
        _store.put("system/apps.json", bytes("[]"), null);
    }

    @Test(expectedExceptions = DocumentConflictException.class)
    public void testStaleVersion() {
        String v1 = _store.put("doc.json", bytes("{}"), null);
        _store.put("doc.json", bytes("{\"a\":1}"), v1);
        _store.put("doc.json", bytes("{\"a\":2}"), v1);
    }

    @Test(expectedExceptions = DocumentConflictException.class)
    public void testReplaceMissingDocument() {
        _store.put("doc.json", bytes("{}"), "7");
    }

    @Test
    public void testSetBumpsVersion() {
        String v1 = _store.put("doc.json", bytes("{}"), null);
        _store.set("doc.json", bytes("{}"));
        assertNotEquals(_store.get("doc.json").getVersion(), v1);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

package com.alninja.billing.writeback;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.ErrorCode;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.PermissionResult;
import com.alninja.billing.api.SubscriptionTier;
import com.alninja.billing.lifecycle.SimpleLifeCycleRegistry;
import com.alninja.billing.permission.PermissionDecision;
import com.alninja.billing.permission.UserUpdate;
import com.alninja.billing.pipeline.BillingContext;
import com.alninja.billing.pipeline.BillingEndpoint;
import com.alninja.billing.pipeline.BillingRequest;
import com.alninja.billing.pipeline.Capability;
import com.alninja.billing.pipeline.NinjaHeaders;
import com.codahale.metrics.MetricRegistry;
import com.google.common.util.concurrent.ListenableFuture;
import org.mockito.InOrder;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class WritebackServiceTest {
    private static final String EMAIL = "dev@acme.com";

    private BillingWritebacks _writebacks;
    private MetricRegistry _metricRegistry;
    private SimpleLifeCycleRegistry _lifeCycle;
    private WritebackService _service;

    private final NinjaHeaders _headers = NinjaHeaders.builder().appId("app1").gitUserEmail(EMAIL).build();
    private final AppInfo _app = AppInfo.orphan("app1", "App", "Acme", 0, 1);

    @BeforeMethod
    public void setUp() {
        _writebacks = mock(BillingWritebacks.class);
        _metricRegistry = new MetricRegistry();
        _lifeCycle = new SimpleLifeCycleRegistry();
        _service = new WritebackService(_writebacks, new BillingConfiguration(), _lifeCycle, _metricRegistry);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        _lifeCycle.stop();
    }

    private long failures() {
        return _metricRegistry.meter(MetricRegistry.name("alninja.billing", "WritebackService", "failures")).getCount();
    }

    @Test
    public void testNewOrphanWithoutOrganization() {
        BillingContext context = new BillingContext().bindNewOrphan(_app);

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks).writeBackNewOrphan(_app);
        verifyNoMoreInteractions(_writebacks);
    }

    @Test
    public void testClaimRecordsAppThenUser() {
        Organization organization = Organization.builder("org1").build();
        BillingContext context = new BillingContext().bindApp(_app).claim(organization);

        _service.perform(context, _headers, BillingEndpoint.unbilled("getNext").and(Capability.BILLING));

        InOrder inOrder = inOrder(_writebacks);
        inOrder.verify(_writebacks).writeBackClaimedApp(context.getApp(), organization);
        inOrder.verify(_writebacks).updateFirstSeenTimestamp("org1", EMAIL);
        verifyNoMoreInteractions(_writebacks);
    }

    @Test
    public void testForceOrphan() {
        BillingContext context = new BillingContext().bindApp(_app).forceOrphan();

        _service.perform(context, _headers, BillingEndpoint.withBilling("getNext"));

        verify(_writebacks).writeBackForceOrphanedApp(context.getApp());
        verifyNoMoreInteractions(_writebacks);
    }

    @Test
    public void testUnknownUserIsLogged() {
        Organization organization = Organization.builder("org1").build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization)
                .decide(new PermissionDecision(PermissionResult.allowed(), UserUpdate.UNKNOWN, true));

        _service.perform(context, _headers, BillingEndpoint.withBilling("getNext"));

        verify(_writebacks).writeBackUserUpdate("org1", EMAIL, UserUpdate.UNKNOWN);
        verify(_writebacks).updateFirstSeenTimestamp("org1", EMAIL);
        verify(_writebacks).logUnknownUser("org1", EMAIL, "app1");
        verify(_writebacks, never()).logActivity(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    public void testUsageLoggedAndMetered() {
        Organization organization = Organization.builder("org1")
                .plan(SubscriptionTier.PAY_AS_YOU_GO).stripeCustomerId("cus_1").build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization)
                .decide(PermissionDecision.of(PermissionResult.allowed()));

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks).logActivity("org1", "app1", EMAIL, "getNext");
        verify(_writebacks).updateBillingLog("org1", "app1", "Acme", EMAIL, "cus_1");
    }

    @Test
    public void testUsageNotMeteredWithoutCustomer() {
        Organization organization = Organization.builder("org1").plan(SubscriptionTier.PAY_AS_YOU_GO).build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization);

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks).logActivity("org1", "app1", EMAIL, "getNext");
        verify(_writebacks, never()).updateBillingLog(anyString(), anyString(), anyString(), anyString(), anyString());
    }

    @Test
    public void testUsageNotLoggedForDeniedRequest() {
        Organization organization = Organization.builder("org1")
                .plan(SubscriptionTier.PAY_AS_YOU_GO).stripeCustomerId("cus_1").build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization)
                .decide(PermissionDecision.of(PermissionResult.denied(ErrorCode.USER_NOT_AUTHORIZED)));

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks, never()).logActivity(anyString(), anyString(), anyString(), anyString());
        verify(_writebacks, never()).updateBillingLog(anyString(), anyString(), anyString(), anyString(), anyString());
    }

    @Test
    public void testUsageNotLoggedForDeniedUser() {
        Organization organization = Organization.builder("org1").deniedUsers("DEV@acme.com").build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization);

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks, never()).logActivity(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    public void testNothingForUserWithoutEmail() {
        Organization organization = Organization.builder("org1").build();
        BillingContext context = new BillingContext().bindApp(_app).bindOrganization(organization);

        _service.perform(context, NinjaHeaders.builder().appId("app1").build(), BillingEndpoint.withUsageLogging("getNext"));

        verifyNoInteractions(_writebacks);
    }

    @Test
    public void testFailureDoesNotStopRemainingWritebacks() {
        Organization organization = Organization.builder("org1").build();
        BillingContext context = new BillingContext().bindNewOrphan(_app).bindOrganization(organization)
                .decide(new PermissionDecision(PermissionResult.allowed(), UserUpdate.UNKNOWN, true));
        doThrow(new IllegalStateException("store down")).when(_writebacks).writeBackNewOrphan(any(AppInfo.class));
        doThrow(new IllegalStateException("store down")).when(_writebacks)
                .writeBackUserUpdate(anyString(), anyString(), any(UserUpdate.class));

        _service.perform(context, _headers, BillingEndpoint.withUsageLogging("getNext"));

        verify(_writebacks).updateFirstSeenTimestamp("org1", EMAIL);
        verify(_writebacks).logUnknownUser("org1", EMAIL, "app1");
        verify(_writebacks).logActivity("org1", "app1", EMAIL, "getNext");
        assertEquals(failures(), 2);
    }

    @Test
    public void testSubmitWithoutContext() throws Exception {
        BillingRequest request = new BillingRequest(_headers);

        ListenableFuture<?> future = _service.submit(request, BillingEndpoint.withBilling("getNext"));

        assertTrue(future.isDone());
        verifyNoInteractions(_writebacks);
    }

    @Test
    public void testSubmitAfterShutdown() throws Exception {
        _lifeCycle.stop();
        BillingRequest request = new BillingRequest(_headers);
        request.createContext().bindNewOrphan(_app);

        ListenableFuture<?> future = _service.submit(request, BillingEndpoint.withBilling("getNext"));

        assertTrue(future.isDone());
        try {
            future.get();
            fail("Writebacks should not run once the pool is shut down");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof RejectedExecutionException);
        }
        assertEquals(failures(), 1);
        assertTrue(_service.awaitIdle(1, TimeUnit.SECONDS));
        verifyNoInteractions(_writebacks);
    }

    @Test
    public void testSubmitOnPrivateBackend() throws Exception {
        WritebackService service = new WritebackService(_writebacks,
                new BillingConfiguration().setPrivateBackend(true), _lifeCycle, _metricRegistry);
        BillingRequest request = new BillingRequest(_headers);
        request.createContext().bindNewOrphan(_app);

        assertTrue(service.submit(request, BillingEndpoint.withBilling("getNext")).isDone());
        verifyNoInteractions(_writebacks);
    }

    @Test
    public void testAwaitIdle() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await();
            return null;
        }).when(_writebacks).writeBackNewOrphan(any(AppInfo.class));
        BillingRequest request = new BillingRequest(_headers);
        request.createContext().bindNewOrphan(_app);

        ListenableFuture<?> future = _service.submit(request, BillingEndpoint.withBilling("getNext"));

        assertFalse(_service.awaitIdle(50, TimeUnit.MILLISECONDS));
        release.countDown();
        assertTrue(_service.awaitIdle(10, TimeUnit.SECONDS));
        assertTrue(future.isDone());
        verify(_writebacks).writeBackNewOrphan(_app);
    }
}

package com.lead.discovery.catalog;

import com.lead.discovery.cache.CacheConfig;
import com.lead.discovery.cache.CacheStats;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingServiceCatalogTest {

    @Mock
    private ServiceCatalog delegate;

    @Mock
    private MetricsService metricsService;

    private CachingServiceCatalog catalog;
    private ServiceOffering loans;

    @BeforeEach
    void setUp() {
        catalog = new CachingServiceCatalog(delegate, CacheConfig.defaults(), metricsService);
        loans = ServiceOffering.builder().id("svc-loan").serviceName("Loans").serviceType("business_loan").build();
    }

    @Test
    void lookupsAreServedFromCache() {
        when(delegate.findById("svc-loan")).thenReturn(Optional.of(loans));

        assertEquals(Optional.of(loans), catalog.findById("svc-loan"));
        assertEquals(Optional.of(loans), catalog.findById("svc-loan"));

        verify(delegate, times(1)).findById("svc-loan");
        verify(metricsService).recordCacheMiss();
        verify(metricsService).recordCacheHit();
        CacheStats stats = catalog.getStats();
        assertEquals(1, stats.size());
    }

    @Test
    void missingServicesAreCachedToo() {
        when(delegate.findById("nope")).thenReturn(Optional.empty());

        assertTrue(catalog.findById("nope").isEmpty());
        assertTrue(catalog.findById("nope").isEmpty());

        verify(delegate, times(1)).findById("nope");
    }

    @Test
    void invalidateReloadsActiveList() {
        when(delegate.findActive()).thenReturn(List.of(loans));

        assertEquals(List.of(loans), catalog.findActive());
        catalog.findActive();
        catalog.invalidate("svc-loan");
        catalog.findActive();

        verify(delegate, times(2)).findActive();
    }

    @Test
    void invalidateAllDropsLookups() {
        when(delegate.findById("svc-loan")).thenReturn(Optional.of(loans));

        catalog.findById("svc-loan");
        catalog.invalidateAll();
        catalog.findById("svc-loan");

        verify(delegate, times(2)).findById("svc-loan");
    }

    @Test
    void invalidConfigRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}

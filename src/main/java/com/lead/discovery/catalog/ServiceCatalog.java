package com.lead.discovery.catalog;

import com.lead.discovery.core.model.ServiceOffering;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the service catalog. The catalog is owned elsewhere; the engine only
 * reads offerings to score leads against them.
 */
public interface ServiceCatalog {

    Optional<ServiceOffering> findById(String serviceId);

    /**
     * Offerings with {@code active == true}.
     */
    List<ServiceOffering> findActive();
}

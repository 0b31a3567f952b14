package com.lead.discovery.catalog;

import com.lead.discovery.core.model.ServiceOffering;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Catalog held in memory, for tests and embedded use.
 */
public class InMemoryServiceCatalog implements ServiceCatalog {

    private final ConcurrentMap<String, ServiceOffering> services = new ConcurrentHashMap<>();

    public InMemoryServiceCatalog() {
    }

    public InMemoryServiceCatalog(List<ServiceOffering> offerings) {
        offerings.forEach(this::put);
    }

    public void put(ServiceOffering offering) {
        services.put(offering.getId(), offering);
    }

    public void remove(String serviceId) {
        services.remove(serviceId);
    }

    @Override
    public Optional<ServiceOffering> findById(String serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    @Override
    public List<ServiceOffering> findActive() {
        return services.values().stream()
                .filter(ServiceOffering::isActive)
                .sorted(Comparator.comparing(ServiceOffering::getServiceName))
                .toList();
    }
}

package com.bookati.reservation.domain.service;

import com.bookati.common.exception.ConflictException;
import com.bookati.common.exception.ForbiddenException;
import com.bookati.common.exception.ResourceNotFoundException;
import com.bookati.common.exception.ValidationException;
import com.bookati.common.util.PhoneNumberNormalizer;
import com.bookati.reservation.domain.model.Customer;
import com.bookati.reservation.domain.model.ServiceOffer;
import com.bookati.reservation.domain.model.ServiceOffering;
import com.bookati.reservation.domain.model.Tenant;
import com.bookati.reservation.domain.repository.CustomerRepository;
import com.bookati.reservation.domain.repository.ServiceOfferRepository;
import com.bookati.reservation.domain.repository.ServiceOfferingRepository;
import com.bookati.reservation.domain.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the catalog and customer records owned by other parts of the platform.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLookupService {

    private final TenantRepository tenantRepository;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final ServiceOfferRepository serviceOfferRepository;
    private final CustomerRepository customerRepository;

    @Transactional(readOnly = true)
    public Tenant requireActiveTenant(UUID tenantId) {
        Tenant tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
        if (!tenant.isActive()) {
            throw new ForbiddenException("Tenant " + tenantId + " is not active", "TENANT_INACTIVE");
        }
        return tenant;
    }

    @Transactional(readOnly = true)
    public ServiceOffering requireBookableService(UUID serviceId, UUID tenantId) {
        ServiceOffering service = serviceOfferingRepository.findById(serviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Service", serviceId));
        if (!service.getTenantId().equals(tenantId)) {
            throw new ForbiddenException("Service " + serviceId + " belongs to another tenant", "TENANT_MISMATCH");
        }
        if (!service.isActive()) {
            throw new ConflictException("Service " + serviceId + " is not active", "SERVICE_INACTIVE");
        }
        return service;
    }

    /**
     * Price of one paid visitor at booking time: the offer price when an offer is chosen,
     * otherwise the service unit price.
     */
    @Transactional(readOnly = true)
    public BigDecimal unitPrice(ServiceOffering service, UUID offerId) {
        if (offerId == null) {
            return service.getUnitPrice();
        }
        ServiceOffer offer = serviceOfferRepository.findById(offerId)
                .orElseThrow(() -> new ValidationException("Offer " + offerId + " does not exist", "INVALID_OFFER"));
        if (!offer.getServiceId().equals(service.getId())) {
            throw new ValidationException("Offer " + offerId + " is not an offer of service " + service.getId(),
                    "INVALID_OFFER");
        }
        if (!offer.isActive()) {
            throw new ValidationException("Offer " + offerId + " is no longer active", "INVALID_OFFER");
        }
        return offer.getPrice();
    }

    /**
     * Price of one paid visitor for an existing booking. An offer that has since been removed
     * falls back to the service price.
     */
    @Transactional(readOnly = true)
    public BigDecimal currentUnitPrice(UUID serviceId, UUID offerId) {
        if (offerId != null) {
            Optional<ServiceOffer> offer = serviceOfferRepository.findById(offerId);
            if (offer.isPresent()) {
                return offer.get().getPrice();
            }
            log.warn("Offer {} of service {} no longer exists, pricing at the service unit price", offerId, serviceId);
        }
        return serviceOfferingRepository.findById(serviceId)
                .map(ServiceOffering::getUnitPrice)
                .orElseThrow(() -> new ResourceNotFoundException("Service", serviceId));
    }

    /**
     * @throws ValidationException with code INVALID_PHONE when the number can not be normalized
     */
    public String normalizePhone(String phone) {
        return PhoneNumberNormalizer.normalize(phone)
                .orElseThrow(() -> new ValidationException("Phone number '" + phone + "' is not valid", "INVALID_PHONE"));
    }

    /**
     * Resolves the customer record for a booking. A supplied id that does not exist in the tenant
     * is ignored; the phone lookup decides then. Empty means a guest booking.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> resolveCustomerId(UUID tenantId, UUID customerId, String normalizedPhone) {
        if (customerId != null) {
            Optional<Customer> customer = customerRepository.findById(customerId)
                    .filter(c -> c.getTenantId().equals(tenantId));
            if (customer.isPresent()) {
                return Optional.of(customer.get().getId());
            }
            log.debug("Customer {} not found in tenant {}, falling back to phone lookup", customerId, tenantId);
        }
        return customerRepository.findByTenantIdAndPhone(tenantId, normalizedPhone)
                .map(Customer::getId);
    }
}

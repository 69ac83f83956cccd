package uk.gegc.aegis.features.partner.domain.repository;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import uk.gegc.aegis.features.partner.domain.model.Partner;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.util.Optional;
import java.util.UUID;

public interface PartnerRepository extends Repository<Partner, UUID> {

    Partner saveAndFlush(Partner partner);

    @Query("SELECT p FROM Partner p WHERE p.id = :id AND p.tenantId = :#{#tenant.tenantId}")
    Optional<Partner> findById(@Param("tenant") TenantContext tenant, @Param("id") UUID id);
}

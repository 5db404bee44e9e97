package aforo.pricing.repository;

import aforo.pricing.entity.Contract;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContractRepository extends JpaRepository<Contract, Long> {

    Optional<Contract> findByUserIdAndOrganizationId(String userId, Long organizationId);

    /**
     * Contracts subscribed to a service, any version. Service keys are stored lower-case.
     */
    @Query(value = "SELECT * FROM contract WHERE organization_id = :orgId " +
                   "AND jsonb_exists(contracted_services, LOWER(:serviceName))",
           nativeQuery = true)
    List<Contract> findByContractedService(@Param("orgId") Long organizationId,
                                           @Param("serviceName") String serviceName);

    /**
     * Contracts subscribed to one escaped version of a service.
     */
    @Query(value = "SELECT * FROM contract WHERE organization_id = :orgId " +
                   "AND contracted_services ->> LOWER(:serviceName) = :escapedVersion",
           nativeQuery = true)
    List<Contract> findByContractedServiceVersion(@Param("orgId") Long organizationId,
                                                  @Param("serviceName") String serviceName,
                                                  @Param("escapedVersion") String escapedVersion);
}

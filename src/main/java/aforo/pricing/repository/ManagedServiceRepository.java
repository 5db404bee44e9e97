package aforo.pricing.repository;

import aforo.pricing.entity.ManagedService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ManagedServiceRepository extends JpaRepository<ManagedService, Long> {

    /**
     * Case-insensitive lookup of a service by name within an organization.
     */
    @Query("SELECT s FROM ManagedService s WHERE s.organizationId = :orgId " +
           "AND LOWER(s.name) = LOWER(:name) AND s.disabled = :disabled")
    Optional<ManagedService> findByName(@Param("orgId") Long organizationId,
                                        @Param("name") String name,
                                        @Param("disabled") boolean disabled);

    List<ManagedService> findByOrganizationIdAndDisabledFalseOrderByNameAsc(Long organizationId);
}

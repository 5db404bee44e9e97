package aforo.pricing.repository;

import aforo.pricing.entity.Pricing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Stored pricings. Services reference them by id through their locators.
 */
@Repository
public interface PricingRepository extends JpaRepository<Pricing, String> {
}

package com.flamingo.ndthub.domain.repository;

import com.flamingo.ndthub.domain.entity.Manufacturer;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Manufacturer entities. */
@Repository
public interface ManufacturerRepository extends JpaRepository<Manufacturer, Long> {

  List<Manufacturer> findAllByOrderByNameAsc();

  Optional<Manufacturer> findByName(String name);
}

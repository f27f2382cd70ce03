package com.flamingo.ndthub.service.manufacturer;

import com.flamingo.ndthub.domain.entity.Manufacturer;
import java.util.List;

/** Service interface for manufacturers. */
public interface ManufacturerService {

  /** Gets all manufacturers ordered by name. */
  List<Manufacturer> getAllManufacturers();

  /**
   * Gets a manufacturer by ID.
   *
   * @throws com.flamingo.ndthub.exception.ManufacturerNotFoundException if not found
   */
  Manufacturer getManufacturer(Long manufacturerId);
}

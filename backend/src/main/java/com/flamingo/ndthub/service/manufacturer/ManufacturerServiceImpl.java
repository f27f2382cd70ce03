package com.flamingo.ndthub.service.manufacturer;

import com.flamingo.ndthub.domain.entity.Manufacturer;
import com.flamingo.ndthub.domain.repository.ManufacturerRepository;
import com.flamingo.ndthub.exception.ManufacturerNotFoundException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the ManufacturerService. */
@Service
@RequiredArgsConstructor
public class ManufacturerServiceImpl implements ManufacturerService {

  private final ManufacturerRepository manufacturerRepository;

  @Override
  @Transactional(readOnly = true)
  public List<Manufacturer> getAllManufacturers() {
    return manufacturerRepository.findAllByOrderByNameAsc();
  }

  @Override
  @Transactional(readOnly = true)
  public Manufacturer getManufacturer(Long manufacturerId) {
    return manufacturerRepository
        .findById(manufacturerId)
        .orElseThrow(() -> new ManufacturerNotFoundException(manufacturerId));
  }
}

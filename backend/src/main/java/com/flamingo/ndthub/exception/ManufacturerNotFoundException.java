package com.flamingo.ndthub.exception;

/** Exception thrown when a manufacturer is not found. */
public class ManufacturerNotFoundException extends RuntimeException {

  private final Long manufacturerId;

  public ManufacturerNotFoundException(Long manufacturerId) {
    super("Manufacturer not found: " + manufacturerId);
    this.manufacturerId = manufacturerId;
  }

  public Long getManufacturerId() {
    return manufacturerId;
  }
}

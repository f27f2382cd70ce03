package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.dto.response.ManufacturerResponse;
import com.flamingo.ndthub.service.manufacturer.ManufacturerService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the public manufacturer list. */
@RestController
@RequestMapping("/api/manufacturers")
@RequiredArgsConstructor
public class ManufacturerController {

  private final ManufacturerService manufacturerService;

  @GetMapping
  public ResponseEntity<List<ManufacturerResponse>> getManufacturers() {
    return ResponseEntity.ok(
        manufacturerService.getAllManufacturers().stream()
            .map(ManufacturerResponse::fromEntity)
            .toList());
  }
}

package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.domain.entity.Manufacturer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for manufacturer data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManufacturerResponse {

  private Long id;
  private String name;
  private String themePrimary;
  private String themeSecondary;

  public static ManufacturerResponse fromEntity(Manufacturer manufacturer) {
    return ManufacturerResponse.builder()
        .id(manufacturer.getId())
        .name(manufacturer.getName())
        .themePrimary(manufacturer.getThemePrimary())
        .themeSecondary(manufacturer.getThemeSecondary())
        .build();
  }
}

package com.dtech.accountservice.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateVendorRequest(@NotBlank @Size(min = 3, max = 50) String name, @Min(1) int userLimit) {}

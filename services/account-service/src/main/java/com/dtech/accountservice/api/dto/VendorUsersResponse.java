package com.dtech.accountservice.api.dto;

import java.util.List;

/**
 * @param limit the vendor's user limit
 */
public record VendorUsersResponse(long total, int limit, List<VendorUserResponse> data) {}

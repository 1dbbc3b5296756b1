package com.assuranceledger.api.dto;

import lombok.Data;

/**
 * Optional note carried by claim transitions.
 */
@Data
public class ClaimActionRequest {

    private String note;
}

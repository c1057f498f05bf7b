package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Platform handles the federation service reports as belonging to the same person,
 * excluding the handle that was looked up.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkedHandles {
    private String federationId;
    private List<String> linkedHandles;
}

package com.flowb.social.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional profile details written onto the identity row of the handle being resolved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdentityHints {

    private String displayName;
    private String avatarUrl;

    public static IdentityHints none() {
        return new IdentityHints();
    }
}

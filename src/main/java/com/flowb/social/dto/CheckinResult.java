package com.flowb.social.dto;

import com.flowb.social.model.Checkin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckinResult {
    private Checkin checkin;
    private int notified;
}

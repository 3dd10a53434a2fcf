package me.golemcore.router.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelResponse {
    private String id;
    private String provider;
    private String displayName;
    private List<String> taskTypes;
    private int priority;
    private double baseScore;
    private int rpm;
    private long tpm;
    private int rpd;
    private boolean blacklisted;
}

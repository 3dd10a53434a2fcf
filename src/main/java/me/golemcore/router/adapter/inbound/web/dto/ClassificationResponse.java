package me.golemcore.router.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResponse {
    private int complexity;
    private boolean requiresMultiAgent;
    private String category;
    private boolean ambiguous;
}

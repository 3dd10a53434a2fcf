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
public class RoutingResponse {
    private String status;
    private String content;
    private String modelId;
    private Integer complexity;
    private String category;
    private boolean ambiguous;
    private boolean multiAgent;
    private List<String> states;
    private List<Attempt> attempts;
    private String message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attempt {
        private String modelId;
        private boolean multiAgent;
        private String failure;
        private boolean sent;
        private String message;
    }
}

package me.golemcore.router.testsupport;

import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.ModelLimits;
import me.golemcore.router.domain.model.TaskType;

public final class TestModels {

    private TestModels() {
    }

    public static ModelDescriptor model(String id, int priority, int rpm, long tpm, int rpd, TaskType... types) {
        String provider = id.contains("/") ? id.substring(0, id.indexOf('/')) : "test";
        ModelDescriptor.ModelDescriptorBuilder builder = ModelDescriptor.builder()
                .id(id)
                .provider(provider)
                .displayName(id)
                .priority(priority)
                .baseScore(0.5)
                .limits(new ModelLimits(rpm, tpm, rpd));
        for (TaskType type : types) {
            builder.taskType(type);
        }
        return builder.build();
    }

    public static ModelDescriptor dialogModel(String id, int priority) {
        return model(id, priority, 10, 1_000_000, 100, TaskType.DIALOG, TaskType.SIMPLE);
    }
}

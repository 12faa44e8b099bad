package io.backup4j.core;

import io.backup4j.TaskHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class TaskHandlerRegistry {

    private final Map<String, TaskHandler<?, ?>> handlersByName;

    public TaskHandlerRegistry(List<TaskHandler<?, ?>> handlers) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        TaskHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate TaskHandler name: " + a.name());
                        }
                ));
    }

    public TaskHandler<?, ?> getRequired(String name) {
        TaskHandler<?, ?> handler = handlersByName.get(name);
        if (handler == null) {
            throw new IllegalArgumentException("No TaskHandler registered for name: " + name);
        }
        return handler;
    }

    public Set<String> names() {
        return handlersByName.keySet();
    }
}

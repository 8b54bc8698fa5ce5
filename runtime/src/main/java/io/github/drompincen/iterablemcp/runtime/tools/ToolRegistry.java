package io.github.drompincen.iterablemcp.runtime.tools;

import io.github.drompincen.iterablemcp.protocol.api.PermissionConfig;
import io.github.drompincen.iterablemcp.protocol.api.ToolDescriptor;
import io.github.drompincen.iterablemcp.runtime.policy.PermissionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds every tool implementation found on the classpath. Which of them a caller
 * may see or invoke is decided per request by {@link PermissionEvaluator}.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;
    private final PermissionEvaluator permissionEvaluator;

    public ToolRegistry(ApplicationContext applicationContext, PermissionEvaluator permissionEvaluator) {
        this.applicationContext = applicationContext;
        this.permissionEvaluator = permissionEvaluator;
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /** Looks a tool up only if the config permits it; denied and unknown names look the same. */
    public Optional<Tool> find(String name, PermissionConfig config) {
        if (name == null || !permissionEvaluator.isAllowed(name, config)) {
            return Optional.empty();
        }
        return get(name);
    }

    public List<Tool> allowed(PermissionConfig config) {
        return tools.values().stream()
                .filter(t -> permissionEvaluator.isAllowed(t.name(), config))
                .sorted(Comparator.comparing(Tool::name))
                .collect(Collectors.toList());
    }

    public List<ToolDescriptor> descriptors(PermissionConfig config) {
        return allowed(config).stream()
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema(), t.capabilities()))
                .collect(Collectors.toList());
    }

    private void injectDependencies(Tool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (method.getName().startsWith("set") && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                try {
                    Object bean = applicationContext.getBean(paramType);
                    method.invoke(tool, bean);
                    log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (NoSuchBeanDefinitionException e) {
                    log.trace("No bean of type {} for {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (Exception e) {
                    log.warn("Failed to inject {} into {}.{}: {}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName(), e.getMessage());
                }
            }
        }
    }
}

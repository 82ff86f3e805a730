package com.runtimehub.runtime_engine.plugin;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import com.runtimehub.runtime_engine.engine.exception.PluginLoadException;
import com.runtimehub.runtime_engine.executor.NodeExecutorRegistry;
import com.runtimehub.runtime_engine.port.PortRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Discovers {@link NodePlugin}s and registers their node types with the executor and port
 * registries. A broken plugin is logged and skipped; it never stops the engine from starting.
 * Built-in and earlier-loaded types win over later ones.
 */
@Slf4j
@Component
public class PluginLoader {

    private static final int MAX_PROVIDER_ERRORS = 100;

    private final NodeExecutorRegistry executorRegistry;
    private final PortRegistry portRegistry;
    private final RuntimeHubProperties.Plugins settings;

    private final List<LoadedPlugin> loaded = new CopyOnWriteArrayList<>();
    // keep jar class loaders reachable while their executors are registered
    private final List<URLClassLoader> jarLoaders = new ArrayList<>();

    public PluginLoader(NodeExecutorRegistry executorRegistry,
                        PortRegistry portRegistry,
                        RuntimeHubProperties properties) {
        this.executorRegistry = executorRegistry;
        this.portRegistry = portRegistry;
        this.settings = properties.getPlugins();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("Plugin loading disabled");
            return;
        }
        loadClasspathPlugins();
        loadDirectory(Path.of(settings.getDirectory()));
        log.info("Loaded {} plugin(s)", loaded.size());
    }

    public void loadClasspathPlugins() {
        ServiceLoader<NodePlugin> serviceLoader = ServiceLoader.load(NodePlugin.class, getClass().getClassLoader());
        loadFrom(serviceLoader, "classpath", plugin -> true);
    }

    /**
     * Loads every {@code *.jar} in the directory, creating the directory when it does not exist.
     */
    public void loadDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Could not create plugins directory {}: {}", directory, e.getMessage());
            return;
        }
        try (DirectoryStream<Path> jars = Files.newDirectoryStream(directory, "*.jar")) {
            for (Path jar : jars) {
                loadJar(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list plugins directory {}: {}", directory, e.getMessage());
        }
    }

    private void loadJar(Path jar) {
        try {
            URLClassLoader loader = new URLClassLoader(new URL[] {jar.toUri().toURL()}, getClass().getClassLoader());
            synchronized (jarLoaders) {
                jarLoaders.add(loader);
            }
            ServiceLoader<NodePlugin> serviceLoader = ServiceLoader.load(NodePlugin.class, loader);
            // the jar loader also sees the parent's providers; only take the jar's own
            loadFrom(serviceLoader, jar.getFileName().toString(), plugin -> plugin.getClass().getClassLoader() == loader);
        } catch (IOException e) {
            PluginLoadException error = new PluginLoadException("Failed to open plugin jar " + jar, e);
            log.error(error.getMessage(), error);
        }
    }

    private void loadFrom(ServiceLoader<NodePlugin> serviceLoader, String source, Predicate<NodePlugin> accept) {
        Iterator<NodePlugin> providers = serviceLoader.iterator();
        int errors = 0;
        while (errors < MAX_PROVIDER_ERRORS) {
            NodePlugin plugin;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                plugin = providers.next();
            } catch (ServiceConfigurationError e) {
                errors++;
                PluginLoadException error = new PluginLoadException("Plugin from " + source + " could not be loaded", e);
                log.error(error.getMessage(), error);
                continue;
            }
            if (!accept.test(plugin)) {
                continue;
            }
            try {
                register(plugin, source);
            } catch (PluginLoadException e) {
                log.error("Skipping plugin {} from {}: {}", plugin.getClass().getName(), source, e.getMessage());
            }
        }
    }

    /**
     * Validates the plugin and registers each of its node types that is not already known.
     *
     * @throws PluginLoadException when the plugin or one of its nodes is malformed
     */
    public LoadedPlugin register(NodePlugin plugin, String source) {
        validate(plugin);

        List<String> registered = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (PluginNode node : plugin.getNodes()) {
            String type = node.type();
            synchronized (executorRegistry) {
                if (executorRegistry.has(type)) {
                    log.warn("Plugin {} node type '{}' conflicts with an existing type, skipping", plugin.getName(), type);
                    skipped.add(type);
                    continue;
                }
                executorRegistry.register(type, node.executor());
            }
            portRegistry.register(type, node.ports());
            registered.add(type);
        }

        LoadedPlugin result = new LoadedPlugin(plugin.getName(), plugin.getVersion(), plugin.getDescription(),
                source, List.copyOf(registered), List.copyOf(skipped));
        loaded.add(result);
        log.info("Loaded plugin {} {} from {} with node types {}", plugin.getName(), plugin.getVersion(), source, registered);
        return result;
    }

    private static void validate(NodePlugin plugin) {
        if (isBlank(plugin.getName())) {
            throw new PluginLoadException("Plugin " + plugin.getClass().getName() + " has no name");
        }
        if (isBlank(plugin.getVersion())) {
            throw new PluginLoadException("Plugin " + plugin.getName() + " has no version");
        }
        if (plugin.getNodes() == null) {
            throw new PluginLoadException("Plugin " + plugin.getName() + " declares no nodes");
        }
        for (PluginNode node : plugin.getNodes()) {
            if (node == null || node.executor() == null) {
                throw new PluginLoadException("Plugin " + plugin.getName() + " has a node without an executor");
            }
            if (isBlank(node.type())) {
                throw new PluginLoadException("Plugin " + plugin.getName() + " has a node without a type");
            }
            if (node.ports() == null) {
                throw new PluginLoadException("Plugin " + plugin.getName() + " node '" + node.type() + "' has no ports");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public List<LoadedPlugin> getLoadedPlugins() {
        return List.copyOf(loaded);
    }

    @PreDestroy
    public void close() {
        synchronized (jarLoaders) {
            for (URLClassLoader loader : jarLoaders) {
                try {
                    loader.close();
                } catch (IOException e) {
                    log.debug("Could not close plugin class loader: {}", e.getMessage());
                }
            }
            jarLoaders.clear();
        }
    }
}

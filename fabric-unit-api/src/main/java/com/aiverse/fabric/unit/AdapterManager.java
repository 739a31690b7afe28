package com.aiverse.fabric.unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

/**
 * Collects {@link PortProvider}s: internal ones (explicitly registered or found on the worker classpath)
 * and adapter JARs from one configured directory, each loaded through a {@link RestrictedAdapterClassLoader}.
 * Internal binding failures are fatal; adapter failures are logged and skipped.
 */
public final class AdapterManager {

    private static final Logger log = LoggerFactory.getLogger(AdapterManager.class);

    private final List<PortProvider> internalProviders = new ArrayList<>();
    private final List<PortProvider> adapterProviders = new ArrayList<>();
    // held so adapter classes stay loadable for the worker's lifetime
    private final List<URLClassLoader> adapterLoaders = new ArrayList<>();

    public void registerInternal(PortProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /** Registers every provider listed in {@code META-INF/services} on the given classloader as internal. */
    public int discoverClasspath(ClassLoader classLoader) {
        int n = 0;
        for (PortProvider provider : ServiceLoader.load(PortProvider.class, classLoader)) {
            internalProviders.add(provider);
            n++;
        }
        if (n > 0) {
            log.info("Discovered {} port provider(s) on the classpath", n);
        }
        return n;
    }

    /**
     * Loads adapter JARs ({@code *.jar}) from the given directory only. A missing directory is ignored;
     * a JAR or provider that fails to load is logged and skipped.
     */
    public void loadAdapters(Path adaptersDir) {
        if (adaptersDir == null) {
            return;
        }
        if (!Files.exists(adaptersDir)) {
            log.debug("Adapters directory does not exist: {}", adaptersDir);
            return;
        }
        if (!Files.isDirectory(adaptersDir)) {
            log.warn("Adapters path is not a directory: {}", adaptersDir);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(adaptersDir, "*.jar")) {
            for (Path jar : stream) {
                loadAdapterJar(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list adapters directory {}: {}", adaptersDir, e.getMessage());
        }
    }

    private void loadAdapterJar(Path jar) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, new RestrictedAdapterClassLoader());
            adapterLoaders.add(loader);

            Iterator<PortProvider> it = ServiceLoader.load(PortProvider.class, loader).iterator();
            int n = 0;
            while (true) {
                try {
                    if (!it.hasNext()) break;
                    adapterProviders.add(it.next());
                    n++;
                } catch (ServiceConfigurationError e) {
                    log.error("Adapter provider from JAR {} failed to instantiate (skipping this provider): {}",
                            jar.getFileName(), e.getMessage(), e);
                }
            }
            if (n > 0) {
                log.info("Loaded {} provider(s) from adapter JAR: {}", n, jar.getFileName());
            }
        } catch (Exception e) {
            log.error("Failed to load adapter JAR {} (skipping): {}", jar, e.getMessage(), e);
        }
    }

    /**
     * Lets every enabled provider bind its ports: internal providers first, then adapters, so an adapter
     * can replace an internal binding.
     *
     * @return number of providers that bound successfully
     * @throws IllegalStateException if an internal provider fails
     */
    public int bindAll(PortBindings bindings) {
        int bound = 0;
        for (PortProvider p : internalProviders) {
            if (!p.isEnabled()) continue;
            try {
                p.bind(bindings);
                bound++;
            } catch (RuntimeException e) {
                throw new IllegalStateException("Internal port provider failed: " + p.name(), e);
            }
        }
        for (PortProvider p : adapterProviders) {
            try {
                if (!p.isEnabled()) continue;
                p.bind(bindings);
                bound++;
                log.info("Bound ports from adapter {}", p.name());
            } catch (RuntimeException | LinkageError e) {
                log.error("Adapter {} failed to bind ports (skipping): {}", p.name(), e.getMessage(), e);
            }
        }
        return bound;
    }

    public List<PortProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    public List<PortProvider> getAdapterProviders() {
        return new ArrayList<>(adapterProviders);
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getAdapterCount() {
        return adapterProviders.size();
    }
}

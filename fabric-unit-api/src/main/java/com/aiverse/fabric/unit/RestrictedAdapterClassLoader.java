package com.aiverse.fabric.unit;

/**
 * Restricted parent classloader for adapter JARs. Exposes only the unit API, contracts, configuration
 * and SLF4J; any other class request throws {@link ClassNotFoundException}, including reflective
 * lookups through {@code Class.forName}.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code jakarta.*}, {@code com.aiverse.fabric.unit.*},
 * {@code com.aiverse.fabric.contracts.*}, {@code com.aiverse.fabric.config.*}, {@code org.slf4j.*}
 * <p>
 * <b>Denied:</b> worker, features, ledger, signals, mcop and every other internal package.
 */
public final class RestrictedAdapterClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "jakarta.",
            "com.aiverse.fabric.unit.",
            "com.aiverse.fabric.contracts.",
            "com.aiverse.fabric.config.",
            "org.slf4j."
    };

    private final ClassLoader kernelLoader;

    public RestrictedAdapterClassLoader() {
        this(PortProvider.class.getClassLoader());
    }

    RestrictedAdapterClassLoader(ClassLoader kernelLoader) {
        super(null);
        this.kernelLoader = kernelLoader;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = kernelLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (adapters may only use java.*, javax.*, jakarta.*, com.aiverse.fabric.unit.*,"
                    + " com.aiverse.fabric.contracts.*, com.aiverse.fabric.config.*, org.slf4j.*)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}

package com.aiverse.fabric.features;

import com.aiverse.fabric.annotations.FabricFeature;
import com.aiverse.fabric.annotations.FeaturePhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Global registry of features. Register instances of classes annotated with {@link FabricFeature};
 * look up by name or resolve the features that apply to a unit invocation.
 */
public final class FeatureRegistry {

    private static final FeatureRegistry INSTANCE = new FeatureRegistry();

    private final Map<String, FeatureEntry> byName = new ConcurrentHashMap<>();
    /** Registration order; resolution preserves it within each phase. */
    private final List<String> order = new CopyOnWriteArrayList<>();

    public static FeatureRegistry getInstance() {
        return INSTANCE;
    }

    private FeatureRegistry() {
    }

    /**
     * Registers a feature instance as <b>INTERNAL</b>. Reads {@link FabricFeature} from the class and stores it by
     * {@link FabricFeature#name()}. The instance must implement the contract(s) for its phase: {@link PreUnitCall},
     * {@link PostSuccessCall}, {@link PostErrorCall}, {@link FinallyCall} or {@link PreFinallyCall}.
     *
     * @throws IllegalArgumentException if the class is not annotated or the name is already registered
     */
    public void register(Object featureInstance) {
        register(featureInstance, FeaturePrivilege.INTERNAL);
    }

    public void register(Object featureInstance, FeaturePrivilege privilege) {
        Objects.requireNonNull(featureInstance, "featureInstance");
        Objects.requireNonNull(privilege, "privilege");
        Class<?> clazz = featureInstance.getClass();
        FabricFeature ann = clazz.getAnnotation(FabricFeature.class);
        if (ann == null) {
            throw new IllegalArgumentException("Feature implementation must be annotated with @FabricFeature: " + clazz.getName());
        }
        String contractVersion = ann.contractVersion() != null && !ann.contractVersion().isBlank() ? ann.contractVersion() : null;
        register(ann.name(), ann.phase(), ann.applicableUnits(), contractVersion, privilege, featureInstance);
    }

    public void registerInternal(Object featureInstance) {
        register(featureInstance, FeaturePrivilege.INTERNAL);
    }

    /** Registers an observer-only feature. If it throws, the runner logs and continues. */
    public void registerCommunity(Object featureInstance) {
        register(featureInstance, FeaturePrivilege.COMMUNITY);
    }

    /**
     * Registers a feature with explicit metadata (e.g. when not using the annotation).
     */
    public void register(String name, FeaturePhase phase, String[] applicableUnits, String contractVersion,
                         FeaturePrivilege privilege, Object featureInstance) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(privilege, "privilege");
        Objects.requireNonNull(featureInstance, "featureInstance");
        if (name.isBlank()) throw new IllegalArgumentException("Feature name must be non-blank");
        FeatureEntry entry = new FeatureEntry(name, phase, applicableUnits, contractVersion, privilege, featureInstance);
        if (byName.putIfAbsent(name, entry) != null) {
            throw new IllegalArgumentException("Feature already registered: " + name);
        }
        order.add(name);
    }

    /** Removes a feature; returns the removed entry or null. */
    public FeatureEntry unregister(String name) {
        if (name == null) return null;
        FeatureEntry removed = byName.remove(name);
        if (removed != null) order.remove(name);
        return removed;
    }

    public FeatureEntry get(String name) {
        return name != null ? byName.get(name) : null;
    }

    /**
     * Resolves the registered features that apply to the given unit, per phase, in registration order.
     */
    public ResolvedFeatures resolve(String unitId, String capabilityType) {
        List<String> pre = new ArrayList<>();
        List<String> postSuccess = new ArrayList<>();
        List<String> postError = new ArrayList<>();
        List<String> fin = new ArrayList<>();
        for (String name : order) {
            FeatureEntry e = byName.get(name);
            if (e == null || !e.appliesTo(unitId, capabilityType)) continue;
            if (e.isPre()) pre.add(name);
            if (e.isPostSuccess()) postSuccess.add(name);
            if (e.isPostError()) postError.add(name);
            if (e.isFinally()) fin.add(name);
        }
        return new ResolvedFeatures(pre, postSuccess, postError, fin);
    }

    /** All entries in registration order. */
    public Map<String, FeatureEntry> getAll() {
        Map<String, FeatureEntry> out = new LinkedHashMap<>();
        for (String name : order) {
            FeatureEntry e = byName.get(name);
            if (e != null) out.put(name, e);
        }
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return byName.size();
    }

    /** Clears all registrations (tests and plugin removal). */
    public void clear() {
        byName.clear();
        order.clear();
    }

    /**
     * Registered feature: metadata plus the implementation instance.
     */
    public static final class FeatureEntry {
        private final String name;
        private final FeaturePhase phase;
        private final String[] applicableUnits;
        private final String contractVersion;
        private final FeaturePrivilege privilege;
        private final Object instance;

        FeatureEntry(String name, FeaturePhase phase, String[] applicableUnits, String contractVersion,
                     FeaturePrivilege privilege, Object instance) {
            this.name = name;
            this.phase = phase != null ? phase : FeaturePhase.PRE_FINALLY;
            this.applicableUnits = applicableUnits != null ? applicableUnits.clone() : new String[0];
            this.contractVersion = contractVersion;
            this.privilege = privilege;
            this.instance = instance;
        }

        public String getName() { return name; }
        public FeaturePhase getPhase() { return phase; }
        /** Contract version (e.g. 1.0); null = unknown. */
        public String getContractVersion() { return contractVersion; }
        public FeaturePrivilege getPrivilege() { return privilege; }
        public boolean isInternal() { return privilege == FeaturePrivilege.INTERNAL; }
        public boolean isCommunity() { return privilege == FeaturePrivilege.COMMUNITY; }
        public Object getInstance() { return instance; }

        public boolean isPre() { return phase == FeaturePhase.PRE || phase == FeaturePhase.PRE_FINALLY; }
        public boolean isPostSuccess() { return phase == FeaturePhase.POST_SUCCESS || phase == FeaturePhase.PRE_FINALLY; }
        public boolean isPostError() { return phase == FeaturePhase.POST_ERROR || phase == FeaturePhase.PRE_FINALLY; }
        public boolean isFinally() { return phase == FeaturePhase.FINALLY || phase == FeaturePhase.PRE_FINALLY; }

        /**
         * True when no patterns are declared, or a pattern is "*", equals the unit id or capability type,
         * or ends with "*" and prefixes either of them.
         */
        public boolean appliesTo(String unitId, String capabilityType) {
            if (applicableUnits.length == 0) return true;
            String u = unitId != null ? unitId : "";
            String c = capabilityType != null ? capabilityType : "";
            for (String raw : applicableUnits) {
                if (raw == null) continue;
                String pattern = raw.trim();
                if ("*".equals(pattern)) return true;
                if (pattern.endsWith("*")) {
                    String prefix = pattern.substring(0, pattern.length() - 1);
                    if (u.startsWith(prefix) || c.startsWith(prefix)) return true;
                } else if (pattern.equals(u) || pattern.equals(c)) {
                    return true;
                }
            }
            return false;
        }
    }
}

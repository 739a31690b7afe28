package com.aiverse.fabric.features;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pre and post feature hooks around one unit invocation.
 * Internal pre hooks propagate their exceptions; community pre hooks and every post hook fail soft.
 */
public final class UnitFeatureRunner {

    private static final Logger log = LoggerFactory.getLogger(UnitFeatureRunner.class);

    private final FeatureRegistry registry;

    public UnitFeatureRunner(FeatureRegistry registry) {
        this.registry = registry;
    }

    public UnitFeatureRunner() {
        this(FeatureRegistry.getInstance());
    }

    public ResolvedFeatures resolve(UnitExecutionContext context) {
        return registry.resolve(context.getUnitId(), context.getCapabilityType());
    }

    public void runPre(ResolvedFeatures resolved, UnitExecutionContext context) {
        for (String name : resolved.getPre()) {
            FeatureRegistry.FeatureEntry e = registry.get(name);
            if (e == null) continue;
            if (!(e.getInstance() instanceof PreUnitCall pre)) continue;
            if (e.isCommunity()) {
                try {
                    pre.before(context);
                } catch (RuntimeException ex) {
                    log.warn("Community pre feature {} failed (observer-only); continuing", name, ex);
                }
            } else {
                pre.before(context);
            }
        }
    }

    public void runPostSuccess(ResolvedFeatures resolved, UnitExecutionContext context, Object unitResult) {
        for (String name : resolved.getPostSuccess()) {
            runPostFeature(name, context, unitResult, PostPhase.SUCCESS);
        }
    }

    public void runPostError(ResolvedFeatures resolved, UnitExecutionContext context, Object unitResult) {
        for (String name : resolved.getPostError()) {
            runPostFeature(name, context, unitResult, PostPhase.ERROR);
        }
    }

    public void runFinally(ResolvedFeatures resolved, UnitExecutionContext context, Object unitResult) {
        for (String name : resolved.getFinally()) {
            runPostFeature(name, context, unitResult, PostPhase.FINALLY);
        }
    }

    private enum PostPhase { SUCCESS, ERROR, FINALLY }

    private void runPostFeature(String name, UnitExecutionContext context, Object unitResult, PostPhase phase) {
        FeatureRegistry.FeatureEntry e = registry.get(name);
        if (e == null) return;
        Object inst = e.getInstance();
        try {
            switch (phase) {
                case SUCCESS -> {
                    if (inst instanceof PreFinallyCall f) {
                        f.afterSuccess(context, unitResult);
                    } else if (inst instanceof PostSuccessCall f) {
                        f.afterSuccess(context, unitResult);
                    } else if (inst instanceof PostUnitCall f) {
                        f.after(context, unitResult);
                    }
                }
                case ERROR -> {
                    if (inst instanceof PreFinallyCall f) {
                        f.afterError(context, unitResult);
                    } else if (inst instanceof PostErrorCall f) {
                        f.afterError(context, unitResult);
                    } else if (inst instanceof PostUnitCall f) {
                        f.after(context, unitResult);
                    }
                }
                case FINALLY -> {
                    if (inst instanceof PreFinallyCall f) {
                        f.afterFinally(context, unitResult);
                    } else if (inst instanceof FinallyCall f) {
                        f.afterFinally(context, unitResult);
                    } else if (inst instanceof PostUnitCall f) {
                        f.after(context, unitResult);
                    }
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Post feature {} failed", name, ex);
        }
    }
}

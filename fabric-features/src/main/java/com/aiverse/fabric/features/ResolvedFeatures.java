package com.aiverse.fabric.features;

import java.util.List;

/**
 * Feature names to run around one unit invocation, per phase, in registration order.
 * <ol>
 *   <li><b>Pre</b>: {@link #getPre()}</li>
 *   <li><b>Unit</b>: the execution unit</li>
 *   <li>On success <b>PostSuccess</b>, on error <b>PostError</b></li>
 *   <li><b>Finally</b>: always, after PostSuccess or PostError</li>
 * </ol>
 */
public final class ResolvedFeatures {

    private final List<String> pre;
    private final List<String> postSuccess;
    private final List<String> postError;
    private final List<String> finallyPhase;

    public ResolvedFeatures(List<String> pre, List<String> postSuccess, List<String> postError, List<String> finallyPhase) {
        this.pre = pre != null ? List.copyOf(pre) : List.of();
        this.postSuccess = postSuccess != null ? List.copyOf(postSuccess) : List.of();
        this.postError = postError != null ? List.copyOf(postError) : List.of();
        this.finallyPhase = finallyPhase != null ? List.copyOf(finallyPhase) : List.of();
    }

    public List<String> getPre() {
        return pre;
    }

    public List<String> getPostSuccess() {
        return postSuccess;
    }

    public List<String> getPostError() {
        return postError;
    }

    public List<String> getFinally() {
        return finallyPhase;
    }

    public boolean isEmpty() {
        return pre.isEmpty() && postSuccess.isEmpty() && postError.isEmpty() && finallyPhase.isEmpty();
    }
}

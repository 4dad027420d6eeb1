package com.phillippitts.multiroomaudio.service.process;

/**
 * Lifecycle of a supervised player process. A name with no entry in the supervisor is absent.
 *
 * <pre>
 * absent -&gt; STARTING -&gt; RUNNING | RUNNING_DEGRADED -&gt; STOPPING -&gt; absent
 * </pre>
 */
public enum ProcessState {
    STARTING,
    RUNNING,
    /** Running from the fallback command instead of the declared device. */
    RUNNING_DEGRADED,
    STOPPING
}

package com.phillippitts.multiroomaudio.service.process;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Portable strategy for platforms without process groups: signals the process and every
 * descendant visible through {@link ProcessHandle}.
 *
 * <p>Descendants are snapshotted before the leader is signalled, since orphaned children are
 * re-parented and would otherwise drop out of the tree.
 */
public final class ProcessTreeStrategy implements ProcessGroupStrategy {

    @Override
    public String name() {
        return "process-tree";
    }

    @Override
    public List<String> prepareCommand(List<String> command) {
        return List.copyOf(command);
    }

    @Override
    public void terminate(Process process) {
        List<ProcessHandle> children = descendantsOf(process);
        process.destroy();
        children.forEach(ProcessHandle::destroy);
    }

    @Override
    public void kill(Process process) {
        List<ProcessHandle> children = descendantsOf(process);
        process.destroyForcibly();
        children.forEach(ProcessHandle::destroyForcibly);
    }

    private static List<ProcessHandle> descendantsOf(Process process) {
        try {
            return process.descendants().collect(Collectors.toList());
        } catch (UnsupportedOperationException e) {
            // Process implementations without a native handle have no visible children
            return List.of();
        }
    }
}
